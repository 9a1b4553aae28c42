package shoal.lex;

import java.util.regex.PatternSyntaxException;

import lombok.Getter;

@Getter
public class InvalidPatternException extends GrammarException {

    private final String pattern;
    private final String state;
    private final int ruleIndex;

    InvalidPatternException(String pattern, String state, int ruleIndex, PatternSyntaxException cause) {
        super("invalid pattern '" + pattern + "' in state '" + state + "', rule " + ruleIndex
            + ": " + cause.getDescription(), cause);
        this.pattern = pattern;
        this.state = state;
        this.ruleIndex = ruleIndex;
    }
}
