package shoal.lex;

import lombok.Getter;

@Getter
public class UnknownStateException extends GrammarException {

    private final String state;

    /** The state holding the offending rule, or {@code null} for the missing root. */
    private final String referencingState;

    private final int ruleIndex;

    UnknownStateException(String state, String referencingState, int ruleIndex) {
        super("unknown state '" + state + "' referenced by state '" + referencingState + "', rule " + ruleIndex);
        this.state = state;
        this.referencingState = referencingState;
        this.ruleIndex = ruleIndex;
    }

    private UnknownStateException(String grammar, String state) {
        super("grammar '" + grammar + "' has no '" + state + "' state");
        this.state = state;
        this.referencingState = null;
        this.ruleIndex = -1;
    }

    static UnknownStateException missingRoot(String grammar) {
        return new UnknownStateException(grammar, Grammar.ROOT_STATE);
    }
}
