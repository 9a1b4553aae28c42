package shoal.lex.grammars;

import static shoal.lex.RawRule.rule;
import static shoal.lex.Tokens.TEXT;

import shoal.lex.Grammar;
import shoal.lex.Lexer;

/**
 * Plain text: the whole input as one {@code Text} token.
 */
public final class TextGrammar {

    private TextGrammar() {
    }

    public static final Grammar GRAMMAR = Grammar.builder("text")
        .state("root",
            rule("(?s).+", TEXT))
        .build();

    public static Lexer lexer() {
        return Lexer.builder()
            .name("Text only")
            .alias("text")
            .filename("*.txt")
            .mimeType("text/plain")
            .grammar(GRAMMAR)
            .confidence(text -> 0.01)
            .build();
    }
}
