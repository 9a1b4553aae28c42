package shoal.lex.grammars;

import static shoal.lex.Action.using;
import static shoal.lex.RawRule.rule;
import static shoal.lex.Tokens.GENERIC_OUTPUT;
import static shoal.lex.Tokens.GENERIC_PROMPT;
import static shoal.lex.Tokens.GENERIC_TRACEBACK;
import static shoal.lex.Tokens.TEXT;

import shoal.lex.Grammar;
import shoal.lex.Lexer;

/**
 * Interactive Python sessions. Input after a {@code >>>} or {@code ...}
 * prompt is lexed as Python, other lines are output.
 */
public final class PythonConsoleGrammar {

    private PythonConsoleGrammar() {
    }

    public static final Grammar GRAMMAR = Grammar.builder("pycon")
        .state("root",
            rule("^(?:>>>|\\.\\.\\.)(?: |$)", GENERIC_PROMPT),
            rule("(?<=^>>> |^\\.\\.\\. ).*\\n?", using(PythonGrammar.GRAMMAR).wrappedIn(TEXT)),
            rule("^Traceback \\(most recent call last\\):\\n(?:[ \\t][^\\n]*+\\n)*+.*\\n?", GENERIC_TRACEBACK),
            rule(".*\\n?", GENERIC_OUTPUT))
        .build();

    static double estimate(String text) {
        return text.startsWith(">>> ") ? 0.9 : 0.0;
    }

    public static Lexer lexer() {
        return Lexer.builder()
            .name("Python console session")
            .alias("pycon")
            .mimeType("text/x-python-doctest")
            .grammar(GRAMMAR)
            .confidence(PythonConsoleGrammar::estimate)
            .build();
    }
}
