package shoal.lex.grammars;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static shoal.lex.Tokens.GENERIC_OUTPUT;
import static shoal.lex.Tokens.GENERIC_PROMPT;
import static shoal.lex.Tokens.GENERIC_TRACEBACK;
import static shoal.lex.Tokens.NAME;
import static shoal.lex.Tokens.NUMBER_INTEGER;
import static shoal.lex.Tokens.OPERATOR;
import static shoal.lex.Tokens.WHITESPACE;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import shoal.lex.Token;

public class PythonConsoleGrammarTest {

    private static List<Token> lex(String text) {
        var tokens = new ArrayList<Token>();
        PythonConsoleGrammar.GRAMMAR.compile().tokenize(text).forEachRemaining(tokens::add);
        return tokens;
    }

    @Test
    void inputIsLexedAsPython() {
        assertEquals(List.of(
            new Token(0, GENERIC_PROMPT, ">>> "),
            new Token(4, NAME, "x"),
            new Token(5, WHITESPACE, " "),
            new Token(6, OPERATOR, "="),
            new Token(7, WHITESPACE, " "),
            new Token(8, NUMBER_INTEGER, "1"),
            new Token(9, WHITESPACE, "\n"),
            new Token(10, GENERIC_OUTPUT, "2\n")),
            lex(">>> x = 1\n2\n"));
    }

    @Test
    void traceback() {
        var text = ">>> f()\nTraceback (most recent call last):\n  File \"<stdin>\", line 1\nNameError: f\n";
        var tokens = lex(text);
        var traceback = tokens.get(tokens.size() - 1);
        assertEquals(GENERIC_TRACEBACK, traceback.type());
        assertEquals(text.substring(text.indexOf("Traceback")), traceback.value());
    }

    @Test
    void longTraceback() {
        var traceback = "Traceback (most recent call last):\n"
            + "  File \"<stdin>\", line 1, in f\n".repeat(10000)
            + "RecursionError: maximum recursion depth exceeded\n";
        var tokens = lex(">>> f()\n" + traceback);

        var last = tokens.get(tokens.size() - 1);
        assertEquals(GENERIC_TRACEBACK, last.type());
        assertEquals(traceback, last.value());
    }

    @Test
    void estimate() {
        assertEquals(0.9, PythonConsoleGrammar.estimate(">>> 1 + 1\n2\n"));
        assertEquals(0.0, PythonConsoleGrammar.estimate("1 + 1\n"));
    }
}
