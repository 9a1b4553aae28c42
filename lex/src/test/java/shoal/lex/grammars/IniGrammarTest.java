package shoal.lex.grammars;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static shoal.lex.Tokens.COMMENT_SINGLE;
import static shoal.lex.Tokens.KEYWORD;
import static shoal.lex.Tokens.NAME_ATTRIBUTE;
import static shoal.lex.Tokens.OPERATOR;
import static shoal.lex.Tokens.PUNCTUATION;
import static shoal.lex.Tokens.STRING;
import static shoal.lex.Tokens.STRING_ESCAPE;
import static shoal.lex.Tokens.WHITESPACE;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import shoal.lex.Token;

public class IniGrammarTest {

    private static List<Token> lex(String text) {
        var tokens = new ArrayList<Token>();
        IniGrammar.GRAMMAR.compile().tokenize(text).forEachRemaining(tokens::add);
        return tokens;
    }

    @Test
    void sectionsKeysAndComments() {
        assertEquals(List.of(
            new Token(0, PUNCTUATION, "["),
            new Token(1, KEYWORD, "core"),
            new Token(5, PUNCTUATION, "]"),
            new Token(6, WHITESPACE, "\n"),
            new Token(7, NAME_ATTRIBUTE, "name"),
            new Token(11, WHITESPACE, " "),
            new Token(12, OPERATOR, "="),
            new Token(13, WHITESPACE, " "),
            new Token(14, STRING, "shoal ; x"),
            new Token(23, WHITESPACE, "\n"),
            new Token(24, NAME_ATTRIBUTE, "path"),
            new Token(28, OPERATOR, "="),
            new Token(29, STRING, "a"),
            new Token(30, STRING_ESCAPE, "\\"),
            new Token(31, WHITESPACE, "\n"),
            new Token(32, STRING, "  b"),
            new Token(35, WHITESPACE, "\n"),
            new Token(36, COMMENT_SINGLE, "# c"),
            new Token(39, WHITESPACE, "\n")),
            lex("[core]\nname = shoal ; x\npath=a\\\n  b\n# c\n"));
    }

    @Test
    void lineWithoutSeparator() {
        assertEquals(List.of(
            new Token(0, NAME_ATTRIBUTE, "flag"),
            new Token(4, WHITESPACE, "\n")),
            lex("flag\n"));
    }

    @Test
    void estimate() {
        assertEquals(1.0, IniGrammar.estimate("[core]\nname = x\n"));
        assertEquals(0.0, IniGrammar.estimate("name = x\n"));
        assertEquals(0.0, IniGrammar.estimate("[]\n"));
    }
}
