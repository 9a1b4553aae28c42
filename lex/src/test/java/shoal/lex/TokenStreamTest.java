package shoal.lex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static shoal.lex.RawRule.rule;
import static shoal.lex.Tokens.NAME;
import static shoal.lex.Tokens.NUMBER_INTEGER;
import static shoal.lex.Tokens.PUNCTUATION;
import static shoal.lex.Tokens.WHITESPACE;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    static final Grammar GRAMMAR = Grammar.builder("test")
        .state("root",
            rule("[a-z]+", NAME),
            rule("\\d+", NUMBER_INTEGER),
            rule(";", PUNCTUATION),
            rule("\\s+", WHITESPACE))
        .build();

    TokenStream stream;

    boolean includeHidden;

    private void assertNextToken(Token expect) {
        if (includeHidden) {
            assertEquals(false, stream.isAtEnd(true));
            assertEquals(expect, stream.peek(true));
            assertEquals(expect, stream.advance(true));
        } else {
            assertEquals(false, stream.isAtEnd());
            assertEquals(expect, stream.peek());
            assertEquals(expect, stream.advance());
        }
        assertEquals(expect, stream.previous());
    }

    private void assertAtEnd(Token last) {
        assertTrue(stream.isAtEnd(includeHidden));
        assertNull(stream.peek(includeHidden));
        assertNull(stream.advance(includeHidden));
        assertEquals(last, stream.previous());
    }

    @BeforeEach
    void setUp() {
        var source = "hello;\nworld;42\n";
        stream = TokenStream.of(GRAMMAR.compile().tokenize(source));
        includeHidden = false;
    }

    @Test
    void hidden() {
        includeHidden = true;
        assertNextToken(new Token(0, NAME, "hello"));
        assertNextToken(new Token(5, PUNCTUATION, ";"));
        assertNextToken(new Token(6, WHITESPACE, "\n"));
        assertNextToken(new Token(7, NAME, "world"));
        assertNextToken(new Token(12, PUNCTUATION, ";"));
        assertNextToken(new Token(13, NUMBER_INTEGER, "42"));
        assertNextToken(new Token(15, WHITESPACE, "\n"));
        assertAtEnd(new Token(15, WHITESPACE, "\n"));
    }

    @Test
    void visible() {
        includeHidden = false;
        assertNextToken(new Token(0, NAME, "hello"));
        assertNextToken(new Token(5, PUNCTUATION, ";"));
        assertNextToken(new Token(7, NAME, "world"));
        assertNextToken(new Token(12, PUNCTUATION, ";"));
        assertNextToken(new Token(13, NUMBER_INTEGER, "42"));
        assertAtEnd(new Token(13, NUMBER_INTEGER, "42"));
    }

    @Test
    void previousBeforeFirstAdvance() {
        assertEquals(new Token(0, NAME, "hello"), stream.previous());
    }

    @Test
    void mixed() {
        assertNextToken(new Token(0, NAME, "hello"));
        assertNextToken(new Token(5, PUNCTUATION, ";"));
        includeHidden = true;
        assertNextToken(new Token(6, WHITESPACE, "\n"));
        includeHidden = false;
        assertNextToken(new Token(7, NAME, "world"));
    }

    @Test
    void customHiddenPredicate() {
        stream = new TokenStream(GRAMMAR.compile().tokenize("a;b"), token -> token.is(PUNCTUATION));
        assertNextToken(new Token(0, NAME, "a"));
        assertNextToken(new Token(2, NAME, "b"));
        assertAtEnd(new Token(2, NAME, "b"));
    }
}
