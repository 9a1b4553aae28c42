package shoal.lex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class TokenTypeTest {

    @Test
    void interning() {
        assertSame(TokenType.of("Name", "Function"), TokenType.of("Name", "Function"));
        assertSame(Tokens.NAME_FUNCTION, TokenType.of("Name").child("Function"));
        assertSame(Tokens.NAME_FUNCTION, TokenType.parse("Token.Name.Function"));
        assertSame(Tokens.NAME_FUNCTION, TokenType.parse("Name.Function"));
    }

    @Test
    void ancestorsAreCreated() {
        var deep = TokenType.of("Custom", "Inner", "Leaf");
        assertSame(TokenType.of("Custom", "Inner"), deep.parent());
        assertSame(TokenType.of("Custom"), deep.parent().parent());
        assertSame(TokenType.ROOT, deep.parent().parent().parent());
        assertTrue(TokenType.of("Custom").subtypes().contains(TokenType.of("Custom", "Inner")));
        assertEquals(3, deep.depth());
        assertEquals("Leaf", deep.name());
    }

    @Test
    void root() {
        assertTrue(TokenType.ROOT.isRoot());
        assertNull(TokenType.ROOT.parent());
        assertEquals(List.of(), TokenType.ROOT.segments());
        assertEquals("Token", TokenType.ROOT.toString());
        assertSame(TokenType.ROOT, TokenType.parse(""));
        assertSame(TokenType.ROOT, TokenType.parse("Token"));
        assertSame(TokenType.ROOT, TokenType.of());
    }

    @Test
    void subtypes() {
        assertTrue(Tokens.NAME_FUNCTION.isSubtypeOf(Tokens.NAME));
        assertTrue(Tokens.NAME_FUNCTION_MAGIC.isSubtypeOf(Tokens.NAME));
        assertTrue(Tokens.NAME.isSubtypeOf(Tokens.NAME));
        assertTrue(Tokens.KEYWORD.isSubtypeOf(TokenType.ROOT));
        assertTrue(TokenType.ROOT.isSubtypeOf(TokenType.ROOT));
        assertFalse(Tokens.NAME.isSubtypeOf(Tokens.NAME_FUNCTION));
        assertFalse(TokenType.ROOT.isSubtypeOf(Tokens.NAME));
        assertFalse(Tokens.KEYWORD.isSubtypeOf(Tokens.NAME));
    }

    @Test
    void subtypeGoesBySegmentNotPrefixText() {
        var names = TokenType.of("Names");
        assertFalse(names.isSubtypeOf(Tokens.NAME));
    }

    @Test
    void printsDottedPath() {
        assertEquals("Token.Literal.String.Double", Tokens.STRING_DOUBLE.toString());
        assertEquals("Double", Tokens.STRING_DOUBLE.name());
    }

    @Test
    void rejectsBadSegments() {
        assertThrows(IllegalArgumentException.class, () -> TokenType.of("Name", ""));
        assertThrows(IllegalArgumentException.class, () -> TokenType.of("Name.Function"));
        assertThrows(IllegalArgumentException.class, () -> TokenType.parse("Name..Function"));
    }
}
