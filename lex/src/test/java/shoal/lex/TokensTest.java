package shoal.lex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TokensTest {

    @Test
    void standardShortNames() {
        assertEquals("", Tokens.shortName(Tokens.TOKEN));
        assertEquals("k", Tokens.shortName(Tokens.KEYWORD));
        assertEquals("kc", Tokens.shortName(Tokens.KEYWORD_CONSTANT));
        assertEquals("nf", Tokens.shortName(Tokens.NAME_FUNCTION));
        assertEquals("s2", Tokens.shortName(Tokens.STRING_DOUBLE));
        assertEquals("err", Tokens.shortName(Tokens.ERROR));
        assertEquals("w", Tokens.shortName(Tokens.WHITESPACE));
    }

    @Test
    void nonStandardTypesExtendTheirAncestor() {
        assertEquals("nf-Lambda", Tokens.shortName(Tokens.NAME_FUNCTION.child("Lambda")));
        assertEquals("k-Extra-Deep", Tokens.shortName(TokenType.of("Keyword", "Extra", "Deep")));
    }

    @Test
    void isStandard() {
        assertTrue(Tokens.isStandard(Tokens.GENERIC_PROMPT));
        assertFalse(Tokens.isStandard(Tokens.NAME_FUNCTION.child("Lambda")));
    }
}
