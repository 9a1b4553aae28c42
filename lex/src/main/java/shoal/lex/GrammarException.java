package shoal.lex;

/**
 * Raised when a grammar cannot be compiled. Always thrown before any text is
 * lexed with the grammar.
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
