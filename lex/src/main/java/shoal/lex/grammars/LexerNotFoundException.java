package shoal.lex.grammars;

public class LexerNotFoundException extends RuntimeException {

    public LexerNotFoundException(String message) {
        super(message);
    }
}
