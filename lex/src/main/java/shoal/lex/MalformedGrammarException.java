package shoal.lex;

public class MalformedGrammarException extends GrammarException {

    public MalformedGrammarException(String message) {
        super(message);
    }

    public MalformedGrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
