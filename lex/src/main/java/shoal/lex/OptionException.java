package shoal.lex;

import lombok.Getter;

/**
 * Raised for a lexer option value that cannot be used.
 */
@Getter
public class OptionException extends RuntimeException {

    private final String option;

    public OptionException(String option, String message) {
        super("option '" + option + "': " + message);
        this.option = option;
    }

    public OptionException(String option, String message, Throwable cause) {
        super("option '" + option + "': " + message, cause);
        this.option = option;
    }
}
