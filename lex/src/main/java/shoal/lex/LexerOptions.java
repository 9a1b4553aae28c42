package shoal.lex;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Input normalization settings of a {@link Lexer}.
 */
@Value
@Builder(toBuilder = true)
public class LexerOptions {

    /** Decode byte input as UTF-8, or as ISO-8859-1 if it is not valid UTF-8. */
    public static final String GUESS_ENCODING = "guess";

    private static final LexerOptions DEFAULTS = builder().build();

    /** Strip leading and trailing newlines. */
    @Builder.Default
    boolean stripNewlines = true;

    /** Strip all leading and trailing whitespace; wins over {@link #stripNewlines}. */
    @Builder.Default
    boolean stripAll = false;

    /** Make sure the text ends with a newline. */
    @Builder.Default
    boolean ensureNewline = true;

    /** Expand tabs to this width; 0 keeps them. */
    @Builder.Default
    int tabSize = 0;

    /** Charset name for byte input, or {@value #GUESS_ENCODING}. */
    @Builder.Default
    @NonNull
    String encoding = GUESS_ENCODING;

    public static LexerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from string values keyed {@code stripnl}, {@code stripall},
     * {@code ensurenl}, {@code tabsize} and {@code encoding}. Missing keys keep
     * their defaults, unknown keys are ignored.
     *
     * @throws OptionException if a value cannot be parsed
     */
    public static LexerOptions fromMap(@NonNull Map<String, String> options) {
        var builder = builder();
        if (options.containsKey("stripnl")) {
            builder.stripNewlines(booleanOption("stripnl", options.get("stripnl")));
        }
        if (options.containsKey("stripall")) {
            builder.stripAll(booleanOption("stripall", options.get("stripall")));
        }
        if (options.containsKey("ensurenl")) {
            builder.ensureNewline(booleanOption("ensurenl", options.get("ensurenl")));
        }
        if (options.containsKey("tabsize")) {
            builder.tabSize(intOption("tabsize", options.get("tabsize")));
        }
        if (options.containsKey("encoding")) {
            builder.encoding(encodingOption("encoding", options.get("encoding")));
        }
        return builder.build().validate();
    }

    /**
     * @throws OptionException if the tab size is negative or the encoding unknown
     */
    public LexerOptions validate() {
        if (tabSize < 0) {
            throw new OptionException("tabsize", "must not be negative, got " + tabSize);
        }
        encodingOption("encoding", encoding);
        return this;
    }

    /** The charset for byte input, or {@code null} when guessing. */
    Charset charset() {
        if (GUESS_ENCODING.equalsIgnoreCase(encoding)) {
            return null;
        }
        return Charset.forName(encoding);
    }

    private static boolean booleanOption(String option, String value) {
        if (value == null) {
            throw new OptionException(option, "missing value");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "1":
        case "yes":
        case "true":
        case "on":
            return true;
        case "0":
        case "no":
        case "false":
        case "off":
            return false;
        default:
            throw new OptionException(option, "expected a boolean, got '" + value + "'");
        }
    }

    private static int intOption(String option, String value) {
        if (value == null) {
            throw new OptionException(option, "missing value");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new OptionException(option, "expected an integer, got '" + value + "'", ex);
        }
    }

    private static String encodingOption(String option, String value) {
        if (value == null || value.isBlank()) {
            throw new OptionException(option, "missing value");
        }
        if (GUESS_ENCODING.equalsIgnoreCase(value)) {
            return value;
        }
        try {
            if (!Charset.isSupported(value)) {
                throw new OptionException(option, "unsupported charset '" + value + "'");
            }
        } catch (IllegalCharsetNameException ex) {
            throw new OptionException(option, "illegal charset name '" + value + "'", ex);
        }
        return value;
    }
}
