package shoal.lex;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.java.Log;

/**
 * A named lexer: a grammar plus the input normalization applied before the
 * grammar sees the text.
 *
 * <p>The grammar is compiled when the lexer is built, so an invalid grammar
 * fails here and never while lexing. Lexers are immutable and may be shared
 * between threads.
 */
@Log
@Getter
public final class Lexer {

    private final String name;
    private final List<String> aliases;
    /** File name globs, e.g. {@code *.json}. */
    private final List<String> filenames;
    private final List<String> mimeTypes;
    private final Grammar grammar;
    private final LexerOptions options;
    private final ConfidenceEstimator confidence;

    @Getter(AccessLevel.NONE)
    private final CompiledGrammar compiled;

    @Builder(toBuilder = true)
    private Lexer(
            @NonNull String name,
            @Singular List<String> aliases,
            @Singular List<String> filenames,
            @Singular List<String> mimeTypes,
            @NonNull Grammar grammar,
            LexerOptions options,
            ConfidenceEstimator confidence) {
        this.name = name;
        this.aliases = List.copyOf(aliases);
        this.filenames = List.copyOf(filenames);
        this.mimeTypes = List.copyOf(mimeTypes);
        this.grammar = grammar;
        this.options = options != null ? options.validate() : LexerOptions.defaults();
        this.confidence = confidence != null ? confidence : ConfidenceEstimator.NONE;
        this.compiled = grammar.compile();
    }

    public Lexer withOptions(@NonNull LexerOptions options) {
        return toBuilder().options(options).build();
    }

    /** Lexes {@code text} lazily after normalizing it. */
    public Iterator<Token> getTokens(@NonNull String text) {
        return compiled.tokenize(normalize(text));
    }

    /** Decodes {@code bytes} with the configured encoding, then lexes them. */
    public Iterator<Token> getTokens(@NonNull byte[] bytes) {
        return getTokens(decode(bytes));
    }

    public Stream<Token> stream(@NonNull String text) {
        return compiled.stream(normalize(text));
    }

    public List<Token> tokenList(@NonNull String text) {
        var tokens = new ArrayList<Token>();
        getTokens(text).forEachRemaining(tokens::add);
        return tokens;
    }

    /**
     * How confident this lexer is that {@code text} is in its language,
     * clamped to [0, 1].
     */
    public double estimateConfidence(@NonNull String text) {
        var estimate = confidence.estimate(text);
        if (Double.isNaN(estimate) || estimate <= 0.0) {
            return 0.0;
        }
        return Math.min(estimate, 1.0);
    }

    /**
     * The text token offsets refer to: line endings unified, then stripped,
     * tab-expanded and newline-terminated as configured.
     */
    public String normalize(@NonNull String text) {
        text = text.replace("\r\n", "\n").replace('\r', '\n');

        if (options.isStripAll()) {
            text = text.strip();
        } else if (options.isStripNewlines()) {
            text = stripNewlines(text);
        }

        if (options.getTabSize() > 0) {
            text = expandTabs(text, options.getTabSize());
        }

        if (options.isEnsureNewline() && !text.endsWith("\n")) {
            text += "\n";
        }
        return text;
    }

    /**
     * Decodes byte input. Guessing tries strict UTF-8 and falls back to
     * ISO-8859-1, which accepts any byte sequence. A leading byte order mark
     * is dropped.
     */
    public String decode(@NonNull byte[] bytes) {
        var charset = options.charset();
        String text;
        if (charset != null) {
            text = new String(bytes, charset);
        } else {
            try {
                text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            } catch (CharacterCodingException ex) {
                log.fine(() -> name + ": input is not UTF-8, decoding as ISO-8859-1");
                text = new String(bytes, StandardCharsets.ISO_8859_1);
            }
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }

    private static String stripNewlines(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '\n') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '\n') {
            end--;
        }
        return text.substring(start, end);
    }

    private static String expandTabs(String text, int tabSize) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        var sb = new StringBuilder(text.length() + 16);
        int column = 0;
        for (int i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            if (c == '\t') {
                var spaces = tabSize - column % tabSize;
                sb.append(" ".repeat(spaces));
                column += spaces;
            } else {
                sb.append(c);
                column = c == '\n' ? 0 : column + 1;
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Lexer(" + name + ")";
    }
}
