package shoal.lex.grammars;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.NonNull;
import lombok.extern.java.Log;
import shoal.lex.Lexer;

/**
 * Finds lexers by name, alias, file name or content.
 */
@Log
public final class LexerRegistry {

    private final List<Lexer> lexers = new CopyOnWriteArrayList<>();

    /** A registry holding the bundled lexers. */
    public static LexerRegistry standard() {
        var registry = new LexerRegistry();
        registry.register(TextGrammar.lexer());
        registry.register(JsonGrammar.lexer());
        registry.register(IniGrammar.lexer());
        registry.register(PythonGrammar.lexer());
        registry.register(PythonConsoleGrammar.lexer());
        return registry;
    }

    public LexerRegistry register(@NonNull Lexer lexer) {
        lexers.add(lexer);
        log.fine(() -> "registered lexer " + lexer.getName() + " " + lexer.getAliases());
        return this;
    }

    public List<Lexer> all() {
        return List.copyOf(lexers);
    }

    /** Looks a lexer up by alias or name, ignoring case. */
    public Optional<Lexer> findByName(@NonNull String name) {
        var wanted = name.toLowerCase(Locale.ROOT);
        for (var lexer : lexers) {
            if (lexer.getName().toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(lexer);
            }
            for (var alias : lexer.getAliases()) {
                if (alias.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return Optional.of(lexer);
                }
            }
        }
        return Optional.empty();
    }

    public Lexer byName(@NonNull String name) {
        return findByName(name)
            .orElseThrow(() -> new LexerNotFoundException("no lexer for alias '" + name + "'"));
    }

    /**
     * Looks a lexer up by matching the file name part of {@code filename}
     * against each lexer's globs. When several match, the one most confident
     * about {@code content} wins; without content the first registered does.
     */
    public Optional<Lexer> findByFilename(@NonNull String filename, String content) {
        Path name;
        try {
            name = Path.of(filename).getFileName();
        } catch (InvalidPathException ex) {
            log.fine(() -> "not a valid path: " + filename);
            return Optional.empty();
        }
        if (name == null) {
            return Optional.empty();
        }

        var fs = FileSystems.getDefault();
        var matches = lexers.stream()
            .filter(lexer -> lexer.getFilenames().stream()
                .anyMatch(glob -> fs.getPathMatcher("glob:" + glob).matches(name)))
            .toList();
        if (matches.isEmpty() || content == null) {
            return matches.stream().findFirst();
        }
        return matches.stream()
            .max(Comparator.comparingDouble(lexer -> lexer.estimateConfidence(content)));
    }

    public Lexer byFilename(@NonNull String filename) {
        return findByFilename(filename, null)
            .orElseThrow(() -> new LexerNotFoundException("no lexer for filename '" + filename + "'"));
    }

    /**
     * The lexer most confident about {@code text}. Ties go to the lexer
     * registered first; if nobody is confident at all, the result is empty.
     */
    public Optional<Lexer> guess(@NonNull String text) {
        Lexer best = null;
        var bestScore = 0.0;
        for (var lexer : lexers) {
            var score = lexer.estimateConfidence(text);
            if (score > bestScore) {
                best = lexer;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }
}
