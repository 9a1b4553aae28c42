package shoal.tool;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import java.util.logging.Level;

import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;
import shoal.lex.Lexer;
import shoal.lex.LexerOptions;
import shoal.lex.OptionException;
import shoal.lex.Token;
import shoal.lex.TokenStream;
import shoal.lex.Tokens;
import shoal.lex.grammars.LexerNotFoundException;
import shoal.lex.grammars.LexerRegistry;

/**
 * Prints the token stream of a file, of standard input, or of lines typed at
 * a prompt.
 *
 * <pre>
 * usage: shoal [-l lexer] [-O key=value,...] [-H] [file|-]
 * </pre>
 */
@Log
@RequiredArgsConstructor
public class Shoal {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 64;

    private static final String USAGE = "Usage: shoal [-l lexer] [-O key=value,...] [-H] [file|-]";

    private final LexerRegistry registry;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        var shoal = new Shoal(LexerRegistry.standard(), System.in, System.out, System.err);
        System.exit(shoal.run(args));
    }

    private static class Flags {
        String lexer = null;
        Map<String, String> options = new LinkedHashMap<>();
        boolean skipHidden = false;
        String path = null;
    }

    int run(String... args) {
        var flags = new Flags();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (("-l".equals(arg) || "-O".equals(arg)) && i + 1 >= args.length) {
                return usage("missing value for " + arg);
            }
            if ("-l".equals(arg)) {
                flags.lexer = args[++i];
            } else if ("-O".equals(arg)) {
                for (var option : args[++i].split(",")) {
                    var kv = option.split("=", 2);
                    if (kv.length != 2 || kv[0].isBlank()) {
                        return usage("malformed option '" + option + "'");
                    }
                    flags.options.put(kv[0].trim(), kv[1].trim());
                }
            } else if ("-H".equals(arg)) {
                flags.skipHidden = true;
            } else if (flags.path == null && (!arg.startsWith("-") || "-".equals(arg))) {
                flags.path = arg;
            } else {
                return usage("unexpected argument '" + arg + "'");
            }
        }

        LexerOptions options;
        try {
            options = LexerOptions.fromMap(flags.options);
        } catch (OptionException ex) {
            return usage(ex.getMessage());
        }

        try {
            if (flags.path == null) {
                return runPrompt(flags, options);
            }
            return runFile(flags, options);
        } catch (LexerNotFoundException ex) {
            log.severe(ex.getMessage());
            err.println("shoal: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            log.log(Level.SEVERE, "cannot read input", ex);
            err.println("shoal: cannot read input: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int usage(String problem) {
        err.println("shoal: " + problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private int runFile(Flags flags, LexerOptions options) throws IOException {
        byte[] bytes;
        try {
            if ("-".equals(flags.path)) {
                bytes = in.readAllBytes();
            } else {
                bytes = Files.readAllBytes(Paths.get(flags.path));
            }
        } catch (NoSuchFileException ex) {
            log.severe("no such file: " + flags.path);
            err.println("shoal: no such file: " + flags.path);
            return EXIT_FAILURE;
        } catch (IOException ex) {
            log.log(Level.SEVERE, "cannot read " + flags.path, ex);
            err.println("shoal: cannot read " + flags.path + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }

        Lexer lexer;
        if (flags.lexer != null) {
            lexer = registry.byName(flags.lexer);
        } else {
            var text = new String(bytes, StandardCharsets.UTF_8);
            lexer = registry.findByFilename(flags.path, text)
                .or(() -> registry.guess(text))
                .orElseThrow(() -> new LexerNotFoundException("cannot guess a lexer for " + flags.path));
        }
        lexer = lexer.withOptions(options);

        var stream = new TokenStream(lexer.getTokens(bytes), hidden(flags));
        while (!stream.isAtEnd()) {
            print(stream.advance());
        }
        return EXIT_OK;
    }

    private int runPrompt(Flags flags, LexerOptions options) throws IOException {
        var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        var lexer = registry.byName(flags.lexer != null ? flags.lexer : "text").withOptions(options);

        for (;;) {
            out.print(lexer.getName() + "> ");
            var line = reader.readLine();

            if (line == null || ":q".equals(line)) {
                break;
            } else if (line.startsWith(":lexer")) {
                var arg = line.substring(6).trim();
                if (!arg.isBlank()) {
                    var found = registry.findByName(arg);
                    if (found.isPresent()) {
                        lexer = found.get().withOptions(options);
                    } else {
                        err.println("shoal: no lexer for alias '" + arg + "'");
                    }
                }
                out.println("lexer: " + lexer.getName());
            } else if (!line.isEmpty()) {
                var stream = new TokenStream(lexer.getTokens(line), hidden(flags));
                while (!stream.isAtEnd()) {
                    print(stream.advance());
                }
            }
        }
        return EXIT_OK;
    }

    private static Predicate<Token> hidden(Flags flags) {
        return flags.skipHidden ? TokenStream.WHITESPACE : token -> false;
    }

    private void print(Token token) {
        var type = token.type();
        var shortName = Tokens.shortName(type);
        out.println(token.offset() + "\t" + type + (shortName.isEmpty() ? "" : " [" + shortName + "]")
            + "\t" + token.quotedValue());
    }
}
