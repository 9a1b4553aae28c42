package shoal.lex.grammars;

import static shoal.lex.Action.byGroups;
import static shoal.lex.RawRule.include;
import static shoal.lex.RawRule.rule;
import static shoal.lex.Tokens.KEYWORD_CONSTANT;
import static shoal.lex.Tokens.NAME_TAG;
import static shoal.lex.Tokens.NUMBER_FLOAT;
import static shoal.lex.Tokens.NUMBER_INTEGER;
import static shoal.lex.Tokens.PUNCTUATION;
import static shoal.lex.Tokens.STRING_DOUBLE;
import static shoal.lex.Tokens.WHITESPACE;

import java.util.regex.Pattern;

import shoal.lex.Grammar;
import shoal.lex.Lexer;
import shoal.lex.Tokens;

/**
 * JSON documents. Object keys are told apart from string values; anything
 * that is not JSON comes out as {@code Error} tokens.
 */
public final class JsonGrammar {

    private JsonGrammar() {
    }

    private static final String STRING = "\"[^\"\\\\\\n]*+(?:\\\\.[^\"\\\\\\n]*+)*+\"";

    public static final Grammar GRAMMAR = Grammar.builder("json")
        .state("whitespace",
            rule("\\s+", WHITESPACE))
        .state("value",
            rule(STRING, STRING_DOUBLE),
            rule("-?(?:0|[1-9]\\d*)(?:\\.\\d+(?:[eE][+-]?\\d+)?|[eE][+-]?\\d+)", NUMBER_FLOAT),
            rule("-?(?:0|[1-9]\\d*)", NUMBER_INTEGER),
            rule("(?:true|false|null)\\b", KEYWORD_CONSTANT),
            rule("\\{", PUNCTUATION, "object"),
            rule("\\[", PUNCTUATION, "array"))
        .state("object",
            include("whitespace"),
            rule("(" + STRING + ")(\\s*)(:)", byGroups(NAME_TAG, WHITESPACE, PUNCTUATION)),
            rule(",", PUNCTUATION),
            rule("\\}", PUNCTUATION, "#pop"),
            include("value"))
        .state("array",
            include("whitespace"),
            rule(",", PUNCTUATION),
            rule("\\]", PUNCTUATION, "#pop"),
            include("value"))
        .state("root",
            include("whitespace"),
            include("value"))
        .build();

    private static final Pattern DOCUMENT = Pattern.compile("^\\s*[\\[{].*[\\]}]\\s*$", Pattern.DOTALL);

    /** Bracketed input that lexes without errors is very likely JSON. */
    static double estimate(String text) {
        if (!DOCUMENT.matcher(text).matches()) {
            return 0.0;
        }
        var clean = GRAMMAR.compile().stream(text).noneMatch(token -> token.is(Tokens.ERROR));
        return clean ? 0.8 : 0.2;
    }

    public static Lexer lexer() {
        return Lexer.builder()
            .name("JSON")
            .alias("json")
            .filename("*.json")
            .mimeType("application/json")
            .grammar(GRAMMAR)
            .confidence(JsonGrammar::estimate)
            .build();
    }
}
