package shoal.lex.grammars;

import static shoal.lex.Action.byGroups;
import static shoal.lex.RawRule.defaultTo;
import static shoal.lex.RawRule.rule;
import static shoal.lex.Tokens.COMMENT_SINGLE;
import static shoal.lex.Tokens.KEYWORD;
import static shoal.lex.Tokens.NAME_ATTRIBUTE;
import static shoal.lex.Tokens.OPERATOR;
import static shoal.lex.Tokens.PUNCTUATION;
import static shoal.lex.Tokens.STRING;
import static shoal.lex.Tokens.STRING_ESCAPE;
import static shoal.lex.Tokens.WHITESPACE;

import shoal.lex.Grammar;
import shoal.lex.Lexer;

/**
 * INI and similar configuration files: sections, {@code key = value} pairs,
 * {@code ;} and {@code #} comments, and values continued with a trailing
 * backslash.
 */
public final class IniGrammar {

    private IniGrammar() {
    }

    public static final Grammar GRAMMAR = Grammar.builder("ini")
        .state("root",
            rule("\\s+", WHITESPACE),
            rule("[;#].*", COMMENT_SINGLE),
            rule("(\\[)([^\\]\\n]*)(\\])", byGroups(PUNCTUATION, KEYWORD, PUNCTUATION)),
            rule("([^=:;#\\s\\[][^=:\\n]*?)([ \\t]*)([=:])([ \\t]*)",
                byGroups(NAME_ATTRIBUTE, WHITESPACE, OPERATOR, WHITESPACE), "value"),
            rule(".+", NAME_ATTRIBUTE))
        .state("value",
            rule("(\\\\)(\\n)", byGroups(STRING_ESCAPE, WHITESPACE)),
            rule("[^\\\\\\n]+", STRING),
            rule("\\\\", STRING),
            defaultTo("#pop"))
        .build();

    /** A first line holding a section header. */
    static double estimate(String text) {
        var newline = text.indexOf('\n');
        if (newline < 3) {
            return 0.0;
        }
        var first = text.substring(0, newline).strip();
        return first.startsWith("[") && first.endsWith("]") ? 1.0 : 0.0;
    }

    public static Lexer lexer() {
        return Lexer.builder()
            .name("INI")
            .alias("ini")
            .alias("cfg")
            .alias("dosini")
            .filename("*.ini")
            .filename("*.cfg")
            .filename("*.inf")
            .mimeType("text/x-ini")
            .grammar(GRAMMAR)
            .confidence(IniGrammar::estimate)
            .build();
    }
}
