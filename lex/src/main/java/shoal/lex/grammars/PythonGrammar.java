package shoal.lex.grammars;

import static shoal.lex.Action.byGroups;
import static shoal.lex.RawRule.defaultTo;
import static shoal.lex.RawRule.include;
import static shoal.lex.RawRule.rule;
import static shoal.lex.StateTransition.combined;
import static shoal.lex.Tokens.COMMENT_HASHBANG;
import static shoal.lex.Tokens.COMMENT_SINGLE;
import static shoal.lex.Tokens.KEYWORD;
import static shoal.lex.Tokens.KEYWORD_CONSTANT;
import static shoal.lex.Tokens.KEYWORD_NAMESPACE;
import static shoal.lex.Tokens.NAME;
import static shoal.lex.Tokens.NAME_BUILTIN;
import static shoal.lex.Tokens.NAME_BUILTIN_PSEUDO;
import static shoal.lex.Tokens.NAME_CLASS;
import static shoal.lex.Tokens.NAME_DECORATOR;
import static shoal.lex.Tokens.NAME_FUNCTION;
import static shoal.lex.Tokens.NUMBER_BIN;
import static shoal.lex.Tokens.NUMBER_FLOAT;
import static shoal.lex.Tokens.NUMBER_HEX;
import static shoal.lex.Tokens.NUMBER_INTEGER;
import static shoal.lex.Tokens.NUMBER_OCT;
import static shoal.lex.Tokens.OPERATOR;
import static shoal.lex.Tokens.OPERATOR_WORD;
import static shoal.lex.Tokens.PUNCTUATION;
import static shoal.lex.Tokens.STRING_AFFIX;
import static shoal.lex.Tokens.STRING_DOUBLE;
import static shoal.lex.Tokens.STRING_ESCAPE;
import static shoal.lex.Tokens.STRING_INTERPOL;
import static shoal.lex.Tokens.STRING_SINGLE;
import static shoal.lex.Tokens.TEXT;
import static shoal.lex.Tokens.WHITESPACE;

import java.util.regex.Pattern;

import shoal.lex.Grammar;
import shoal.lex.Lexer;

/**
 * A subset of Python 3: keywords, definitions, numbers, operators, comments
 * and single-line strings including f-strings, whose replacement fields are
 * lexed as expressions.
 */
public final class PythonGrammar {

    private PythonGrammar() {
    }

    private static final String IDENTIFIER = "[A-Za-z_]\\w*";

    public static final Grammar GRAMMAR = Grammar.builder("python")
        .state("root",
            rule("\\A#!.*$", COMMENT_HASHBANG),
            rule("\\n", WHITESPACE),
            rule("[^\\S\\n]+", WHITESPACE),
            rule("#.*$", COMMENT_SINGLE),
            rule("\\\\\\n", TEXT),
            rule("(def)(\\s+)", byGroups(KEYWORD, WHITESPACE), "funcname"),
            rule("(class)(\\s+)", byGroups(KEYWORD, WHITESPACE), "classname"),
            rule("(?:from|import)\\b", KEYWORD_NAMESPACE),
            include("expr"))
        .state("expr",
            rule("([fF][rR]?|[rR][fF])(\")", byGroups(STRING_AFFIX, STRING_DOUBLE), combined("fstringescape", "dqf")),
            rule("([fF][rR]?|[rR][fF])(')", byGroups(STRING_AFFIX, STRING_SINGLE), combined("fstringescape", "sqf")),
            rule("([rR][bB]?|[bB][rR])(\")", byGroups(STRING_AFFIX, STRING_DOUBLE), "dqs"),
            rule("([rR][bB]?|[bB][rR])(')", byGroups(STRING_AFFIX, STRING_SINGLE), "sqs"),
            rule("([bBuU]?)(\")", byGroups(STRING_AFFIX, STRING_DOUBLE), combined("stringescape", "dqs")),
            rule("([bBuU]?)(')", byGroups(STRING_AFFIX, STRING_SINGLE), combined("stringescape", "sqs")),
            rule("[^\\S\\n]+", WHITESPACE),
            rule("(?:and|or|not|in|is)\\b", OPERATOR_WORD),
            rule("(?:True|False|None)\\b", KEYWORD_CONSTANT),
            rule("(?:as|assert|async|await|break|continue|del|elif|else|except|finally|for|global|if|lambda"
                + "|nonlocal|pass|raise|return|try|while|with|yield)\\b", KEYWORD),
            rule("(?:self|cls)\\b", NAME_BUILTIN_PSEUDO),
            rule("(?:abs|all|any|bool|dict|enumerate|float|int|isinstance|len|list|max|min|open|print|range"
                + "|repr|set|sorted|str|sum|super|tuple|type|zip)\\b", NAME_BUILTIN),
            rule("@" + IDENTIFIER + "(?:\\." + IDENTIFIER + ")*+", NAME_DECORATOR),
            rule("0[xX][0-9a-fA-F_]+", NUMBER_HEX),
            rule("0[bB][01_]+", NUMBER_BIN),
            rule("0[oO][0-7_]+", NUMBER_OCT),
            rule("(?:\\d[\\d_]*)?\\.\\d[\\d_]*(?:[eE][+-]?\\d+)?|\\d[\\d_]*[eE][+-]?\\d+", NUMBER_FLOAT),
            rule("\\d[\\d_]*", NUMBER_INTEGER),
            rule("\\*\\*=?|//=?|>>=?|<<=?|->|:=|[-+*/%&|^@]=|[=!<>]=|[-~+/*%=<>&^|.@]", OPERATOR),
            rule("[\\[\\](){}:,;]", PUNCTUATION),
            rule(IDENTIFIER, NAME))
        .state("funcname",
            rule(IDENTIFIER, NAME_FUNCTION, "#pop"),
            defaultTo("#pop"))
        .state("classname",
            rule(IDENTIFIER, NAME_CLASS, "#pop"),
            defaultTo("#pop"))
        .state("stringescape",
            rule("\\\\(?:[\\\\'\"abfnrtv\\n]|x[0-9a-fA-F]{2}|[0-7]{1,3}|N\\{[^}\\n]+\\}|u[0-9a-fA-F]{4}"
                + "|U[0-9a-fA-F]{8})", STRING_ESCAPE))
        .state("fstringescape",
            rule("\\{\\{|\\}\\}", STRING_ESCAPE),
            include("stringescape"))
        .state("dqs",
            rule("\"", STRING_DOUBLE, "#pop"),
            rule("\\\\\\\\|\\\\\"|\\\\\\n", STRING_DOUBLE),
            rule("[^\\\\\"\\n]+", STRING_DOUBLE),
            rule("\\\\", STRING_DOUBLE),
            defaultTo("#pop"))
        .state("sqs",
            rule("'", STRING_SINGLE, "#pop"),
            rule("\\\\\\\\|\\\\'|\\\\\\n", STRING_SINGLE),
            rule("[^\\\\'\\n]+", STRING_SINGLE),
            rule("\\\\", STRING_SINGLE),
            defaultTo("#pop"))
        .state("dqf",
            rule("\"", STRING_DOUBLE, "#pop"),
            rule("\\{", STRING_INTERPOL, "fexpr"),
            rule("\\}", STRING_INTERPOL),
            rule("[^\\\\\"{}\\n]+", STRING_DOUBLE),
            rule("\\\\", STRING_DOUBLE),
            defaultTo("#pop"))
        .state("sqf",
            rule("'", STRING_SINGLE, "#pop"),
            rule("\\{", STRING_INTERPOL, "fexpr"),
            rule("\\}", STRING_INTERPOL),
            rule("[^\\\\'{}\\n]+", STRING_SINGLE),
            rule("\\\\", STRING_SINGLE),
            defaultTo("#pop"))
        .state("fexpr",
            rule("[{(\\[]", PUNCTUATION, "fexpr-inner"),
            rule("(?:=\\s*)?(?:![sraf])?\\}", STRING_INTERPOL, "#pop"),
            rule("(?:=\\s*)?(?:![sraf])?:", STRING_INTERPOL, "#pop"),
            rule("\\s+", WHITESPACE),
            include("expr"))
        .state("fexpr-inner",
            rule("[{(\\[]", PUNCTUATION, "#push"),
            rule("[\\])}]", PUNCTUATION, "#pop"),
            rule("\\s+", WHITESPACE),
            include("expr"))
        .build();

    private static final Pattern SHEBANG = Pattern.compile("\\A#!.*\\bpython[23w]?(?:\\.\\d+)?\\b.*$",
        Pattern.MULTILINE);
    private static final Pattern SOURCE_HINT = Pattern.compile("^(?:import \\w|from \\w[\\w.]* import |def \\w)",
        Pattern.MULTILINE);

    static double estimate(String text) {
        if (SHEBANG.matcher(text).find()) {
            return 1.0;
        }
        var head = text.length() > 1000 ? text.substring(0, 1000) : text;
        return SOURCE_HINT.matcher(head).find() ? 0.4 : 0.0;
    }

    public static Lexer lexer() {
        return Lexer.builder()
            .name("Python")
            .alias("python")
            .alias("py")
            .alias("python3")
            .filename("*.py")
            .filename("*.pyw")
            .mimeType("text/x-python")
            .grammar(GRAMMAR)
            .confidence(PythonGrammar::estimate)
            .build();
    }
}
