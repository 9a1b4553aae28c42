package shoal.lex;

import static java.util.Map.entry;

import java.util.Map;

import lombok.NonNull;

/**
 * The conventional token types and the short class names formatters use for
 * them.
 */
public final class Tokens {

    private Tokens() {
    }

    public static final TokenType TOKEN = TokenType.ROOT;

    public static final TokenType TEXT = TokenType.of("Text");
    public static final TokenType WHITESPACE = TEXT.child("Whitespace");
    public static final TokenType ESCAPE = TokenType.of("Escape");
    public static final TokenType ERROR = TokenType.of("Error");
    public static final TokenType OTHER = TokenType.of("Other");

    public static final TokenType KEYWORD = TokenType.of("Keyword");
    public static final TokenType KEYWORD_CONSTANT = KEYWORD.child("Constant");
    public static final TokenType KEYWORD_DECLARATION = KEYWORD.child("Declaration");
    public static final TokenType KEYWORD_NAMESPACE = KEYWORD.child("Namespace");
    public static final TokenType KEYWORD_PSEUDO = KEYWORD.child("Pseudo");
    public static final TokenType KEYWORD_RESERVED = KEYWORD.child("Reserved");
    public static final TokenType KEYWORD_TYPE = KEYWORD.child("Type");

    public static final TokenType NAME = TokenType.of("Name");
    public static final TokenType NAME_ATTRIBUTE = NAME.child("Attribute");
    public static final TokenType NAME_BUILTIN = NAME.child("Builtin");
    public static final TokenType NAME_BUILTIN_PSEUDO = NAME_BUILTIN.child("Pseudo");
    public static final TokenType NAME_CLASS = NAME.child("Class");
    public static final TokenType NAME_CONSTANT = NAME.child("Constant");
    public static final TokenType NAME_DECORATOR = NAME.child("Decorator");
    public static final TokenType NAME_ENTITY = NAME.child("Entity");
    public static final TokenType NAME_EXCEPTION = NAME.child("Exception");
    public static final TokenType NAME_FUNCTION = NAME.child("Function");
    public static final TokenType NAME_FUNCTION_MAGIC = NAME_FUNCTION.child("Magic");
    public static final TokenType NAME_PROPERTY = NAME.child("Property");
    public static final TokenType NAME_LABEL = NAME.child("Label");
    public static final TokenType NAME_NAMESPACE = NAME.child("Namespace");
    public static final TokenType NAME_OTHER = NAME.child("Other");
    public static final TokenType NAME_TAG = NAME.child("Tag");
    public static final TokenType NAME_VARIABLE = NAME.child("Variable");
    public static final TokenType NAME_VARIABLE_CLASS = NAME_VARIABLE.child("Class");
    public static final TokenType NAME_VARIABLE_GLOBAL = NAME_VARIABLE.child("Global");
    public static final TokenType NAME_VARIABLE_INSTANCE = NAME_VARIABLE.child("Instance");
    public static final TokenType NAME_VARIABLE_MAGIC = NAME_VARIABLE.child("Magic");

    public static final TokenType LITERAL = TokenType.of("Literal");
    public static final TokenType LITERAL_DATE = LITERAL.child("Date");

    public static final TokenType STRING = LITERAL.child("String");
    public static final TokenType STRING_AFFIX = STRING.child("Affix");
    public static final TokenType STRING_BACKTICK = STRING.child("Backtick");
    public static final TokenType STRING_CHAR = STRING.child("Char");
    public static final TokenType STRING_DELIMITER = STRING.child("Delimiter");
    public static final TokenType STRING_DOC = STRING.child("Doc");
    public static final TokenType STRING_DOUBLE = STRING.child("Double");
    public static final TokenType STRING_ESCAPE = STRING.child("Escape");
    public static final TokenType STRING_HEREDOC = STRING.child("Heredoc");
    public static final TokenType STRING_INTERPOL = STRING.child("Interpol");
    public static final TokenType STRING_OTHER = STRING.child("Other");
    public static final TokenType STRING_REGEX = STRING.child("Regex");
    public static final TokenType STRING_SINGLE = STRING.child("Single");
    public static final TokenType STRING_SYMBOL = STRING.child("Symbol");

    public static final TokenType NUMBER = LITERAL.child("Number");
    public static final TokenType NUMBER_BIN = NUMBER.child("Bin");
    public static final TokenType NUMBER_FLOAT = NUMBER.child("Float");
    public static final TokenType NUMBER_HEX = NUMBER.child("Hex");
    public static final TokenType NUMBER_INTEGER = NUMBER.child("Integer");
    public static final TokenType NUMBER_INTEGER_LONG = NUMBER_INTEGER.child("Long");
    public static final TokenType NUMBER_OCT = NUMBER.child("Oct");

    public static final TokenType OPERATOR = TokenType.of("Operator");
    public static final TokenType OPERATOR_WORD = OPERATOR.child("Word");

    public static final TokenType PUNCTUATION = TokenType.of("Punctuation");
    public static final TokenType PUNCTUATION_MARKER = PUNCTUATION.child("Marker");

    public static final TokenType COMMENT = TokenType.of("Comment");
    public static final TokenType COMMENT_HASHBANG = COMMENT.child("Hashbang");
    public static final TokenType COMMENT_MULTILINE = COMMENT.child("Multiline");
    public static final TokenType COMMENT_PREPROC = COMMENT.child("Preproc");
    public static final TokenType COMMENT_PREPROC_FILE = COMMENT.child("PreprocFile");
    public static final TokenType COMMENT_SINGLE = COMMENT.child("Single");
    public static final TokenType COMMENT_SPECIAL = COMMENT.child("Special");

    public static final TokenType GENERIC = TokenType.of("Generic");
    public static final TokenType GENERIC_DELETED = GENERIC.child("Deleted");
    public static final TokenType GENERIC_EMPH = GENERIC.child("Emph");
    public static final TokenType GENERIC_ERROR = GENERIC.child("Error");
    public static final TokenType GENERIC_HEADING = GENERIC.child("Heading");
    public static final TokenType GENERIC_INSERTED = GENERIC.child("Inserted");
    public static final TokenType GENERIC_OUTPUT = GENERIC.child("Output");
    public static final TokenType GENERIC_PROMPT = GENERIC.child("Prompt");
    public static final TokenType GENERIC_STRONG = GENERIC.child("Strong");
    public static final TokenType GENERIC_SUBHEADING = GENERIC.child("Subheading");
    public static final TokenType GENERIC_TRACEBACK = GENERIC.child("Traceback");

    private static final Map<TokenType, String> shortNames = Map.ofEntries(
        entry(TOKEN, ""),
        entry(TEXT, ""),
        entry(WHITESPACE, "w"),
        entry(ESCAPE, "esc"),
        entry(ERROR, "err"),
        entry(OTHER, "x"),

        entry(KEYWORD, "k"),
        entry(KEYWORD_CONSTANT, "kc"),
        entry(KEYWORD_DECLARATION, "kd"),
        entry(KEYWORD_NAMESPACE, "kn"),
        entry(KEYWORD_PSEUDO, "kp"),
        entry(KEYWORD_RESERVED, "kr"),
        entry(KEYWORD_TYPE, "kt"),

        entry(NAME, "n"),
        entry(NAME_ATTRIBUTE, "na"),
        entry(NAME_BUILTIN, "nb"),
        entry(NAME_BUILTIN_PSEUDO, "bp"),
        entry(NAME_CLASS, "nc"),
        entry(NAME_CONSTANT, "no"),
        entry(NAME_DECORATOR, "nd"),
        entry(NAME_ENTITY, "ni"),
        entry(NAME_EXCEPTION, "ne"),
        entry(NAME_FUNCTION, "nf"),
        entry(NAME_FUNCTION_MAGIC, "fm"),
        entry(NAME_PROPERTY, "py"),
        entry(NAME_LABEL, "nl"),
        entry(NAME_NAMESPACE, "nn"),
        entry(NAME_OTHER, "nx"),
        entry(NAME_TAG, "nt"),
        entry(NAME_VARIABLE, "nv"),
        entry(NAME_VARIABLE_CLASS, "vc"),
        entry(NAME_VARIABLE_GLOBAL, "vg"),
        entry(NAME_VARIABLE_INSTANCE, "vi"),
        entry(NAME_VARIABLE_MAGIC, "vm"),

        entry(LITERAL, "l"),
        entry(LITERAL_DATE, "ld"),

        entry(STRING, "s"),
        entry(STRING_AFFIX, "sa"),
        entry(STRING_BACKTICK, "sb"),
        entry(STRING_CHAR, "sc"),
        entry(STRING_DELIMITER, "dl"),
        entry(STRING_DOC, "sd"),
        entry(STRING_DOUBLE, "s2"),
        entry(STRING_ESCAPE, "se"),
        entry(STRING_HEREDOC, "sh"),
        entry(STRING_INTERPOL, "si"),
        entry(STRING_OTHER, "sx"),
        entry(STRING_REGEX, "sr"),
        entry(STRING_SINGLE, "s1"),
        entry(STRING_SYMBOL, "ss"),

        entry(NUMBER, "m"),
        entry(NUMBER_BIN, "mb"),
        entry(NUMBER_FLOAT, "mf"),
        entry(NUMBER_HEX, "mh"),
        entry(NUMBER_INTEGER, "mi"),
        entry(NUMBER_INTEGER_LONG, "il"),
        entry(NUMBER_OCT, "mo"),

        entry(OPERATOR, "o"),
        entry(OPERATOR_WORD, "ow"),

        entry(PUNCTUATION, "p"),
        entry(PUNCTUATION_MARKER, "pm"),

        entry(COMMENT, "c"),
        entry(COMMENT_HASHBANG, "ch"),
        entry(COMMENT_MULTILINE, "cm"),
        entry(COMMENT_PREPROC, "cp"),
        entry(COMMENT_PREPROC_FILE, "cpf"),
        entry(COMMENT_SINGLE, "c1"),
        entry(COMMENT_SPECIAL, "cs"),

        entry(GENERIC, "g"),
        entry(GENERIC_DELETED, "gd"),
        entry(GENERIC_EMPH, "ge"),
        entry(GENERIC_ERROR, "gr"),
        entry(GENERIC_HEADING, "gh"),
        entry(GENERIC_INSERTED, "gi"),
        entry(GENERIC_OUTPUT, "go"),
        entry(GENERIC_PROMPT, "gp"),
        entry(GENERIC_STRONG, "gs"),
        entry(GENERIC_SUBHEADING, "gu"),
        entry(GENERIC_TRACEBACK, "gt"));

    public static boolean isStandard(@NonNull TokenType type) {
        return shortNames.containsKey(type);
    }

    /**
     * The short class name of {@code type}. Non-standard types take the name
     * of their nearest standard ancestor followed by {@code -Segment} for each
     * segment below it, e.g. {@code Name.Function.Lambda} gives
     * {@code nf-Lambda}.
     */
    public static String shortName(@NonNull TokenType type) {
        var suffix = new StringBuilder();
        var current = type;
        while (!shortNames.containsKey(current)) {
            suffix.insert(0, "-" + current.name());
            current = current.parent();
        }
        return shortNames.get(current) + suffix;
    }
}
