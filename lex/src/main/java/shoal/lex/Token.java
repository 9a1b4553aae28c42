package shoal.lex;

import lombok.NonNull;

public record Token(
    int offset,
    @NonNull TokenType type,
    @NonNull String value) {

    public static Token of(int offset, TokenType type, String value) {
        return new Token(offset, type, value);
    }

    public int end() {
        return offset + value.length();
    }

    public boolean is(TokenType other) {
        return type.isSubtypeOf(other);
    }

    Token shift(int delta) {
        return delta == 0 ? this : new Token(offset + delta, type, value);
    }

    public String quotedValue() {
        var sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            switch (c) {
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\t':
                sb.append("\\t");
                break;
            case '"':
            case '\\':
                sb.append('\\').append(c);
                break;
            default:
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String toString() {
        return "(Token " + type + " " + quotedValue() + " " + offset + ")";
    }
}
