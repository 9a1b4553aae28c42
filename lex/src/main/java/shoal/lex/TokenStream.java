package shoal.lex;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public final class TokenStream {

    public static final Predicate<Token> WHITESPACE = token -> token.is(Tokens.WHITESPACE);

    private final @NonNull Iterator<Token> source;
    private final @NonNull Predicate<Token> hidden;

    private final List<Token> buffer = new ArrayList<>();
    private Token previous = null;

    public static TokenStream of(Iterator<Token> source) {
        return new TokenStream(source, WHITESPACE);
    }

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return isAtEnd(false);
    }

    public boolean isAtEnd(boolean includeHidden) {
        return peek(includeHidden) == null;
    }

    public Token peek() {
        return peek(false);
    }

    public Token peek(boolean includeHidden) {
        var index = includeHidden ? 0 : nextVisible();
        return fill(index) ? buffer.get(index) : null;
    }

    public Token advance() {
        return advance(false);
    }

    public Token advance(boolean includeHidden) {
        var index = includeHidden ? 0 : nextVisible();
        if (!fill(index)) {
            return null;
        }
        previous = buffer.get(index);
        // hidden tokens before the visible one are consumed along with it
        buffer.subList(0, index + 1).clear();
        return previous;
    }

    private int nextVisible() {
        var index = 0;
        while (fill(index) && hidden.test(buffer.get(index))) {
            index++;
        }
        return index;
    }

    private boolean fill(int index) {
        while (buffer.size() <= index && source.hasNext()) {
            buffer.add(source.next());
        }
        return index < buffer.size();
    }
}
