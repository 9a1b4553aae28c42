package shoal.lex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.NonNull;

/**
 * A node of the token type taxonomy, identified by its dotted path of segment
 * names (e.g. {@code Keyword.Constant}).
 *
 * <p>Nodes are interned: {@link #of(String...)} always returns the same
 * instance for the same path, creating ancestors on the way. Equality and
 * hashing still go by path, so nodes compare equal regardless of how they were
 * obtained. The intern table only ever grows and entries are never mutated
 * after publication, which makes it safe to share between concurrent lexer
 * runs.
 */
public final class TokenType {

    private static final Map<List<String>, TokenType> interned = new ConcurrentHashMap<>();

    /** The root of the taxonomy, a supertype of every other node. */
    public static final TokenType ROOT = intern(List.of());

    private final List<String> segments;
    private final TokenType parent;
    private final Set<TokenType> subtypes = ConcurrentHashMap.newKeySet();

    private TokenType(List<String> segments, TokenType parent) {
        this.segments = segments;
        this.parent = parent;
    }

    public static TokenType of(@NonNull String... path) {
        return of(List.of(path));
    }

    public static TokenType of(@NonNull List<String> path) {
        for (var segment : path) {
            if (segment.isEmpty() || segment.indexOf('.') >= 0) {
                throw new IllegalArgumentException("invalid token type segment: '" + segment + "'");
            }
        }
        return intern(List.copyOf(path));
    }

    /**
     * Parses a dotted path. A leading {@code Token} segment is optional, and
     * both {@code ""} and {@code "Token"} denote the root.
     */
    public static TokenType parse(@NonNull String dotted) {
        if (dotted.isEmpty() || "Token".equals(dotted)) {
            return ROOT;
        }
        var parts = new ArrayList<>(List.of(dotted.split("\\.", -1)));
        if ("Token".equals(parts.get(0))) {
            parts.remove(0);
        }
        return of(parts);
    }

    private static TokenType intern(List<String> path) {
        var existing = interned.get(path);
        if (existing != null) {
            return existing;
        }
        TokenType parent = path.isEmpty() ? null : intern(List.copyOf(path.subList(0, path.size() - 1)));
        var created = interned.computeIfAbsent(path, p -> new TokenType(p, parent));
        if (parent != null) {
            parent.subtypes.add(created);
        }
        return created;
    }

    public TokenType child(@NonNull String name) {
        var path = new ArrayList<>(segments);
        path.add(name);
        return of(path);
    }

    public List<String> segments() {
        return segments;
    }

    /** The parent node, or {@code null} for the root. */
    public TokenType parent() {
        return parent;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    /** The last segment of the path, or {@code "Token"} for the root. */
    public String name() {
        return isRoot() ? "Token" : segments.get(segments.size() - 1);
    }

    /** Subtypes interned so far, one level down. */
    public Set<TokenType> subtypes() {
        return Collections.unmodifiableSet(subtypes);
    }

    /**
     * Whether {@code other}'s path is a whole-segment prefix of this path.
     * Every node is a subtype of itself and of the root.
     */
    public boolean isSubtypeOf(@NonNull TokenType other) {
        if (other.segments.size() > segments.size()) {
            return false;
        }
        for (int i = 0; i < other.segments.size(); i++) {
            if (!segments.get(i).equals(other.segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof TokenType other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return isRoot() ? "Token" : "Token." + String.join(".", segments);
    }
}
