package shoal.lex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.NonNull;

/**
 * A declarative lexer definition: named states, each holding an ordered list
 * of rules. Rule order is significant, the first rule that matches wins.
 *
 * <p>Grammars are immutable. {@link #compile()} validates and compiles the
 * grammar once and returns the cached result afterwards.
 */
public final class Grammar {

    public static final String ROOT_STATE = "root";

    @Getter
    private final String name;

    @Getter
    private final Map<String, List<RawRule>> states;

    /** Regex flags applied to every pattern of this grammar. */
    @Getter
    private final int flags;

    private final Lazy<CompiledGrammar> compiled;

    private Grammar(String name, Map<String, List<RawRule>> states, int flags) {
        this.name = name;
        this.states = states;
        this.flags = flags;
        this.compiled = Lazy.lazy(() -> GrammarCompiler.compile(this));
    }

    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    public boolean hasState(String state) {
        return states.containsKey(state);
    }

    /**
     * Compiles this grammar, or returns the result of an earlier compilation.
     *
     * @throws GrammarException if the grammar is invalid
     */
    public CompiledGrammar compile() {
        return compiled.get();
    }

    @Override
    public String toString() {
        return "Grammar(" + name + ", states=" + states.keySet() + ")";
    }

    public static final class Builder {

        private final String name;
        private final Map<String, List<RawRule>> states = new LinkedHashMap<>();
        private int flags = Pattern.MULTILINE;

        private Builder(String name) {
            this.name = name;
        }

        public Builder flags(int flags) {
            this.flags = flags;
            return this;
        }

        /** Adds rules to a state, creating it if needed. */
        public Builder state(@NonNull String state, @NonNull RawRule... rules) {
            var list = states.computeIfAbsent(state, s -> new ArrayList<>());
            for (var rule : rules) {
                if (rule == null) {
                    throw new MalformedGrammarException("null rule in state '" + state + "'");
                }
                list.add(rule);
            }
            return this;
        }

        public Grammar build() {
            var copy = new LinkedHashMap<String, List<RawRule>>();
            states.forEach((state, rules) -> copy.put(state, List.copyOf(rules)));
            return new Grammar(name, Collections.unmodifiableMap(copy), flags);
        }
    }
}
