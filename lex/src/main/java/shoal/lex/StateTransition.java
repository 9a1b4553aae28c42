package shoal.lex;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;

/**
 * A change to the lexer's state stack, applied after a rule matched.
 */
public interface StateTransition {

    /** Pushes a named state. */
    record Push(@NonNull String state) implements StateTransition {
        @Override
        public String toString() {
            return state;
        }
    }

    /** Pops up to {@code count} states, never the last one. */
    record Pop(int count) implements StateTransition {
        public Pop {
            if (count < 1) {
                throw new IllegalArgumentException("pop count must be positive: " + count);
            }
        }

        @Override
        public String toString() {
            return count == 1 ? "#pop" : "#pop:" + count;
        }
    }

    /** Pushes another copy of the current state. */
    record PushSame() implements StateTransition {
        @Override
        public String toString() {
            return "#push";
        }
    }

    /** Replaces the current state: a pop followed by a push. */
    record Goto(@NonNull String state) implements StateTransition {
        @Override
        public String toString() {
            return "#pop#push:" + state;
        }
    }

    /**
     * Pushes an anonymous state made of the listed states' rules, in order.
     * The compiler turns this into a {@link Push} of a synthesized state.
     */
    record PushCombined(@NonNull List<String> states) implements StateTransition {
        public PushCombined {
            if (states.isEmpty()) {
                throw new IllegalArgumentException("combined state needs at least one state");
            }
            states = List.copyOf(states);
        }

        String combinedName() {
            return String.join("+", states);
        }

        @Override
        public String toString() {
            return "combined(" + String.join(", ", states) + ")";
        }
    }

    StateTransition PUSH_SAME = new PushSame();

    static StateTransition push(String state) {
        return new Push(state);
    }

    static StateTransition pop() {
        return new Pop(1);
    }

    static StateTransition pop(int count) {
        return new Pop(count);
    }

    static StateTransition pushSame() {
        return PUSH_SAME;
    }

    static StateTransition goTo(String state) {
        return new Goto(state);
    }

    static StateTransition combined(String... states) {
        return new PushCombined(List.of(states));
    }

    /**
     * Parses a directive string: {@code #pop}, {@code #pop:N}, {@code #push},
     * {@code #pop#push:state}, or a plain state name.
     */
    static StateTransition parse(@NonNull String directive) {
        if ("#pop".equals(directive)) {
            return pop();
        }
        if ("#push".equals(directive)) {
            return PUSH_SAME;
        }
        if (directive.startsWith("#pop#push:")) {
            var target = directive.substring("#pop#push:".length());
            if (target.isEmpty()) {
                throw new MalformedGrammarException("missing state in directive: " + directive);
            }
            return goTo(target);
        }
        if (directive.startsWith("#pop:")) {
            try {
                return pop(Integer.parseInt(directive.substring("#pop:".length())));
            } catch (IllegalArgumentException ex) {
                throw new MalformedGrammarException("invalid pop count in directive: " + directive, ex);
            }
        }
        if (directive.isEmpty() || directive.startsWith("#")) {
            throw new MalformedGrammarException("unknown state directive: '" + directive + "'");
        }
        return push(directive);
    }

    static List<StateTransition> parseAll(@NonNull String... directives) {
        var result = new ArrayList<StateTransition>(directives.length);
        for (var directive : directives) {
            result.add(parse(directive));
        }
        return List.copyOf(result);
    }
}
