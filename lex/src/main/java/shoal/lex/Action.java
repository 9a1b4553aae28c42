package shoal.lex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;

/**
 * What a rule does with its match.
 */
public interface Action {

    /**
     * Emits the whole match as one token. A {@code null} type leaves the text
     * unclassified: it is emitted under {@link TokenType#ROOT}.
     */
    record Emit(TokenType type) implements Action {
    }

    /**
     * Emits each participating capture group as its own token, in group order.
     * A {@code null} entry skips its group, as do groups without an entry.
     * Text outside the groups is not emitted.
     */
    record EmitGroups(@NonNull List<TokenType> types) implements Action {
        public EmitGroups {
            types = Collections.unmodifiableList(new ArrayList<>(types));
        }
    }

    /**
     * Lexes the match with another grammar, or with the current one when
     * {@code grammar} is {@code null}, starting in {@code state}. With a
     * {@code wrapType}, parts of the match the other grammar leaves unemitted
     * are emitted as that type.
     */
    record Delegate(Grammar grammar, @NonNull String state, TokenType wrapType) implements Action {

        public boolean isSelf() {
            return grammar == null;
        }

        public Delegate wrappedIn(TokenType type) {
            return new Delegate(grammar, state, type);
        }
    }

    /** An optional emission combined with state stack changes. */
    record StateOp(Action emission, @NonNull List<StateTransition> ops) implements Action {
        public StateOp {
            if (emission instanceof StateOp || emission instanceof Delegate) {
                throw new MalformedGrammarException("state changes combine with Emit or EmitGroups only, got "
                    + emission);
            }
            ops = List.copyOf(ops);
        }
    }

    static Action emit(TokenType type) {
        return new Emit(type);
    }

    static Action byGroups(TokenType... types) {
        return new EmitGroups(Arrays.asList(types));
    }

    static Delegate using(@NonNull Grammar grammar) {
        return new Delegate(grammar, Grammar.ROOT_STATE, null);
    }

    static Delegate using(@NonNull Grammar grammar, String state) {
        return new Delegate(grammar, state, null);
    }

    static Delegate usingThis(String state) {
        return new Delegate(null, state, null);
    }

    static Action withStates(Action emission, StateTransition... ops) {
        return new StateOp(emission, List.of(ops));
    }
}
