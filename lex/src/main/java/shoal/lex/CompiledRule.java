package shoal.lex;

import java.util.List;
import java.util.regex.Pattern;

import lombok.NonNull;

/**
 * A rule ready for matching. {@code action} is an {@link Action.Emit}, an
 * {@link Action.EmitGroups} or a resolved delegation; {@code transitions}
 * hold only pushes, pops and gotos of states that exist in the grammar.
 *
 * @param state the state the rule was declared in, which differs from the
 *        state using it when the rule was included
 * @param index the rule's position within its declaring state
 */
public record CompiledRule(
    @NonNull String state,
    int index,
    @NonNull Pattern pattern,
    @NonNull Action action,
    @NonNull List<StateTransition> transitions) {

    public CompiledRule {
        transitions = List.copyOf(transitions);
    }

    /** A resolved delegation. A {@code null} target means the grammar that owns the rule. */
    record Delegation(CompiledGrammar target, String state, TokenType wrapType) implements Action {
    }

    @Override
    public String toString() {
        return state + "[" + index + "] /" + pattern.pattern() + "/ " + action
            + (transitions.isEmpty() ? "" : " " + transitions);
    }
}
