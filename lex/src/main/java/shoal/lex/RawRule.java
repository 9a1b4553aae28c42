package shoal.lex;

import java.util.List;

import lombok.NonNull;

/**
 * An entry in a grammar state's rule list: a literal rule or an include of
 * another state's rules.
 */
public interface RawRule {

    /** A pattern and what to do when it matches. */
    record Rule(@NonNull String pattern, Action action) implements RawRule {
    }

    /** Inlines all rules of {@code state} at this position. */
    record Include(@NonNull String state) implements RawRule {
    }

    static RawRule rule(String pattern, TokenType type) {
        return new Rule(pattern, Action.emit(type));
    }

    static RawRule rule(String pattern, TokenType type, String... directives) {
        return rule(pattern, Action.emit(type), directives);
    }

    static RawRule rule(String pattern, TokenType type, StateTransition... ops) {
        return rule(pattern, Action.emit(type), ops);
    }

    static RawRule rule(String pattern, Action action) {
        return new Rule(pattern, action);
    }

    static RawRule rule(String pattern, Action action, String... directives) {
        return new Rule(pattern, new Action.StateOp(action, StateTransition.parseAll(directives)));
    }

    static RawRule rule(String pattern, Action action, StateTransition... ops) {
        return new Rule(pattern, new Action.StateOp(action, List.of(ops)));
    }

    /** A rule that emits its match unclassified and changes state. */
    static RawRule untyped(String pattern, String... directives) {
        return rule(pattern, Action.emit(null), directives);
    }

    static RawRule include(String state) {
        return new Include(state);
    }

    /** A rule that consumes nothing and only changes state. */
    static RawRule defaultTo(String... directives) {
        return rule("", Action.emit(null), directives);
    }
}
