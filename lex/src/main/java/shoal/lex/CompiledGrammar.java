package shoal.lex;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import lombok.Getter;
import lombok.NonNull;

/**
 * A grammar with includes inlined, patterns compiled and state references
 * checked. Holds no per-run state, so one instance can serve any number of
 * concurrent {@link #tokenize(String)} calls.
 */
public final class CompiledGrammar {

    @Getter
    private final String name;

    private final Map<String, List<CompiledRule>> states;

    private volatile boolean verified;

    CompiledGrammar(String name, Map<String, List<CompiledRule>> states) {
        this.name = name;
        this.states = Collections.unmodifiableMap(states);
    }

    public Set<String> stateNames() {
        return states.keySet();
    }

    public boolean hasState(String state) {
        return states.containsKey(state);
    }

    /** The compiled rules of {@code state}, in matching order. */
    public List<CompiledRule> rules(@NonNull String state) {
        var rules = states.get(state);
        if (rules == null) {
            throw new IllegalArgumentException("no state '" + state + "' in grammar " + name);
        }
        return rules;
    }

    /**
     * Lexes {@code text} lazily from the root state. The text is used as
     * given; see {@link Lexer} for input normalization.
     */
    public Iterator<Token> tokenize(@NonNull String text) {
        return tokenize(text, Grammar.ROOT_STATE);
    }

    public Iterator<Token> tokenize(@NonNull String text, @NonNull String startState) {
        return new LexerEngine(this, text, startState);
    }

    public Stream<Token> stream(@NonNull String text) {
        var spliterator = Spliterators.spliteratorUnknownSize(tokenize(text),
            Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Checks that the start state and every transition target exist.
     *
     * @throws MalformedGrammarException if a referenced state is missing
     */
    void verify(String startState) {
        if (!states.containsKey(startState)) {
            throw new MalformedGrammarException("start state '" + startState + "' missing from compiled grammar "
                + name);
        }
        if (verified) {
            return;
        }
        for (var rules : states.values()) {
            for (var rule : rules) {
                for (var transition : rule.transitions()) {
                    if (transition instanceof StateTransition.PushCombined) {
                        throw new MalformedGrammarException("rule " + rule + " holds an unresolved " + transition);
                    }
                    var target = targetOf(transition);
                    if (target != null && !states.containsKey(target)) {
                        throw new MalformedGrammarException("rule " + rule + " targets state '" + target
                            + "' missing from compiled grammar " + name);
                    }
                }
                if (rule.action() instanceof CompiledRule.Delegation delegation && delegation.target() == null
                        && !states.containsKey(delegation.state())) {
                    throw new MalformedGrammarException("rule " + rule + " delegates to state '"
                        + delegation.state() + "' missing from compiled grammar " + name);
                }
            }
        }
        verified = true;
    }

    private static String targetOf(StateTransition transition) {
        if (transition instanceof StateTransition.Push push) {
            return push.state();
        }
        if (transition instanceof StateTransition.Goto goTo) {
            return goTo.state();
        }
        return null;
    }

    @Override
    public String toString() {
        return "CompiledGrammar(" + name + ", states=" + states.keySet() + ")";
    }
}
