package shoal.lex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import lombok.RequiredArgsConstructor;
import lombok.extern.java.Log;

/**
 * Turns a {@link Grammar} into a {@link CompiledGrammar}: patterns are
 * compiled, includes are inlined, combined states are synthesized and every
 * state reference is checked. One instance serves one compilation.
 */
@Log
@RequiredArgsConstructor
final class GrammarCompiler {

    private final Grammar grammar;

    private final Map<String, List<CompiledRule>> compiled = new LinkedHashMap<>();
    private final LinkedHashSet<String> expanding = new LinkedHashSet<>();
    private final Map<String, Pattern> patterns = new HashMap<>();
    private final Map<String, StateTransition.PushCombined> combined = new LinkedHashMap<>();

    static CompiledGrammar compile(Grammar grammar) {
        return new GrammarCompiler(grammar).run();
    }

    private CompiledGrammar run() {
        if (!grammar.hasState(Grammar.ROOT_STATE)) {
            throw UnknownStateException.missingRoot(grammar.getName());
        }

        for (var state : grammar.getStates().keySet()) {
            compileState(state);
        }

        for (var entry : combined.entrySet()) {
            var rules = new ArrayList<CompiledRule>();
            for (var part : entry.getValue().states()) {
                rules.addAll(compiled.get(part));
            }
            compiled.put(entry.getKey(), List.copyOf(rules));
            log.finer(() -> "grammar " + grammar.getName() + ": combined state " + entry.getKey()
                + " with " + rules.size() + " rules");
        }

        var result = new CompiledGrammar(grammar.getName(), compiled);
        log.fine(() -> "compiled grammar " + grammar.getName() + ": " + compiled.size() + " states, "
            + compiled.values().stream().mapToInt(List::size).sum() + " rules");
        return result;
    }

    private List<CompiledRule> compileState(String state) {
        var done = compiled.get(state);
        if (done != null) {
            return done;
        }
        if (expanding.contains(state)) {
            var cycle = new ArrayList<String>();
            var inCycle = false;
            for (var name : expanding) {
                inCycle |= name.equals(state);
                if (inCycle) {
                    cycle.add(name);
                }
            }
            cycle.add(state);
            throw new GrammarCycleException(cycle);
        }

        expanding.add(state);
        var rules = new ArrayList<CompiledRule>();
        var raw = grammar.getStates().get(state);
        for (int i = 0; i < raw.size(); i++) {
            var entry = raw.get(i);
            if (entry instanceof RawRule.Include include) {
                requireState(include.state(), state, i);
                rules.addAll(compileState(include.state()));
            } else if (entry instanceof RawRule.Rule rule) {
                rules.add(compileRule(state, i, rule));
            } else {
                throw new MalformedGrammarException("unsupported rule in state '" + state + "': " + entry);
            }
        }
        expanding.remove(state);

        var result = List.copyOf(rules);
        compiled.put(state, result);
        return result;
    }

    private CompiledRule compileRule(String state, int index, RawRule.Rule rule) {
        var pattern = compilePattern(rule.pattern(), state, index);

        var action = rule.action();
        List<StateTransition> ops = List.of();
        if (action instanceof Action.StateOp stateOp) {
            action = stateOp.emission();
            ops = stateOp.ops();
        }
        if (action == null) {
            action = Action.emit(null);
        }

        return new CompiledRule(state, index, pattern, resolveAction(action, state, index),
            resolveTransitions(ops, state, index));
    }

    private Pattern compilePattern(String regex, String state, int index) {
        var pattern = patterns.get(regex);
        if (pattern == null) {
            try {
                pattern = Pattern.compile(regex, grammar.getFlags());
            } catch (PatternSyntaxException ex) {
                throw new InvalidPatternException(regex, state, index, ex);
            }
            patterns.put(regex, pattern);
        }
        return pattern;
    }

    private Action resolveAction(Action action, String state, int index) {
        if (action instanceof Action.Emit || action instanceof Action.EmitGroups) {
            return action;
        }

        if (action instanceof Action.Delegate delegate) {
            if (delegate.isSelf()) {
                requireState(delegate.state(), state, index);
                return new CompiledRule.Delegation(null, delegate.state(), delegate.wrapType());
            }
            var target = delegate.grammar();
            if (!target.hasState(delegate.state())) {
                throw new UnknownStateException(delegate.state(), state, index);
            }
            // a target is always built before the grammar using it, so this cannot recurse
            return new CompiledRule.Delegation(target.compile(), delegate.state(), delegate.wrapType());
        }

        throw new MalformedGrammarException("unsupported action in state '" + state + "', rule " + index
            + ": " + action);
    }

    private List<StateTransition> resolveTransitions(List<StateTransition> ops, String state, int index) {
        var resolved = new ArrayList<StateTransition>(ops.size());
        for (var op : ops) {
            if (op instanceof StateTransition.Push push) {
                requireState(push.state(), state, index);
                resolved.add(push);
            } else if (op instanceof StateTransition.Goto goTo) {
                requireState(goTo.state(), state, index);
                resolved.add(goTo);
            } else if (op instanceof StateTransition.PushCombined pushCombined) {
                for (var part : pushCombined.states()) {
                    requireState(part, state, index);
                }
                var name = pushCombined.combinedName();
                if (grammar.hasState(name)) {
                    throw new MalformedGrammarException("combined state " + name + " clashes with a declared state");
                }
                combined.putIfAbsent(name, pushCombined);
                resolved.add(StateTransition.push(name));
            } else if (op instanceof StateTransition.Pop || op instanceof StateTransition.PushSame) {
                resolved.add(op);
            } else {
                throw new MalformedGrammarException("unsupported transition in state '" + state + "', rule "
                    + index + ": " + op);
            }
        }
        return resolved;
    }

    private void requireState(String target, String state, int index) {
        if (!grammar.hasState(target)) {
            throw new UnknownStateException(target, state, index);
        }
    }
}
