package shoal.lex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One lexing run over one text. Tokens are produced on demand: each call to
 * {@link #hasNext()} runs the matching loop only until at least one token is
 * pending.
 *
 * <p>At each position the rules of the state on top of the stack are tried in
 * order and the first one matching at that position wins. Unmatched input
 * turns into one {@code Error} token per code point; the run never fails
 * because of the text it is given.
 */
final class LexerEngine implements Iterator<Token> {

    /** Consecutive empty matches allowed at one position before giving up on it. */
    static final int MAX_EMPTY_MATCHES = 128;

    private final CompiledGrammar grammar;
    private final String text;
    private final List<String> stack = new ArrayList<>();
    private final ArrayDeque<Token> pending = new ArrayDeque<>();
    private final Map<Pattern, Matcher> matchers = new IdentityHashMap<>();

    private int position = 0;
    private int emptyMatches = 0;
    private int emptyRunDepth = 0;

    LexerEngine(CompiledGrammar grammar, String text, String startState) {
        grammar.verify(startState);
        this.grammar = grammar;
        this.text = text;
        stack.add(startState);
    }

    /** A snapshot of the state stack, bottom first. */
    List<String> stateStack() {
        return List.copyOf(stack);
    }

    int position() {
        return position;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !isAtEnd()) {
            step();
        }
        return !pending.isEmpty();
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more tokens at offset " + position);
        }
        return pending.removeFirst();
    }

    private boolean isAtEnd() {
        return position >= text.length();
    }

    private void step() {
        for (var rule : grammar.rules(top())) {
            var matcher = matcher(rule.pattern());
            matcher.region(position, text.length());
            if (!matcher.lookingAt()) {
                continue;
            }

            var start = position;
            var end = matcher.end();
            if (end == start && emptyMatches == 0) {
                emptyRunDepth = stack.size();
            }
            emit(rule.action(), matcher, start, end);
            var transitioned = apply(rule.transitions());

            if (end > start) {
                emptyMatches = 0;
                position = end;
            } else if (!transitioned || ++emptyMatches > MAX_EMPTY_MATCHES) {
                // an empty match that changes nothing would repeat forever
                truncateStack(emptyRunDepth);
                recover();
            }
            return;
        }
        recover();
    }

    private void recover() {
        var end = position + Character.charCount(text.codePointAt(position));
        pending.add(new Token(position, Tokens.ERROR, text.substring(position, end)));
        position = end;
        emptyMatches = 0;
    }

    private void emit(Action action, Matcher matcher, int start, int end) {
        if (action instanceof Action.Emit emit) {
            var type = emit.type() != null ? emit.type() : TokenType.ROOT;
            add(start, type, text.substring(start, end));
        } else if (action instanceof Action.EmitGroups groups) {
            emitGroups(groups.types(), matcher);
        } else if (action instanceof CompiledRule.Delegation delegation) {
            delegate(delegation, start, end);
        } else {
            throw new IllegalStateException("unexpected compiled action: " + action);
        }
    }

    private void emitGroups(List<TokenType> types, Matcher matcher) {
        var count = Math.min(matcher.groupCount(), types.size());
        for (int group = 1; group <= count; group++) {
            var type = types.get(group - 1);
            var groupStart = matcher.start(group);
            if (type == null || groupStart < 0) {
                continue;
            }
            add(groupStart, type, matcher.group(group));
        }
    }

    private void delegate(CompiledRule.Delegation delegation, int start, int end) {
        var target = delegation.target() != null ? delegation.target() : grammar;
        var sub = new LexerEngine(target, text.substring(start, end), delegation.state());
        var wrapType = delegation.wrapType();
        var covered = start;
        while (sub.hasNext()) {
            var token = sub.next().shift(start);
            if (wrapType != null && token.offset() > covered) {
                add(covered, wrapType, text.substring(covered, token.offset()));
            }
            pending.add(token);
            covered = Math.max(covered, token.end());
        }
        if (wrapType != null && end > covered) {
            add(covered, wrapType, text.substring(covered, end));
        }
    }

    private void add(int offset, TokenType type, String value) {
        if (!value.isEmpty()) {
            pending.add(new Token(offset, type, value));
        }
    }

    private boolean apply(List<StateTransition> transitions) {
        for (var transition : transitions) {
            if (transition instanceof StateTransition.Push push) {
                stack.add(push.state());
            } else if (transition instanceof StateTransition.Pop pop) {
                pop(pop.count());
            } else if (transition instanceof StateTransition.PushSame) {
                stack.add(top());
            } else if (transition instanceof StateTransition.Goto goTo) {
                pop(1);
                stack.add(goTo.state());
            } else {
                throw new IllegalStateException("unexpected compiled transition: " + transition);
            }
        }
        return !transitions.isEmpty();
    }

    /** Pops up to {@code count} states but always keeps the bottom one. */
    private void pop(int count) {
        var removable = Math.min(count, stack.size() - 1);
        for (int i = 0; i < removable; i++) {
            stack.remove(stack.size() - 1);
        }
    }

    /** Drops states pushed since the stack was {@code depth} deep. */
    private void truncateStack(int depth) {
        while (stack.size() > Math.max(depth, 1)) {
            stack.remove(stack.size() - 1);
        }
    }

    private String top() {
        return stack.get(stack.size() - 1);
    }

    private Matcher matcher(Pattern pattern) {
        var matcher = matchers.get(pattern);
        if (matcher == null) {
            matcher = pattern.matcher(text);
            // lookarounds may see outside the region, ^ and $ keep their usual meaning
            matcher.useTransparentBounds(true);
            matcher.useAnchoringBounds(false);
            matchers.put(pattern, matcher);
        }
        return matcher;
    }
}
