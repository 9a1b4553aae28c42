package shoal.lex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static shoal.lex.RawRule.include;
import static shoal.lex.RawRule.rule;
import static shoal.lex.RawRule.untyped;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class GrammarCompilerTest {

    private static List<String> patterns(CompiledGrammar grammar, String state) {
        return grammar.rules(state).stream()
            .map(rule -> rule.pattern().pattern())
            .collect(Collectors.toList());
    }

    @Test
    void includesAreInlinedInPlace() {
        var compiled = Grammar.builder("test")
            .state("common", rule("\\s+", Tokens.WHITESPACE))
            .state("root", include("common"), rule("\\w+", Tokens.NAME))
            .build()
            .compile();

        assertEquals(List.of("\\s+", "\\w+"), patterns(compiled, "root"));
        assertEquals(List.of("\\s+"), patterns(compiled, "common"));

        var included = compiled.rules("root").get(0);
        assertEquals("common", included.state());
        assertEquals(0, included.index());
        assertSame(compiled.rules("common").get(0), included);
    }

    @Test
    void nestedIncludes() {
        var compiled = Grammar.builder("test")
            .state("root", rule("x", Tokens.TEXT), include("a"), rule("y", Tokens.TEXT))
            .state("a", include("b"), rule("a1", Tokens.NAME))
            .state("b", rule("b1", Tokens.NAME), rule("b2", Tokens.NAME))
            .build()
            .compile();

        assertEquals(List.of("x", "b1", "b2", "a1", "y"), patterns(compiled, "root"));
    }

    @Test
    void includeCycle() {
        var grammar = Grammar.builder("test")
            .state("root", include("a"))
            .state("a", rule("a", Tokens.TEXT), include("b"))
            .state("b", include("a"))
            .build();

        var ex = assertThrows(GrammarCycleException.class, grammar::compile);
        assertEquals(List.of("a", "b", "a"), ex.getCycle());
    }

    @Test
    void selfInclude() {
        var grammar = Grammar.builder("test")
            .state("root", include("root"))
            .build();

        var ex = assertThrows(GrammarCycleException.class, grammar::compile);
        assertEquals(List.of("root", "root"), ex.getCycle());
    }

    @Test
    void missingRoot() {
        var grammar = Grammar.builder("test")
            .state("other", rule("x", Tokens.TEXT))
            .build();

        var ex = assertThrows(UnknownStateException.class, grammar::compile);
        assertEquals("root", ex.getState());
        assertNull(ex.getReferencingState());
    }

    @Test
    void unknownPushTarget() {
        var grammar = Grammar.builder("test")
            .state("root", rule("a", Tokens.TEXT), untyped("\"", "nowhere"))
            .build();

        var ex = assertThrows(UnknownStateException.class, grammar::compile);
        assertEquals("nowhere", ex.getState());
        assertEquals("root", ex.getReferencingState());
        assertEquals(1, ex.getRuleIndex());
    }

    @Test
    void unknownIncludeAndGotoTargets() {
        var include = Grammar.builder("test")
            .state("root", include("nowhere"))
            .build();
        assertThrows(UnknownStateException.class, include::compile);

        var goTo = Grammar.builder("test")
            .state("root", rule("a", Tokens.TEXT, "#pop#push:nowhere"))
            .build();
        assertThrows(UnknownStateException.class, goTo::compile);
    }

    @Test
    void unknownDelegationState() {
        var other = Grammar.builder("other").state("root", rule("x", Tokens.TEXT)).build();

        var self = Grammar.builder("test")
            .state("root", rule("x", Action.usingThis("nowhere")))
            .build();
        assertThrows(UnknownStateException.class, self::compile);

        var foreign = Grammar.builder("test")
            .state("root", rule("x", Action.using(other, "nowhere")))
            .build();
        assertThrows(UnknownStateException.class, foreign::compile);
    }

    @Test
    void invalidPattern() {
        var grammar = Grammar.builder("test")
            .state("root", rule("ok", Tokens.TEXT))
            .state("broken", rule("fine", Tokens.TEXT), rule("(unclosed", Tokens.TEXT))
            .build();

        var ex = assertThrows(InvalidPatternException.class, grammar::compile);
        assertEquals("(unclosed", ex.getPattern());
        assertEquals("broken", ex.getState());
        assertEquals(1, ex.getRuleIndex());
        assertInstanceOf(PatternSyntaxException.class, ex.getCause());
    }

    @Test
    void errorsAreGrammarExceptions() {
        var grammar = Grammar.builder("test")
            .state("root", rule("[", Tokens.TEXT))
            .build();
        assertThrows(GrammarException.class, grammar::compile);
    }

    @Test
    void combinedStatesAreSynthesized() {
        var compiled = Grammar.builder("test")
            .state("root", rule("\"", Tokens.STRING, StateTransition.combined("escape", "string")))
            .state("escape", rule("\\\\.", Tokens.STRING_ESCAPE))
            .state("string", rule("[^\"\\\\]+", Tokens.STRING), rule("\"", Tokens.STRING, "#pop"))
            .build()
            .compile();

        assertTrue(compiled.hasState("escape+string"));
        assertEquals(List.of("\\\\.", "[^\"\\\\]+", "\""), patterns(compiled, "escape+string"));
        assertEquals(List.of(StateTransition.push("escape+string")), compiled.rules("root").get(0).transitions());
    }

    @Test
    void combinedStateNameClash() {
        var grammar = Grammar.builder("test")
            .state("root", rule("x", Tokens.TEXT, StateTransition.combined("a", "b")))
            .state("a", rule("a", Tokens.TEXT))
            .state("b", rule("b", Tokens.TEXT))
            .state("a+b", rule("ab", Tokens.TEXT))
            .build();

        assertThrows(MalformedGrammarException.class, grammar::compile);
    }

    @Test
    void stateChangesCombineWithEmissionsOnly() {
        assertThrows(MalformedGrammarException.class,
            () -> rule("x", Action.usingThis("root"), "#pop"));
    }

    @Test
    void nullRuleIsMalformed() {
        assertThrows(MalformedGrammarException.class,
            () -> Grammar.builder("test").state("root", rule("x", Tokens.TEXT), null));
    }

    @Test
    void patternsUseGrammarFlags() {
        var compiled = Grammar.builder("test")
            .flags(Pattern.CASE_INSENSITIVE)
            .state("root", rule("abc", Tokens.TEXT))
            .build()
            .compile();

        assertEquals(Pattern.CASE_INSENSITIVE, compiled.rules("root").get(0).pattern().flags());
        assertEquals(Pattern.MULTILINE, Grammar.builder("default").build().getFlags());
    }

    @Test
    void compilesOnce() {
        var grammar = Grammar.builder("test")
            .state("root", rule("x", Tokens.TEXT))
            .build();

        assertSame(grammar.compile(), grammar.compile());
    }

    @Test
    void nullEmissionBecomesUntyped() {
        var compiled = Grammar.builder("test")
            .state("root", rule("x", (Action) null))
            .build()
            .compile();

        assertEquals(Action.emit(null), compiled.rules("root").get(0).action());
    }
}
