package com.arbor.grammar.compiler.prepare;

import com.arbor.grammar.api.exceptions.MalformedRuleException;
import com.arbor.grammar.api.model.ExtractedGrammars;
import com.arbor.grammar.api.model.PreparedGrammar;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.api.model.Rules;
import com.arbor.grammar.compiler.analysis.TokenInliner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link GrammarSplitter}.
 */
class GrammarSplitterTest {

    private GrammarSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = new GrammarSplitter();
    }

    // --- Example scenarios ---

    @Test
    @DisplayName("Should replace a literal inside a sequence with an auxiliary token")
    void shouldExtractLiteralFromSequence() {
        PreparedGrammar grammar = PreparedGrammar.builder("plus_expr")
                .rule("plus_expr", Rule.seq(Rule.symbol("expr"), Rule.seq(Rule.string("+"), Rule.symbol("expr"))))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.syntacticGrammar().rule("plus_expr")).isEqualTo(
                Rule.seq(Rule.symbol("expr"), Rule.seq(Rule.auxiliary("token1"), Rule.symbol("expr"))));
        assertThat(result.lexicalGrammar().auxRules()).containsExactly(Map.entry("token1", Rule.string("+")));
        assertThat(result.lexicalGrammar().rules()).isEmpty();
    }

    @Test
    @DisplayName("Should move a top-level pattern rule unchanged into the lexical grammar")
    void shouldMoveShallowTokenRule() {
        PreparedGrammar grammar = PreparedGrammar.builder("program")
                .rule("program", Rule.repeat(Rule.symbol("number")))
                .rule("number", Rule.pattern("[0-9]+"))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.lexicalGrammar().rules()).containsExactly(Map.entry("number", Rule.pattern("[0-9]+")));
        assertThat(result.syntacticGrammar().rules()).doesNotContainKey("number");
        assertThat(result.lexicalGrammar().auxRules()).isEmpty();
    }

    @Test
    @DisplayName("Should not share a token between a shallow token rule and an extracted leaf")
    void shouldKeepShallowTokenOutOfPool() {
        PreparedGrammar grammar = PreparedGrammar.builder("a")
                .rule("a", Rule.choice(Rule.string("x"), Rule.string("y")))
                .rule("b", Rule.string("x"))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.syntacticGrammar().rule("a"))
                .isEqualTo(Rule.choice(Rule.auxiliary("token1"), Rule.auxiliary("token2")));
        assertThat(result.lexicalGrammar().rules()).containsExactly(Map.entry("b", Rule.string("x")));
        assertThat(result.lexicalGrammar().auxRules()).containsExactly(
                Map.entry("token1", Rule.string("x")),
                Map.entry("token2", Rule.string("y")));
    }

    @Test
    @DisplayName("Should extract the content of a repeat")
    void shouldExtractFromRepeat() {
        PreparedGrammar grammar = PreparedGrammar.builder("rep")
                .rule("rep", Rule.repeat(Rule.pattern("\\s")))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.syntacticGrammar().rule("rep")).isEqualTo(Rule.repeat(Rule.auxiliary("token1")));
        assertThat(result.lexicalGrammar().auxRules()).containsExactly(Map.entry("token1", Rule.pattern("\\s")));
    }

    // --- Properties ---

    @Test
    @DisplayName("Should deduplicate identical literals across rules")
    void shouldDeduplicateAcrossRules() {
        PreparedGrammar grammar = PreparedGrammar.builder("sum")
                .rule("sum", Rule.seq(Rule.symbol("term"), Rule.string("+"), Rule.symbol("term")))
                .rule("unary", Rule.seq(Rule.string("+"), Rule.symbol("term")))
                .rule("term", Rule.symbol("unary"))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.lexicalGrammar().auxRules()).containsExactly(Map.entry("token1", Rule.string("+")));
        assertThat(result.syntacticGrammar().rule("sum"))
                .isEqualTo(Rule.seq(Rule.symbol("term"), Rule.auxiliary("token1"), Rule.symbol("term")));
        assertThat(result.syntacticGrammar().rule("unary"))
                .isEqualTo(Rule.seq(Rule.auxiliary("token1"), Rule.symbol("term")));
    }

    @Test
    @DisplayName("Should keep the start rule on the syntactic grammar only")
    void shouldCarryStartRule() {
        PreparedGrammar grammar = PreparedGrammar.builder("expr")
                .rule("expr", Rule.seq(Rule.symbol("expr"), Rule.string(";")))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.syntacticGrammar().startRuleName()).isEqualTo("expr");
        assertThat(result.lexicalGrammar().startRuleName()).isEqualTo(PreparedGrammar.NO_START_RULE);
        assertThat(result.lexicalGrammar().hasStartRule()).isFalse();
    }

    @Test
    @DisplayName("Should route auxiliary rules to the auxiliary maps")
    void shouldRouteAuxiliaryRules() {
        PreparedGrammar grammar = PreparedGrammar.builder("list")
                .rule("list", Rule.seq(Rule.string("["), Rule.auxiliary("list_repeat1")))
                .auxRule("list_repeat1", Rule.repeat(Rule.seq(Rule.symbol("item"), Rule.string(","))))
                .auxRule("comma_or_semi", Rule.pattern("[,;]"))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.syntacticGrammar().rules().keySet()).containsExactly("list");
        assertThat(result.syntacticGrammar().auxRules()).containsExactly(Map.entry("list_repeat1",
                Rule.repeat(Rule.seq(Rule.symbol("item"), Rule.auxiliary("token2")))));
        assertThat(result.lexicalGrammar().auxRules()).containsExactly(
                Map.entry("comma_or_semi", Rule.pattern("[,;]")),
                Map.entry("token1", Rule.string("[")),
                Map.entry("token2", Rule.string(",")));
    }

    @Test
    @DisplayName("Should produce identical output on repeated runs")
    void shouldBeDeterministic() {
        PreparedGrammar grammar = sampleGrammar();

        ExtractedGrammars first = splitter.split(grammar);
        ExtractedGrammars second = splitter.split(grammar);

        assertThat(second).isEqualTo(first);
        assertThat(List.copyOf(second.lexicalGrammar().auxRules().keySet()))
                .isEqualTo(List.copyOf(first.lexicalGrammar().auxRules().keySet()));
    }

    @Test
    @DisplayName("Should use a fresh token pool for every split")
    void shouldNotLeakPoolBetweenSplits() {
        splitter.split(PreparedGrammar.builder("a").rule("a", Rule.seq(Rule.string("x"), Rule.string("y"))).build());

        ExtractedGrammars result = splitter.split(
                PreparedGrammar.builder("b").rule("b", Rule.repeat(Rule.string("z"))).build());

        assertThat(result.lexicalGrammar().auxRules()).containsExactly(Map.entry("token1", Rule.string("z")));
    }

    @Test
    @DisplayName("Should leave no lexical leaf in the syntactic grammar")
    void shouldCoverEveryLexicalLeaf() {
        ExtractedGrammars result = splitter.split(sampleGrammar());

        result.syntacticGrammar().rules().values()
                .forEach(rule -> assertThat(Rules.lexicalLeaves(rule)).isEmpty());
        result.syntacticGrammar().auxRules().values()
                .forEach(rule -> assertThat(Rules.lexicalLeaves(rule)).isEmpty());
    }

    @Test
    @DisplayName("Should restore every rule when tokens are inlined back")
    void shouldRoundTrip() {
        PreparedGrammar grammar = sampleGrammar();

        ExtractedGrammars result = splitter.split(grammar);

        Map<String, Rule> tokens = result.lexicalGrammar().auxRules();
        result.syntacticGrammar().rules().forEach((name, rule) ->
                assertThat(TokenInliner.inline(rule, tokens)).isEqualTo(grammar.rule(name)));
    }

    // --- Errors ---

    @Test
    @DisplayName("Should name the rule containing an empty choice")
    void shouldAttributeMalformedRule() {
        PreparedGrammar grammar = PreparedGrammar.builder("ok")
                .rule("ok", Rule.string("ok"))
                .rule("broken", Rule.repeat(new Rule.Choice(List.of())))
                .build();

        assertThatThrownBy(() -> splitter.split(grammar))
                .isInstanceOf(MalformedRuleException.class)
                .hasMessageContaining("Rule 'broken' is malformed")
                .hasMessageContaining("at least one alternative")
                .extracting(e -> ((MalformedRuleException) e).getRuleName())
                .isEqualTo("broken");
    }

    @Test
    @DisplayName("Should skip a token name already used by an auxiliary rule")
    void shouldSkipNameOfDefinedAuxiliaryRule() {
        PreparedGrammar grammar = PreparedGrammar.builder("a")
                .rule("a", Rule.seq(Rule.string("x"), Rule.auxiliary("token1")))
                .auxRule("token1", Rule.repeat(Rule.symbol("a")))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.syntacticGrammar().rule("a"))
                .isEqualTo(Rule.seq(Rule.auxiliary("token2"), Rule.auxiliary("token1")));
        assertThat(result.syntacticGrammar().auxRules())
                .containsExactly(Map.entry("token1", Rule.repeat(Rule.symbol("a"))));
        assertThat(result.lexicalGrammar().auxRules())
                .containsExactly(Map.entry("token2", Rule.string("x")));
    }

    @Test
    @DisplayName("Should not bind an undefined auxiliary reference to a new token")
    void shouldSkipNameOfUndefinedAuxiliaryReference() {
        PreparedGrammar grammar = PreparedGrammar.builder("a")
                .rule("a", Rule.seq(Rule.string("x"), Rule.auxiliary("token1")))
                .build();

        ExtractedGrammars result = splitter.split(grammar);

        assertThat(result.syntacticGrammar().rule("a"))
                .isEqualTo(Rule.seq(Rule.auxiliary("token2"), Rule.auxiliary("token1")));
        assertThat(result.lexicalGrammar().auxRules())
                .containsExactly(Map.entry("token2", Rule.string("x")));
        assertThat(TokenInliner.inline(result.syntacticGrammar().rule("a"), result.lexicalGrammar().auxRules()))
                .isEqualTo(grammar.rule("a"));
    }

    @Test
    @DisplayName("Should collect defined and referenced auxiliary names")
    void shouldCollectAuxiliaryNamesInUse() {
        PreparedGrammar grammar = PreparedGrammar.builder("a")
                .rule("a", Rule.choice(Rule.auxiliary("dangling"), Rule.symbol("b"), Rule.external("ext")))
                .auxRule("helper", Rule.repeat(Rule.auxiliary("helper")))
                .build();

        assertThat(GrammarSplitter.auxiliaryNamesInUse(grammar)).containsExactlyInAnyOrder("dangling", "helper");
    }

    private PreparedGrammar sampleGrammar() {
        return PreparedGrammar.builder("program")
                .rule("program", Rule.repeat(Rule.symbol("statement")))
                .rule("statement", Rule.choice(
                        Rule.seq(Rule.string("let"), Rule.symbol("identifier"), Rule.string("="), Rule.symbol("expr"), Rule.string(";")),
                        Rule.seq(Rule.symbol("expr"), Rule.string(";"))))
                .rule("expr", Rule.choice(
                        Rule.symbol("identifier"),
                        Rule.symbol("number"),
                        Rule.seq(Rule.string("("), Rule.symbol("expr"), Rule.string(")")),
                        Rule.seq(Rule.symbol("expr"), Rule.choice(Rule.string("+"), Rule.string("-")), Rule.symbol("expr"))))
                .rule("identifier", Rule.pattern("[a-z_]+"))
                .rule("number", Rule.pattern("\\d+"))
                .rule("comment", Rule.seq(Rule.string("//"), Rule.choice(Rule.blank(), Rule.pattern("[^\\n]*"))))
                .build();
    }
}
