package com.arbor.grammar.compiler.analysis;

import com.arbor.grammar.api.exceptions.CompilationException;
import com.arbor.grammar.api.model.ExtractedGrammars;
import com.arbor.grammar.api.model.PreparedGrammar;
import com.arbor.grammar.api.model.Rule;
import com.arbor.grammar.compiler.prepare.GrammarSplitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionVerifierTest {

    private ExtractionVerifier verifier;
    private PreparedGrammar grammar;

    @BeforeEach
    void setUp() {
        verifier = new ExtractionVerifier();
        grammar = PreparedGrammar.builder("sum")
                .rule("sum", Rule.seq(Rule.symbol("number"), Rule.seq(Rule.string("+"), Rule.symbol("number"))))
                .rule("number", Rule.pattern("\\d+"))
                .build();
    }

    @Nested
    @DisplayName("TokenInliner")
    class TokenInlinerTests {

        @Test
        void shouldReplaceAuxiliarySymbolsByDefinition() {
            Rule rewritten = Rule.choice(Rule.auxiliary("token1"), Rule.repeat(Rule.auxiliary("token2")));

            Rule restored = TokenInliner.inline(rewritten,
                    Map.of("token1", Rule.string("a"), "token2", Rule.pattern("b")));

            assertThat(restored).isEqualTo(Rule.choice(Rule.string("a"), Rule.repeat(Rule.pattern("b"))));
        }

        @Test
        void shouldLeaveUnknownAndNonAuxiliarySymbolsAlone() {
            Rule rewritten = Rule.seq(Rule.symbol("token1"), Rule.auxiliary("helper"));

            Rule restored = TokenInliner.inline(rewritten, Map.of("token1", Rule.string("a")));

            assertThat(restored).isEqualTo(rewritten);
        }

        @Test
        void shouldFlattenChoicesProducedByInlining() {
            Rule rewritten = Rule.choice(Rule.auxiliary("token1"), Rule.string("c"));

            Rule restored = TokenInliner.inline(rewritten,
                    Map.of("token1", Rule.choice(Rule.string("a"), Rule.string("b"))));

            assertThat(restored).isEqualTo(Rule.choice(Rule.string("a"), Rule.string("b"), Rule.string("c")));
        }
    }

    @Test
    @DisplayName("Should accept the output of the splitter")
    void shouldAcceptSplitterOutput() {
        ExtractedGrammars result = new GrammarSplitter().split(grammar);

        assertThatCode(() -> verifier.verify(grammar, result)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should accept a grammar with auxiliary rules that reference each other")
    void shouldAcceptAuxiliaryRules() {
        PreparedGrammar withAux = PreparedGrammar.builder("list")
                .rule("list", Rule.seq(Rule.string("["), Rule.seq(Rule.auxiliary("items"), Rule.string("]"))))
                .auxRule("items", Rule.repeat(Rule.choice(Rule.string(","), Rule.auxiliary("item"))))
                .auxRule("item", Rule.pattern("[a-z]+"))
                .build();

        ExtractedGrammars result = new GrammarSplitter().split(withAux);

        assertThatCode(() -> verifier.verify(withAux, result)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject a changed start rule")
    void shouldRejectChangedStartRule() {
        ExtractedGrammars tampered = new ExtractedGrammars(
                PreparedGrammar.builder("other")
                        .rule("sum", Rule.seq(Rule.symbol("number"), Rule.seq(Rule.auxiliary("token1"), Rule.symbol("number"))))
                        .build(),
                PreparedGrammar.builder(PreparedGrammar.NO_START_RULE)
                        .rule("number", Rule.pattern("\\d+"))
                        .auxRule("token1", Rule.string("+"))
                        .build());

        assertThatThrownBy(() -> verifier.verify(grammar, tampered))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Start rule changed");
    }

    @Test
    @DisplayName("Should reject a lexical grammar with a start rule")
    void shouldRejectLexicalStartRule() {
        ExtractedGrammars tampered = new ExtractedGrammars(
                PreparedGrammar.builder("sum")
                        .rule("sum", Rule.seq(Rule.symbol("number"), Rule.seq(Rule.auxiliary("token1"), Rule.symbol("number"))))
                        .build(),
                PreparedGrammar.builder("number")
                        .rule("number", Rule.pattern("\\d+"))
                        .auxRule("token1", Rule.string("+"))
                        .build());

        assertThatThrownBy(() -> verifier.verify(grammar, tampered))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("must not have a start rule");
    }

    @Test
    @DisplayName("Should reject a token rule left in the syntactic grammar")
    void shouldRejectMisroutedTokenRule() {
        ExtractedGrammars tampered = new ExtractedGrammars(
                PreparedGrammar.builder("sum")
                        .rule("sum", Rule.seq(Rule.symbol("number"), Rule.seq(Rule.auxiliary("token1"), Rule.symbol("number"))))
                        .rule("number", Rule.pattern("\\d+"))
                        .build(),
                PreparedGrammar.builder(PreparedGrammar.NO_START_RULE)
                        .auxRule("token1", Rule.string("+"))
                        .build());

        assertThatThrownBy(() -> verifier.verify(grammar, tampered))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Token rule 'number' was not moved unchanged");
    }

    @Test
    @DisplayName("Should reject a missing syntactic rule")
    void shouldRejectMissingRule() {
        ExtractedGrammars tampered = new ExtractedGrammars(
                PreparedGrammar.builder("sum").build(),
                PreparedGrammar.builder(PreparedGrammar.NO_START_RULE)
                        .rule("number", Rule.pattern("\\d+"))
                        .build());

        assertThatThrownBy(() -> verifier.verify(grammar, tampered))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Rule 'sum' is missing from the syntactic grammar");
    }

    @Test
    @DisplayName("Should reject a syntactic rule that still holds a literal")
    void shouldRejectLeftoverLeaf() {
        ExtractedGrammars tampered = new ExtractedGrammars(
                PreparedGrammar.builder("sum")
                        .rule("sum", grammar.rule("sum"))
                        .build(),
                PreparedGrammar.builder(PreparedGrammar.NO_START_RULE)
                        .rule("number", Rule.pattern("\\d+"))
                        .build());

        assertThatThrownBy(() -> verifier.verify(grammar, tampered))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("still contains lexical leaf STRING(\"+\")");
    }

    @Test
    @DisplayName("Should reject a reference to a token that was never defined")
    void shouldRejectUnknownToken() {
        ExtractedGrammars tampered = new ExtractedGrammars(
                PreparedGrammar.builder("sum")
                        .rule("sum", Rule.seq(Rule.symbol("number"), Rule.seq(Rule.auxiliary("token9"), Rule.symbol("number"))))
                        .build(),
                PreparedGrammar.builder(PreparedGrammar.NO_START_RULE)
                        .rule("number", Rule.pattern("\\d+"))
                        .auxRule("token1", Rule.string("+"))
                        .build());

        assertThatThrownBy(() -> verifier.verify(grammar, tampered))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("references unknown token 'token9'");
    }

    @Test
    @DisplayName("Should reject a token whose definition differs from the hoisted leaf")
    void shouldRejectBrokenRoundTrip() {
        ExtractedGrammars tampered = new ExtractedGrammars(
                PreparedGrammar.builder("sum")
                        .rule("sum", Rule.seq(Rule.symbol("number"), Rule.seq(Rule.auxiliary("token1"), Rule.symbol("number"))))
                        .build(),
                PreparedGrammar.builder(PreparedGrammar.NO_START_RULE)
                        .rule("number", Rule.pattern("\\d+"))
                        .auxRule("token1", Rule.string("-"))
                        .build());

        assertThatThrownBy(() -> verifier.verify(grammar, tampered))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Rule 'sum' does not round-trip");
    }
}
