package com.arbor.grammar.api.exceptions;

import com.arbor.grammar.api.model.SymbolKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MalformedRuleExceptionTest {

    @Test
    @DisplayName("Should attribute an anonymous violation to a rule")
    void shouldAttributeToRule() {
        MalformedRuleException anonymous = new MalformedRuleException("Choice must have at least one alternative");

        MalformedRuleException attributed = anonymous.forRule("expr");

        assertThat(anonymous.getRuleName()).isNull();
        assertThat(attributed.getRuleName()).isEqualTo("expr");
        assertThat(attributed.getDetail()).isEqualTo("Choice must have at least one alternative");
        assertThat(attributed).hasMessage("Rule 'expr' is malformed: Choice must have at least one alternative")
                .hasCause(anonymous);
    }

    @Test
    @DisplayName("Should keep the first rule name it was attributed to")
    void shouldKeepExistingAttribution() {
        MalformedRuleException attributed = new MalformedRuleException("inner", "bad");

        assertThat(attributed.forRule("outer")).isSameAs(attributed);
    }

    @Test
    @DisplayName("Should describe an unresolved symbol")
    void shouldDescribeUnresolvedSymbol() {
        UnresolvedSymbolException e = new UnresolvedSymbolException("a", "b", SymbolKind.AUXILIARY);

        assertThat(e).isInstanceOf(CompilationException.class)
                .hasMessage("Rule 'a' references undefined auxiliary symbol 'b'");
        assertThat(e.getSymbolKind()).isEqualTo(SymbolKind.AUXILIARY);
    }
}
