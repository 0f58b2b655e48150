package io.flowcheck.core.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Symbol;
import org.junit.jupiter.api.Test;

class EnumRegistryTest {

    private final EnumDomain q1 = EnumDomain.of("q1", Kind.STRING, "a", "b");
    private final EnumDomain q1Codes = EnumDomain.of("q1_NUM", Kind.NUMBER, 1, 2);

    @Test
    void shouldFindDomainByName() {
        EnumRegistry registry = EnumRegistry.of(q1, q1Codes);

        assertThat(registry.get("q1")).contains(q1);
        assertThat(registry.require("q1_NUM")).isEqualTo(q1Codes);
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.all()).containsExactly(q1, q1Codes);
    }

    @Test
    void shouldMatchSymbolOfSameKind() {
        EnumRegistry registry = EnumRegistry.of(q1);

        assertThat(registry.forSymbol(new Symbol("q1", Kind.STRING))).contains(q1);
        assertThat(registry.forSymbol(new Symbol("q2", Kind.STRING))).isEmpty();
    }

    @Test
    void shouldFailOnMissingRequiredDomain() {
        assertThatThrownBy(() -> EnumRegistry.of(q1).require("q9"))
                .hasMessageContaining("q9");
    }

    @Test
    void shouldRejectDuplicateNames() {
        EnumDomain other = EnumDomain.of("q1", Kind.STRING, "x");

        assertThatThrownBy(() -> EnumRegistry.of(q1, other))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Duplicate enum: q1");
    }

    @Test
    void shouldBeEmptyWithoutDomains() {
        assertThat(EnumRegistry.of().isEmpty()).isTrue();
    }
}
