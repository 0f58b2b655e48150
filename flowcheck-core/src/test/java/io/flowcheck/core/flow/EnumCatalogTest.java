package io.flowcheck.core.flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.expr.Kind;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnumCatalogTest {

    private static EnumValues gender() {
        return new EnumValues("gender", List.of(new EnumValue("male", 1), new EnumValue("female", 2)));
    }

    @Test
    void shouldCreateStringAndNumericDomainPerVariable() {
        // Given
        Page page = new Page("p1", List.of(), List.of(gender()));

        // When
        EnumRegistry registry = EnumCatalog.fromPages(List.of(page));

        // Then
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.require("gender").kind()).isEqualTo(Kind.STRING);
        assertThat(registry.require("gender").members()).containsExactly("male", "female");
        assertThat(registry.require("gender_NUM").members()).containsExactly(1L, 2L);
    }

    @Test
    void shouldMergeOptionsSharingACode() {
        // Given
        EnumValues answers = new EnumValues("q1", List.of(
                new EnumValue("ao1", 1), new EnumValue("ao2", 1), new EnumValue("ao3", 2)));
        Page page = new Page("p1", List.of(), List.of(answers));

        // When
        EnumRegistry registry = EnumCatalog.fromPages(List.of(page));

        // Then
        assertThat(registry.require("q1").members()).containsExactly("ao1", "ao2", "ao3");
        assertThat(registry.require("q1_NUM").members()).containsExactly(1L, 2L);
    }

    @Test
    void shouldAcceptIdenticalDeclarationsOnSeveralPages() {
        Page first = new Page("p1", List.of(), List.of(gender()));
        Page second = new Page("p2", List.of(), List.of(gender()));

        EnumRegistry registry = EnumCatalog.fromPages(List.of(first, second));

        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void shouldRejectConflictingDeclarations() {
        // Given
        Page first = new Page("p1", List.of(), List.of(gender()));
        EnumValues other = new EnumValues("gender", List.of(new EnumValue("male", 1), new EnumValue("diverse", 3)));
        Page second = new Page("p2", List.of(), List.of(other));

        // When / Then
        assertThatThrownBy(() -> EnumCatalog.fromPages(List.of(first, second)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Conflicting enum declarations: [gender (page p2)]");
    }

    @Test
    void shouldRejectEmptyEnum() {
        Page page = new Page("p1", List.of(), List.of(new EnumValues("q9", List.of())));

        assertThatThrownBy(() -> EnumCatalog.fromPages(List.of(page)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Empty enum found: q9");
    }

    @Test
    void shouldReturnEmptyRegistryWithoutDeclarations() {
        assertThat(EnumCatalog.fromPages(List.of(new Page("p1", List.of()))).isEmpty()).isTrue();
    }
}
