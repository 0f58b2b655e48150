package io.flowcheck.core.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Tag;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MapScopeTest {

    @Nested
    class RegisterTest {

        @Test
        void shouldCreateIntermediateScopes() {
            // Given
            MapScope scope = new MapScope();

            // When
            scope.register("zofar.isMobile", "mobile");

            // Then
            assertThat(scope.lookup("zofar.isMobile")).isEqualTo("mobile");
            assertThat(scope.lookup("zofar")).isInstanceOf(MapScope.class);
            assertThat(scope.names()).containsExactly("zofar");
        }

        @Test
        void shouldRejectDuplicateBinding() {
            MapScope scope = new MapScope(Map.of("q1", 1));

            assertThatThrownBy(() -> scope.register("q1", 2))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Identifier already bound: q1");
        }

        @Test
        void shouldRejectPathThroughValue() {
            MapScope scope = new MapScope().register("q1", 1);

            assertThatThrownBy(() -> scope.register("q1.value", 2))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("'q1' is not a scope");
        }
    }

    @Nested
    class LookupTest {

        @Test
        void shouldReportFullPathOfUnknownIdentifier() {
            MapScope scope = new MapScope().register("a.b", 1);

            assertThatThrownBy(() -> scope.lookup("a.c"))
                    .isInstanceOf(SemanticException.class)
                    .hasMessage("Unknown identifier: a.c");
        }

        @Test
        void shouldRejectDescentIntoValue() {
            MapScope scope = new MapScope().register("a", 1);

            assertThatThrownBy(() -> scope.lookup(List.of("a", "b")))
                    .isInstanceOf(SemanticException.class)
                    .hasMessage("'a' is not a scope");
        }
    }

    @Nested
    class MacroTest {

        @Test
        void shouldExpandWhenArgumentsMatchSignature() {
            Macro macro = new Macro("m", List.of(Tag.SYMBOL), args -> Exprs.not(args.get(0)));

            Expr result = macro.expand(List.of(Exprs.bool("b")));

            assertThat(result).isEqualTo(Exprs.not(Exprs.bool("b")));
        }

        @Test
        void shouldRejectArgumentCountMismatch() {
            Macro macro = new Macro("m", List.of(Tag.REF), args -> Exprs.bool("b"));

            assertThatThrownBy(() -> macro.expand(List.of()))
                    .isInstanceOf(SemanticException.class)
                    .hasMessage("Macro m expects [ref] but got []");
        }
    }
}
