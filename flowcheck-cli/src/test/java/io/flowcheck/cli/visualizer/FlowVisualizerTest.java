package io.flowcheck.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import io.flowcheck.core.AnalysisReport;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FlowVisualizerTest {

    @Mock private VisualizationFormat customFormat;

    @Mock private AnalysisReport report;

    @Test
    void shouldRegisterBuiltInFormats() {
        FlowVisualizer visualizer = new FlowVisualizer();

        assertThat(visualizer.getAvailableFormats()).containsExactlyInAnyOrder("text", "mermaid");
    }

    @Test
    void shouldDispatchToNamedFormat() {
        // Given
        when(customFormat.getName()).thenReturn("dot");
        when(customFormat.render(report, true)).thenReturn("digraph {}");
        FlowVisualizer visualizer = new FlowVisualizer(List.of(customFormat));

        // When
        String result = visualizer.visualize(report, "dot", true);

        // Then
        assertThat(result).isEqualTo("digraph {}");
    }

    @Test
    void shouldRejectUnsupportedFormat() {
        FlowVisualizer visualizer = new FlowVisualizer();

        assertThatThrownBy(() -> visualizer.visualize(report, "x", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported format: x. Available: mermaid, text");
    }

    @Test
    void shouldRejectDuplicateFormatNames() {
        when(customFormat.getName()).thenReturn("text");

        assertThatThrownBy(() -> new FlowVisualizer(List.of(new TextVisualizationFormat(), customFormat)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate visualization format: text");
    }
}
