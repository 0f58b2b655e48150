package io.flowcheck.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.bold("index");

        assertThat(result).startsWith("\033[1m");
        assertThat(result).contains("index");
        assertThat(result).endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.bold("index")).isEqualTo("index");
        assertThat(styles.warn("[WARN]")).isEqualTo("[WARN]");
        assertThat(styles.isColorEnabled()).isFalse();
    }

    @Test
    void shouldApplySuccessColor() {
        String result = AnsiStyles.of(true).success("OK");

        assertThat(result).contains("\033[0;32m");
        assertThat(result).endsWith("\033[0m");
    }

    @Test
    void shouldPickColorBySoundness() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.soundOrWarn("page", true)).isEqualTo(styles.success("page"));
        assertThat(styles.soundOrWarn("page", false)).isEqualTo(styles.warn("page"));
    }

    @Test
    void shouldRenderSymbolsWithoutColor() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.arrow()).isEqualTo("→");
        assertThat(styles.loop()).isEqualTo("↻");
        assertThat(styles.boxTop()).isEqualTo("┌─");
        assertThat(styles.boxMid()).isEqualTo("│");
        assertThat(styles.boxBottom()).isEqualTo("└─");
        assertThat(styles.rule(3)).isEqualTo("───");
    }
}
