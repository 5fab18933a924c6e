package io.github.hongjungwan.redlog.api.config;

import io.github.hongjungwan.redlog.api.ColorMode;
import io.github.hongjungwan.redlog.api.FormatErrorPolicy;
import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.theme.Themes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RedlogConfig")
class RedlogConfigTest {

    @Test
    @DisplayName("should have sensible defaults")
    void shouldHaveDefaults() {
        RedlogConfig config = RedlogConfig.defaultConfig();

        assertThat(config.getLevel()).isEqualTo(Level.INFO);
        assertThat(config.getTheme()).isNull();
        assertThat(config.getColorMode()).isEqualTo(ColorMode.AUTO);
        assertThat(config.getFormatErrorPolicy()).isEqualTo(FormatErrorPolicy.RAISE);
        assertThat(config.getFormatter()).isEqualTo(RedlogConfig.FormatterType.DEFAULT);
        assertThat(config.getOutput()).isEqualTo(RedlogConfig.Output.STDERR);
    }

    @Nested
    @DisplayName("Environment")
    class EnvironmentTests {

        @Test
        @DisplayName("should read REDLOG_* variables")
        void shouldReadVariables() {
            Map<String, String> env = Map.of(
                    "REDLOG_LEVEL", "dbg",
                    "REDLOG_THEME", "plain",
                    "REDLOG_COLOR", "never",
                    "REDLOG_FORMAT", "json",
                    "REDLOG_FILE", "/var/log/app.log");

            RedlogConfig config = RedlogConfig.fromEnvironment(env::get);

            assertThat(config.getLevel()).isEqualTo(Level.DEBUG);
            assertThat(config.getTheme()).isSameAs(Themes.PLAIN);
            assertThat(config.getColorMode()).isEqualTo(ColorMode.NEVER);
            assertThat(config.getFormatter()).isEqualTo(RedlogConfig.FormatterType.JSON);
            assertThat(config.getOutput()).isEqualTo(RedlogConfig.Output.FILE);
            assertThat(config.getFilePath()).isEqualTo("/var/log/app.log");
        }

        @Test
        @DisplayName("should fall back to defaults for unset or blank variables")
        void shouldFallBackToDefaults() {
            RedlogConfig config = RedlogConfig.fromEnvironment(Map.of("REDLOG_LEVEL", " ")::get);

            assertThat(config.getLevel()).isEqualTo(Level.INFO);
            assertThat(config.getOutput()).isEqualTo(RedlogConfig.Output.STDERR);
        }

        @Test
        @DisplayName("should reject invalid values")
        void shouldRejectInvalid() {
            assertThatThrownBy(() -> RedlogConfig.fromEnvironment(Map.of("REDLOG_COLOR", "sometimes")::get))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("ColorMode");
            assertThatThrownBy(() -> RedlogConfig.fromEnvironment(Map.of("REDLOG_LEVEL", "fatal")::get))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
