package io.github.hongjungwan.redlog.test;

import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.Logger;
import io.github.hongjungwan.redlog.api.config.RedlogConfig;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.core.format.JsonFormatter;
import io.github.hongjungwan.redlog.core.internal.LogRegistry;
import io.github.hongjungwan.redlog.core.sink.StringSink;
import io.github.hongjungwan.redlog.spi.ColorSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static io.github.hongjungwan.redlog.test.LogLineAssert.assertThatLine;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Test LogLineAssert and LogCapture utilities
 */
class LogLineAssertTest {

    private static final String LINE =
            "14:03:07.412 [err] [app.db]    conn failed                                  host=db1 retry=3 note=\"a b\"";

    @Test
    void testColumns() {
        assertThatLine(LINE)
                .hasLevel(Level.ERROR)
                .hasLoggerName("app.db")
                .messageContains("conn failed")
                .hasNoAnsiEscapes();
    }

    @Test
    void testFields() {
        assertThatLine(LINE)
                .hasField("host", "db1")
                .hasField("retry", 3)
                .hasField("note", "a b")
                .hasFieldOnce("retry")
                .doesNotHaveField("missing");
    }

    @Test
    void testColoredLine() {
        String colored = "\u001B[90m14:03:07.412\u001B[0m \u001B[31m[err]\u001B[0m \u001B[96mretry\u001B[0m=\u001B[37m3\u001B[0m";

        assertThatLine(colored)
                .hasAnsiEscapes()
                .hasLevel(Level.ERROR)
                .hasField("retry", 3);
    }

    @Test
    void testMissingFieldThrows() {
        assertThatThrownBy(() ->
                assertThatLine(LINE).hasField("retry", 4)
        ).hasMessageContaining("Expected line to have field <retry=4>");
    }

    @Test
    void testDuplicateFieldThrows() {
        assertThatThrownBy(() ->
                assertThatLine("t [inf] [a] m a=1 a=2").hasFieldOnce("a")
        ).hasMessageContaining("exactly once");
    }

    @Test
    void testCaptureRestoresRegistry() {
        LogRegistry registry = new LogRegistry(ColorSupport.ALWAYS);
        StringSink original = new StringSink();
        registry.setSink(original);
        Logger logger = registry.getLogger("app").withName("db");

        try (LogCapture capture = LogCapture.install(registry)) {
            logger.error("conn failed", Field.of("retry", 3));

            capture.assertThatLastLine()
                    .hasLevel(Level.ERROR)
                    .hasLoggerName("app.db")
                    .hasField("retry", 3)
                    .hasNoAnsiEscapes();
        }

        logger.info("after");
        assertThat(original.getLines()).hasSize(1);
        assertThat(registry.getSink()).isSameAs(original);
    }

    @Test
    void testCaptureKeepsConfiguredFileOutput(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("app.log");
        LogRegistry registry = new LogRegistry(ColorSupport.NEVER);
        registry.configure(RedlogConfig.builder()
                .output(RedlogConfig.Output.FILE)
                .filePath(file.toString())
                .formatter(RedlogConfig.FormatterType.JSON)
                .build());
        Logger logger = registry.getLogger("app");

        try (LogCapture capture = LogCapture.install(registry)) {
            logger.warn("captured", Field.of("n", 1));

            capture.assertThatLastLine()
                    .hasLevel(Level.WARN)
                    .hasLoggerName("app")
                    .hasField("n", 1);
        }

        logger.info("after capture");

        assertThat(registry.getFormatter()).isInstanceOf(JsonFormatter.class);
        assertThat(Files.readAllLines(file)).singleElement().asString()
                .contains("\"message\":\"after capture\"");
        registry.reset();
    }
}
