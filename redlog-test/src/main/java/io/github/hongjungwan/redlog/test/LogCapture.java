package io.github.hongjungwan.redlog.test;

import io.github.hongjungwan.redlog.api.ColorMode;
import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.theme.Theme;
import io.github.hongjungwan.redlog.api.theme.Themes;
import io.github.hongjungwan.redlog.core.format.DefaultFormatter;
import io.github.hongjungwan.redlog.core.internal.LogRegistry;
import io.github.hongjungwan.redlog.core.sink.StringSink;
import io.github.hongjungwan.redlog.spi.Formatter;
import io.github.hongjungwan.redlog.spi.Sink;

import java.util.List;

/**
 * 레지스트리 출력을 메모리로 캡처. close 시 이전 Sink, 포맷터, 테마, 색상 모드, 레벨을 복원한다.
 *
 * <pre>{@code
 * try (LogCapture capture = LogCapture.install(LogRegistry.getInstance())) {
 *     logger.info("ready");
 *     capture.assertThatLastLine().hasLevel(Level.INFO);
 * }
 * }</pre>
 */
public final class LogCapture implements AutoCloseable {

    private final LogRegistry registry;
    private final StringSink sink = new StringSink();

    private final Sink previousSink;
    private final Formatter previousFormatter;
    private final Theme previousTheme;
    private final ColorMode previousColorMode;
    private final Level previousLevel;

    private LogCapture(LogRegistry registry) {
        this.registry = registry;
        this.previousSink = registry.getSink();
        this.previousFormatter = registry.getFormatter();
        this.previousTheme = registry.getTheme();
        this.previousColorMode = registry.getColorMode();
        this.previousLevel = registry.getLevel();

        registry.setSink(sink);
        registry.setFormatter(new DefaultFormatter());
        registry.setTheme(Themes.PLAIN);
        registry.setColorMode(ColorMode.NEVER);
    }

    /** 기본 포맷터, PLAIN 테마, 색상 없음으로 캡처 시작 */
    public static LogCapture install(LogRegistry registry) {
        return new LogCapture(registry);
    }

    public static LogCapture installGlobal() {
        return install(LogRegistry.getInstance());
    }

    public List<String> getLines() {
        return sink.getLines();
    }

    public String lastLine() {
        List<String> lines = sink.getLines();
        if (lines.isEmpty()) {
            throw new AssertionError("No log line was captured");
        }
        return lines.get(lines.size() - 1);
    }

    public LogLineAssert assertThatLastLine() {
        return LogLineAssert.assertThatLine(lastLine());
    }

    public int size() {
        return sink.size();
    }

    public void clear() {
        sink.clear();
    }

    @Override
    public void close() {
        registry.setSink(previousSink);
        registry.setFormatter(previousFormatter);
        registry.setTheme(previousTheme);
        registry.setColorMode(previousColorMode);
        registry.setLevel(previousLevel);
    }
}
