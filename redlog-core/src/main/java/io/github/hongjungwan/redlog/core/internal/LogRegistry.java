package io.github.hongjungwan.redlog.core.internal;

import io.github.hongjungwan.redlog.api.ColorMode;
import io.github.hongjungwan.redlog.api.FormatErrorPolicy;
import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.Logger;
import io.github.hongjungwan.redlog.api.config.RedlogConfig;
import io.github.hongjungwan.redlog.api.theme.Theme;
import io.github.hongjungwan.redlog.api.theme.Themes;
import io.github.hongjungwan.redlog.core.color.EnvironmentColorSupport;
import io.github.hongjungwan.redlog.core.format.CompactFormatter;
import io.github.hongjungwan.redlog.core.format.DefaultFormatter;
import io.github.hongjungwan.redlog.core.format.JsonFormatter;
import io.github.hongjungwan.redlog.core.sink.ConsoleSink;
import io.github.hongjungwan.redlog.core.sink.FileSink;
import io.github.hongjungwan.redlog.spi.ColorSupport;
import io.github.hongjungwan.redlog.spi.Formatter;
import io.github.hongjungwan.redlog.spi.Sink;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 전역 로깅 설정 (최소 레벨, 테마, 포맷터, Sink, 색상 모드).
 *
 * <p>각 항목은 독립된 volatile 셀이다. 쓰기는 {@link ReentrantLock}으로 직렬화하고 읽기는 락 없이
 * 이전 값 또는 새 값 중 하나를 원자적으로 본다. 로거는 값을 캐시하지 않고 emit마다 다시 읽는다.</p>
 *
 * <p>모든 Sink 쓰기는 프로세스 전역 {@link #WRITE_LOCK} 아래에서 일어나므로
 * 서로 다른 스레드의 줄이 섞이지 않는다.</p>
 */
@Slf4j
public final class LogRegistry {

    private static final ReentrantLock WRITE_LOCK = new ReentrantLock();

    private final ReentrantLock configLock = new ReentrantLock();
    private final ColorSupport colorSupport;

    private volatile Level level = Level.INFO;
    private volatile Theme theme;
    private volatile Formatter formatter = new DefaultFormatter();
    private volatile Sink sink = ConsoleSink.stderr();
    private volatile ColorMode colorMode = ColorMode.AUTO;
    private volatile boolean colorSupported;
    private volatile Clock clock = Clock.systemDefaultZone();
    private volatile FormatErrorPolicy formatErrorPolicy = FormatErrorPolicy.RAISE;

    /** configure()로 생성한 Sink. 다음 configure/reset 때 닫는다. */
    private Sink ownedSink;

    public LogRegistry() {
        this(new EnvironmentColorSupport());
    }

    public LogRegistry(ColorSupport colorSupport) {
        this.colorSupport = Objects.requireNonNull(colorSupport, "colorSupport");
        this.colorSupported = colorSupport.supportsColor();
        this.theme = automaticTheme();
    }

    /** 전역 인스턴스. 최초 접근 시 REDLOG_* 환경 변수를 적용해 초기화. */
    public static LogRegistry getInstance() {
        return Holder.INSTANCE;
    }

    // ---- level ----

    public Level getLevel() {
        return level;
    }

    public void setLevel(Level level) {
        Objects.requireNonNull(level, "level");
        update(() -> this.level = level);
        log.debug("Minimum level set to {}", level);
    }

    // ---- theme ----

    public Theme getTheme() {
        return theme;
    }

    public void setTheme(Theme theme) {
        Objects.requireNonNull(theme, "theme");
        update(() -> this.theme = theme);
        log.debug("Theme set to {}", theme.getName());
    }

    // ---- formatter ----

    public Formatter getFormatter() {
        return formatter;
    }

    public void setFormatter(Formatter formatter) {
        Objects.requireNonNull(formatter, "formatter");
        update(() -> this.formatter = formatter);
        log.debug("Formatter set to {}", formatter.getClass().getSimpleName());
    }

    // ---- sink ----

    public Sink getSink() {
        return sink;
    }

    /**
     * 출력 Sink 교체. 호출자가 넘긴 Sink의 수명은 호출자가 관리한다.
     *
     * <p>{@link #configure}로 연 파일 Sink는 여기서 닫지 않는다. 다음 {@code configure} 또는
     * {@link #reset} 때 닫히므로 잠시 교체했다가 되돌려도 계속 쓸 수 있다.</p>
     */
    public void setSink(Sink sink) {
        Objects.requireNonNull(sink, "sink");
        update(() -> this.sink = sink);
        log.debug("Sink set to {}", sink);
    }

    // ---- color ----

    public ColorMode getColorMode() {
        return colorMode;
    }

    public void setColorMode(ColorMode colorMode) {
        Objects.requireNonNull(colorMode, "colorMode");
        update(() -> this.colorMode = colorMode);
        log.debug("Color mode set to {}", colorMode);
    }

    /** 오라클이 마지막으로 보고한 색상 지원 여부 */
    public boolean isColorSupported() {
        return colorSupported;
    }

    /** 렌더링 시 escape sequence 허용 여부 */
    public boolean isColorEnabled() {
        return switch (colorMode) {
            case ALWAYS -> true;
            case NEVER -> false;
            case AUTO -> colorSupported;
        };
    }

    /** 색상 지원 여부를 다시 조회 (테마는 바꾸지 않음) */
    public boolean redetectColorSupport() {
        boolean supported = colorSupport.supportsColor();
        update(() -> this.colorSupported = supported);
        log.debug("Color support re-detected: {}", supported);
        return supported;
    }

    // ---- misc ----

    public FormatErrorPolicy getFormatErrorPolicy() {
        return formatErrorPolicy;
    }

    /** 이후 생성되는 로거의 기본 printf 불일치 처리 방식 */
    public void setFormatErrorPolicy(FormatErrorPolicy formatErrorPolicy) {
        Objects.requireNonNull(formatErrorPolicy, "formatErrorPolicy");
        update(() -> this.formatErrorPolicy = formatErrorPolicy);
    }

    public void setClock(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        update(() -> this.clock = clock);
    }

    Instant now() {
        return clock.instant();
    }

    ZoneId zone() {
        return clock.getZone();
    }

    // ---- loggers ----

    public Logger getLogger(String name) {
        return getLogger(name, formatErrorPolicy);
    }

    public Logger getLogger(String name, FormatErrorPolicy policy) {
        return ScopedLogger.root(this, name, policy);
    }

    // ---- configuration ----

    /**
     * 설정 전체 적용. 테마가 지정되지 않으면 색상 지원 여부로 자동 선택.
     *
     * @throws java.io.UncheckedIOException 로그 파일을 열 수 없음
     * @throws IllegalArgumentException      FILE 출력인데 경로가 없음
     */
    public void configure(RedlogConfig config) {
        Objects.requireNonNull(config, "config");
        Sink newSink = createSink(config);
        Formatter newFormatter = createFormatter(config.getFormatter());

        Sink previousOwned;
        configLock.lock();
        try {
            this.level = config.getLevel();
            this.colorMode = config.getColorMode();
            this.theme = config.getTheme() != null ? config.getTheme() : automaticTheme();
            this.formatErrorPolicy = config.getFormatErrorPolicy();
            this.formatter = newFormatter;
            this.sink = newSink;
            previousOwned = ownedSink;
            ownedSink = config.getOutput() == RedlogConfig.Output.FILE ? newSink : null;
        } finally {
            configLock.unlock();
        }
        closeQuietlyAfterSwap(previousOwned);

        log.debug("Configured: level={}, theme={}, colorMode={}, formatter={}, output={}",
                config.getLevel(), theme.getName(), config.getColorMode(), config.getFormatter(), config.getOutput());
    }

    /** 기본값 복원 (INFO, 자동 테마, DefaultFormatter, stderr, AUTO) */
    public void reset() {
        configure(RedlogConfig.defaultConfig());
        setClock(Clock.systemDefaultZone());
    }

    /**
     * 전역 쓰기 락 아래에서 한 줄 기록. Sink 실패는 그대로 전파된다.
     *
     * <p>레지스트리 Sink는 락을 잡은 뒤에 읽는다. 교체된 Sink는 같은 락 아래에서 닫히므로
     * 진행 중인 쓰기가 닫힌 Sink를 만나지 않는다.</p>
     *
     * @param override 로거 전용 Sink, 없으면 null
     */
    void write(Sink override, String line) {
        WRITE_LOCK.lock();
        try {
            Sink target = override != null ? override : sink;
            target.write(line);
        } finally {
            WRITE_LOCK.unlock();
        }
    }

    private Theme automaticTheme() {
        return colorSupported ? Themes.COLORIZED : Themes.PLAIN;
    }

    private void update(Runnable mutation) {
        configLock.lock();
        try {
            mutation.run();
        } finally {
            configLock.unlock();
        }
    }

    private static Sink createSink(RedlogConfig config) {
        return switch (config.getOutput()) {
            case STDERR -> ConsoleSink.stderr();
            case STDOUT -> ConsoleSink.stdout();
            case FILE -> {
                if (config.getFilePath() == null || config.getFilePath().isBlank()) {
                    throw new IllegalArgumentException("filePath is required for FILE output");
                }
                yield new FileSink(Paths.get(config.getFilePath()));
            }
        };
    }

    private static Formatter createFormatter(RedlogConfig.FormatterType type) {
        return switch (type) {
            case DEFAULT -> new DefaultFormatter();
            case COMPACT -> new CompactFormatter();
            case JSON -> new JsonFormatter();
        };
    }

    private void closeQuietlyAfterSwap(Sink previous) {
        if (previous == null) {
            return;
        }
        WRITE_LOCK.lock();
        try {
            previous.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close previous sink {}: {}", previous, e.getMessage());
        } finally {
            WRITE_LOCK.unlock();
        }
    }

    private static final class Holder {
        private static final LogRegistry INSTANCE = create();

        private static LogRegistry create() {
            LogRegistry registry = new LogRegistry();
            try {
                registry.configure(RedlogConfig.fromEnvironment());
            } catch (RuntimeException e) {
                log.warn("Ignoring invalid REDLOG_* environment configuration: {}", e.getMessage());
            }
            return registry;
        }
    }
}
