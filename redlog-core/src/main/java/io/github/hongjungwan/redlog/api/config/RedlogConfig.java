package io.github.hongjungwan.redlog.api.config;

import io.github.hongjungwan.redlog.api.ColorMode;
import io.github.hongjungwan.redlog.api.FormatErrorPolicy;
import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.theme.Theme;
import io.github.hongjungwan.redlog.api.theme.Themes;
import lombok.Builder;
import lombok.Getter;

import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration for redlog
 */
@Getter
@Builder(toBuilder = true)
public class RedlogConfig {

    /**
     * Minimum level that reaches the sink
     */
    @Builder.Default
    private final Level level = Level.INFO;

    /**
     * Active theme. null: COLORIZED if the terminal supports color, PLAIN otherwise
     */
    private final Theme theme;

    /**
     * Whether escape sequences may be emitted
     */
    @Builder.Default
    private final ColorMode colorMode = ColorMode.AUTO;

    /**
     * Default printf mismatch handling for new loggers
     */
    @Builder.Default
    private final FormatErrorPolicy formatErrorPolicy = FormatErrorPolicy.RAISE;

    /**
     * Line layout
     */
    @Builder.Default
    private final FormatterType formatter = FormatterType.DEFAULT;

    /**
     * Output destination
     */
    @Builder.Default
    private final Output output = Output.STDERR;

    /**
     * Log file path (output = FILE only)
     */
    private final String filePath;

    public enum FormatterType {
        DEFAULT,
        COMPACT,
        JSON
    }

    public enum Output {
        STDERR,
        STDOUT,
        FILE
    }

    public static RedlogConfig defaultConfig() {
        return RedlogConfig.builder().build();
    }

    /**
     * REDLOG_LEVEL, REDLOG_THEME, REDLOG_COLOR, REDLOG_FORMAT, REDLOG_FILE 환경 변수에서 설정 생성.
     * 지정되지 않은 항목은 기본값.
     */
    public static RedlogConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * @throws IllegalArgumentException 값이 잘못된 경우
     */
    public static RedlogConfig fromEnvironment(Function<String, String> environment) {
        RedlogConfigBuilder builder = RedlogConfig.builder();

        String level = environment.apply("REDLOG_LEVEL");
        if (hasText(level)) {
            builder.level(Level.parse(level));
        }

        String theme = environment.apply("REDLOG_THEME");
        if (hasText(theme)) {
            builder.theme(Themes.byName(theme));
        }

        String color = environment.apply("REDLOG_COLOR");
        if (hasText(color)) {
            builder.colorMode(parseEnum(ColorMode.class, color));
        }

        String format = environment.apply("REDLOG_FORMAT");
        if (hasText(format)) {
            builder.formatter(parseEnum(FormatterType.class, format));
        }

        String file = environment.apply("REDLOG_FILE");
        if (hasText(file)) {
            builder.output(Output.FILE).filePath(file);
        }

        return builder.build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + type.getSimpleName() + ": " + value, e);
        }
    }
}
