package io.github.hongjungwan.redlog.api;

import io.github.hongjungwan.redlog.api.config.RedlogConfig;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.theme.Theme;
import io.github.hongjungwan.redlog.core.format.Printf;
import io.github.hongjungwan.redlog.core.internal.LogRegistry;
import io.github.hongjungwan.redlog.spi.Formatter;
import io.github.hongjungwan.redlog.spi.Sink;

/**
 * redlog 진입점. 전역 {@link LogRegistry}에 위임한다.
 */
public final class Redlog {

    private Redlog() {}

    /** 이름 기반 루트 로거. 같은 이름으로 여러 번 호출하면 서로 독립적이고 동등한 로거가 반환된다. */
    public static Logger getLogger(String name) {
        return registry().getLogger(name);
    }

    /** 클래스 기반 로거 ({@link Class#getSimpleName()}) */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getSimpleName());
    }

    /** printf 불일치 처리 방식을 지정한 루트 로거 */
    public static Logger getLogger(String name, FormatErrorPolicy policy) {
        return registry().getLogger(name, policy);
    }

    /**
     * 필드 생성.
     *
     * @throws Field.InvalidFieldValueException 지원하지 않는 값 타입
     */
    public static Field field(String key, Object value) {
        return Field.of(key, value);
    }

    public static void setLevel(Level level) {
        registry().setLevel(level);
    }

    public static Level getLevel() {
        return registry().getLevel();
    }

    public static void setTheme(Theme theme) {
        registry().setTheme(theme);
    }

    public static Theme getTheme() {
        return registry().getTheme();
    }

    public static void setSink(Sink sink) {
        registry().setSink(sink);
    }

    public static void setFormatter(Formatter formatter) {
        registry().setFormatter(formatter);
    }

    public static void setColorMode(ColorMode colorMode) {
        registry().setColorMode(colorMode);
    }

    public static void configure(RedlogConfig config) {
        registry().configure(config);
    }

    /** 전역 설정을 기본값으로 복원 */
    public static void reset() {
        registry().reset();
    }

    /** 실패 시 예외 대신 {@code [format error: ...]}를 반환하는 printf 포맷 */
    public static String fmt(String format, Object... args) {
        return Printf.formatLenient(format, args);
    }

    public static LogRegistry registry() {
        return LogRegistry.getInstance();
    }
}
