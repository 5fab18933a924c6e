package io.github.hongjungwan.redlog.api.theme;

import java.util.Locale;

/**
 * 내장 테마 모음.
 */
public final class Themes {

    /** 레벨별 색상 테마 */
    public static final Theme COLORIZED = Theme.builder()
            .name("colorized")
            .build();

    /** {@link #COLORIZED}와 동일 */
    public static final Theme DEFAULT = COLORIZED;

    /** 색상 없음. 레이아웃은 COLORIZED와 동일 */
    public static final Theme PLAIN = Theme.builder()
            .name("plain")
            .criticalColor(AnsiColor.NONE)
            .errorColor(AnsiColor.NONE)
            .warnColor(AnsiColor.NONE)
            .infoColor(AnsiColor.NONE)
            .verboseColor(AnsiColor.NONE)
            .traceColor(AnsiColor.NONE)
            .debugColor(AnsiColor.NONE)
            .pedanticColor(AnsiColor.NONE)
            .annoyingColor(AnsiColor.NONE)
            .criticalBackground(AnsiColor.NONE)
            .errorBackground(AnsiColor.NONE)
            .warnBackground(AnsiColor.NONE)
            .infoBackground(AnsiColor.NONE)
            .verboseBackground(AnsiColor.NONE)
            .traceBackground(AnsiColor.NONE)
            .debugBackground(AnsiColor.NONE)
            .pedanticBackground(AnsiColor.NONE)
            .annoyingBackground(AnsiColor.NONE)
            .timestampColor(AnsiColor.NONE)
            .loggerNameColor(AnsiColor.NONE)
            .messageColor(AnsiColor.NONE)
            .fieldKeyColor(AnsiColor.NONE)
            .fieldValueColor(AnsiColor.NONE)
            .build();

    private Themes() {}

    /**
     * 이름으로 내장 테마 조회 (plain, colorized, default).
     *
     * @throws IllegalArgumentException 알 수 없는 이름
     */
    public static Theme byName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Theme name must not be blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "plain", "none", "mono" -> PLAIN;
            case "colorized", "color", "default" -> COLORIZED;
            default -> throw new IllegalArgumentException("Unknown theme: " + name);
        };
    }
}
