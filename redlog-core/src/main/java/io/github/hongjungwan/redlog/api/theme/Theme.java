package io.github.hongjungwan.redlog.api.theme;

import io.github.hongjungwan.redlog.api.Level;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.stream.Stream;

/**
 * 출력 테마. 레벨별 색상, 구성 요소 색상, 정렬 레이아웃을 정의하며 생성 후 변경 불가.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
public class Theme {

    /**
     * 테마 이름 (설정/진단용)
     */
    @Builder.Default
    private final String name = "custom";

    @Builder.Default
    private final AnsiColor criticalColor = AnsiColor.BRIGHT_MAGENTA;

    @Builder.Default
    private final AnsiColor errorColor = AnsiColor.RED;

    @Builder.Default
    private final AnsiColor warnColor = AnsiColor.YELLOW;

    @Builder.Default
    private final AnsiColor infoColor = AnsiColor.GREEN;

    @Builder.Default
    private final AnsiColor verboseColor = AnsiColor.BLUE;

    @Builder.Default
    private final AnsiColor traceColor = AnsiColor.WHITE;

    @Builder.Default
    private final AnsiColor debugColor = AnsiColor.BRIGHT_BLACK;

    @Builder.Default
    private final AnsiColor pedanticColor = AnsiColor.BRIGHT_BLACK;

    @Builder.Default
    private final AnsiColor annoyingColor = AnsiColor.BRIGHT_BLACK;

    /**
     * 레벨 배지 배경색. 기본값은 모두 배경 없음
     */
    @Builder.Default
    private final AnsiColor criticalBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor errorBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor warnBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor infoBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor verboseBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor traceBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor debugBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor pedanticBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor annoyingBackground = AnsiColor.NONE;

    @Builder.Default
    private final AnsiColor timestampColor = AnsiColor.BRIGHT_BLACK;

    @Builder.Default
    private final AnsiColor loggerNameColor = AnsiColor.CYAN;

    @Builder.Default
    private final AnsiColor messageColor = AnsiColor.WHITE;

    @Builder.Default
    private final AnsiColor fieldKeyColor = AnsiColor.BRIGHT_CYAN;

    @Builder.Default
    private final AnsiColor fieldValueColor = AnsiColor.WHITE;

    /**
     * 로거 이름 컬럼 폭 ({@code [name]} 포함)
     */
    @Builder.Default
    private final int loggerNameWidth = 12;

    /**
     * 필드가 있을 때 메시지 컬럼 폭. 0이면 패딩 없음
     */
    @Builder.Default
    private final int messageWidth = 44;

    /**
     * 레벨 배지를 최대 폭으로 패딩
     */
    @Builder.Default
    private final boolean padLevel = true;

    /**
     * {@link java.time.format.DateTimeFormatter} 패턴
     */
    @Builder.Default
    private final String timestampPattern = "HH:mm:ss.SSS";

    /** 레벨별 전경색 */
    public AnsiColor levelColor(Level level) {
        return switch (level) {
            case CRITICAL -> criticalColor;
            case ERROR -> errorColor;
            case WARN -> warnColor;
            case INFO -> infoColor;
            case VERBOSE -> verboseColor;
            case TRACE -> traceColor;
            case DEBUG -> debugColor;
            case PEDANTIC -> pedanticColor;
            case ANNOYING -> annoyingColor;
        };
    }

    /** 레벨별 배경색 */
    public AnsiColor levelBackground(Level level) {
        return switch (level) {
            case CRITICAL -> criticalBackground;
            case ERROR -> errorBackground;
            case WARN -> warnBackground;
            case INFO -> infoBackground;
            case VERBOSE -> verboseBackground;
            case TRACE -> traceBackground;
            case DEBUG -> debugBackground;
            case PEDANTIC -> pedanticBackground;
            case ANNOYING -> annoyingBackground;
        };
    }

    /** 하나라도 색상이 지정되어 있으면 true. PLAIN 테마는 false. */
    public boolean isColorized() {
        return Stream.of(criticalColor, errorColor, warnColor, infoColor, verboseColor, traceColor,
                        debugColor, pedanticColor, annoyingColor, criticalBackground, errorBackground,
                        warnBackground, infoBackground, verboseBackground, traceBackground, debugBackground,
                        pedanticBackground, annoyingBackground, timestampColor,
                        loggerNameColor, messageColor, fieldKeyColor, fieldValueColor)
                .anyMatch(color -> color != null && !color.isNone());
    }
}
