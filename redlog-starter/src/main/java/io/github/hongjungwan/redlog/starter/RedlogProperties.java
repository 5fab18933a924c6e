package io.github.hongjungwan.redlog.starter;

import io.github.hongjungwan.redlog.api.ColorMode;
import io.github.hongjungwan.redlog.api.FormatErrorPolicy;
import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.config.RedlogConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * redlog 설정 Properties (prefix: redlog).
 */
@Data
@ConfigurationProperties(prefix = "redlog")
public class RedlogProperties {

    /** 자동 설정 활성화 여부 */
    private boolean enabled = true;

    /** 최소 출력 레벨 */
    private Level level = Level.INFO;

    /** 테마 이름 (plain, colorized). 비어 있으면 터미널 색상 지원 여부로 자동 선택 */
    private String theme;

    /** 색상 모드: AUTO, ALWAYS, NEVER */
    private ColorMode color = ColorMode.AUTO;

    /** 줄 포맷: DEFAULT, COMPACT, JSON */
    private RedlogConfig.FormatterType formatter = RedlogConfig.FormatterType.DEFAULT;

    /** 출력 대상: STDERR, STDOUT, FILE */
    private RedlogConfig.Output output = RedlogConfig.Output.STDERR;

    /** output=FILE 일 때 로그 파일 경로 */
    private String filePath;

    /** printf 인자 불일치 처리: RAISE, INLINE_MARKER */
    private FormatErrorPolicy formatErrorPolicy = FormatErrorPolicy.RAISE;

    /** Logback 브리지 설정 */
    private BridgeProperties bridge = new BridgeProperties();

    @Data
    public static class BridgeProperties {
        /** SLF4J/Logback 이벤트를 redlog로 출력 */
        private boolean enabled = false;

        /** MDC 항목을 필드로 포함 */
        private boolean includeMdc = true;
    }
}
