package io.github.hongjungwan.redlog.spi;

import io.github.hongjungwan.redlog.api.domain.LogEvent;
import io.github.hongjungwan.redlog.api.theme.Theme;

/**
 * 렌더링 전략 SPI. 상태 없는 순수 함수여야 한다.
 *
 * <p>모든 구현은 필드를 {@link LogEvent#resolvedFields()} 순서로, 즉 키별 마지막 값만
 * 마지막 등장 위치에 출력해야 한다.</p>
 */
@FunctionalInterface
public interface Formatter {

    /**
     * @param event        렌더링할 이벤트
     * @param theme        현재 테마
     * @param colorEnabled 출력 대상이 ANSI 색상을 지원하는지 여부
     * @return 줄 종결자 없는 한 줄
     */
    String format(LogEvent event, Theme theme, boolean colorEnabled);
}
