package io.github.hongjungwan.redlog.api.domain;

import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.field.FieldSet;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * 렌더링 단위. 필터를 통과한 emit 한 번에 하나 생성되어 Formatter로 전달된다.
 */
@Getter
@Builder
public class LogEvent {

    /** 발생 시각 */
    private final Instant timestamp;

    /** 타임스탬프 표시용 타임존 */
    @Builder.Default
    private final ZoneId zone = ZoneId.systemDefault();

    private final Level level;

    /** 점(.)으로 연결된 이름 경로. 루트 로거 이름이 비어 있으면 빈 문자열 */
    @Builder.Default
    private final String loggerName = "";

    @Builder.Default
    private final String message = "";

    /** 누적 필드 + 호출 필드 (중복 키 포함, 누적 순서) */
    @Builder.Default
    private final FieldSet fields = FieldSet.empty();

    /** 중복 키가 해소된 렌더링 순서의 필드 */
    public List<Field> resolvedFields() {
        return fields.resolved();
    }
}
