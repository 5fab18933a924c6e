package io.github.hongjungwan.redlog.api;

/**
 * printf 스타일 메서드의 인자 불일치 처리 방식.
 */
public enum FormatErrorPolicy {
    /** {@code Printf.FormatMismatchException} 전파 (기본) */
    RAISE,
    /** 메시지에 {@code [format error: ...]} 마커를 넣어 출력 */
    INLINE_MARKER
}
