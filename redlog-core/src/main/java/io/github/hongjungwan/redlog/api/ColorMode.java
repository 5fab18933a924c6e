package io.github.hongjungwan.redlog.api;

/**
 * ANSI escape 출력 여부 결정 방식.
 */
public enum ColorMode {
    /** {@link io.github.hongjungwan.redlog.spi.ColorSupport} 결과를 따름 */
    AUTO,
    /** 항상 색상 출력 (테마가 색상을 가진 경우) */
    ALWAYS,
    /** 색상 출력 안 함 */
    NEVER
}
