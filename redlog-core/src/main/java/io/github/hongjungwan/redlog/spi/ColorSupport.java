package io.github.hongjungwan.redlog.spi;

/**
 * 터미널 색상 지원 여부 오라클. 레지스트리 초기화 시 한 번 조회된다.
 */
@FunctionalInterface
public interface ColorSupport {

    ColorSupport ALWAYS = () -> true;

    ColorSupport NEVER = () -> false;

    /** 현재 출력 대상이 ANSI 색상을 지원하면 true */
    boolean supportsColor();
}
