package io.github.hongjungwan.redlog.api;

import java.util.Locale;

/**
 * 로그 레벨. 선언 순서가 심각도 순서(낮음 → 높음)이며 ordinal 비교로 필터링한다.
 */
public enum Level {

    ANNOYING("ayg"),
    PEDANTIC("ped"),
    DEBUG("dbg"),
    TRACE("trc"),
    VERBOSE("vrb"),
    INFO("inf"),
    WARN("wrn"),
    ERROR("err"),
    CRITICAL("crt");

    private final String shortName;
    private final String longName;

    Level(String shortName) {
        this.shortName = shortName;
        this.longName = name().toLowerCase(Locale.ROOT);
    }

    /** 3글자 약어 (crt, err, wrn, inf ...) */
    public String shortName() {
        return shortName;
    }

    /** 소문자 전체 이름 (critical, error ...) */
    public String longName() {
        return longName;
    }

    /** {@code this >= threshold} 이면 출력 대상 */
    public boolean isAtLeast(Level threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * 전체 이름 또는 약어를 대소문자 구분 없이 파싱.
     *
     * @throws IllegalArgumentException 알 수 없는 레벨
     */
    public static Level parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Level must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Level level : values()) {
            if (level.longName.equals(normalized) || level.shortName.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown log level: " + value);
    }
}
