package io.github.hongjungwan.redlog.api.field;

import java.util.Objects;

/**
 * 구조화 로그의 key=value 한 쌍. 생성 후 변경 불가, 구조적 동등성.
 */
public record Field(String key, FieldValue value) {

    public static final String ERROR_KEY = "error";

    public Field {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Field key must not be blank");
        }
        Objects.requireNonNull(value, "value");
    }

    public static Field of(String key, String value) {
        return new Field(key, FieldValue.ofString(value));
    }

    /** {@code char}가 {@code long} 오버로드로 넓혀지지 않도록 문자열로 저장 */
    public static Field of(String key, char value) {
        return new Field(key, FieldValue.ofString(String.valueOf(value)));
    }

    public static Field of(String key, long value) {
        return new Field(key, FieldValue.ofInteger(value));
    }

    public static Field of(String key, double value) {
        return new Field(key, FieldValue.ofFloat(value));
    }

    public static Field of(String key, boolean value) {
        return new Field(key, FieldValue.ofBoolean(value));
    }

    /**
     * 타입을 모르는 값용 팩토리.
     *
     * @throws InvalidFieldValueException 문자열, 정수, 실수, 불리언, null 이외의 값
     */
    public static Field of(String key, Object value) {
        return new Field(key, FieldValue.of(value));
    }

    public static Field ofNull(String key) {
        return new Field(key, FieldValue.ofNull());
    }

    /** 예외를 {@code error="SimpleName: message"} 문자열 필드로 */
    public static Field ofThrowable(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable");
        return of(ERROR_KEY, throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }

    @Override
    public String toString() {
        return key + "=" + value.getRaw();
    }

    /**
     * 지원하지 않는 값 타입. 필드 생성 시점에 항상 호출자에게 전달된다.
     */
    public static class InvalidFieldValueException extends RuntimeException {

        private final Class<?> valueType;

        public InvalidFieldValueException(Class<?> valueType) {
            super("Unsupported field value type: " + valueType.getName()
                    + " (expected string, integer, float, boolean or null)");
            this.valueType = valueType;
        }

        public Class<?> getValueType() {
            return valueType;
        }
    }
}
