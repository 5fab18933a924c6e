package io.github.hongjungwan.redlog.api.field;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 필드 값. {@link Kind} 태그로 닫힌 5가지 타입만 허용한다.
 *
 * <p>INTEGER는 {@code Long} 또는 {@code BigInteger}, FLOAT는 {@code Double}, {@code Float}
 * 또는 {@code BigDecimal}을 원본 그대로 보관한다. 렌더링 시 정밀도를 잃지 않기 위함.</p>
 */
public final class FieldValue {

    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        NULL
    }

    private static final FieldValue NULL_VALUE = new FieldValue(Kind.NULL, null);
    private static final FieldValue TRUE_VALUE = new FieldValue(Kind.BOOLEAN, Boolean.TRUE);
    private static final FieldValue FALSE_VALUE = new FieldValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object raw;

    private FieldValue(Kind kind, Object raw) {
        this.kind = kind;
        this.raw = raw;
    }

    public static FieldValue ofString(String value) {
        return value == null ? NULL_VALUE : new FieldValue(Kind.STRING, value);
    }

    public static FieldValue ofInteger(long value) {
        return new FieldValue(Kind.INTEGER, value);
    }

    public static FieldValue ofFloat(double value) {
        return new FieldValue(Kind.FLOAT, value);
    }

    public static FieldValue ofBoolean(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    public static FieldValue ofNull() {
        return NULL_VALUE;
    }

    /**
     * 임의 객체를 지원 타입으로 분류. 지원하지 않는 타입은 문자열로 변환하지 않고 거부한다.
     *
     * @throws Field.InvalidFieldValueException 지원하지 않는 타입
     */
    public static FieldValue of(Object value) {
        if (value == null) {
            return NULL_VALUE;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new FieldValue(Kind.STRING, value.toString());
        }
        if (value instanceof Boolean) {
            return ofBoolean((Boolean) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ofInteger(((Number) value).longValue());
        }
        if (value instanceof AtomicInteger || value instanceof AtomicLong) {
            return ofInteger(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            return new FieldValue(Kind.INTEGER, value);
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return new FieldValue(Kind.FLOAT, value);
        }
        throw new Field.InvalidFieldValueException(value.getClass());
    }

    public Kind getKind() {
        return kind;
    }

    /** 원본 값. NULL이면 {@code null} */
    public Object getRaw() {
        return raw;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue)) return false;
        FieldValue that = (FieldValue) o;
        return kind == that.kind && Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw);
    }

    @Override
    public String toString() {
        return kind + "(" + raw + ")";
    }
}
