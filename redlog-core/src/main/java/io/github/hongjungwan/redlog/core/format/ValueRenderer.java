package io.github.hongjungwan.redlog.core.format;

import io.github.hongjungwan.redlog.api.field.FieldValue;

import java.math.BigDecimal;

/**
 * 텍스트 포맷터 공용 필드 값 렌더링.
 *
 * <ul>
 *   <li>STRING: 비어 있거나 공백, {@code "}, {@code =} 포함 시 따옴표 + 이스케이프</li>
 *   <li>FLOAT: 지수 표기 없는 십진수, 소수부 항상 포함 ({@code 1.0}, {@code 3.14})</li>
 *   <li>NULL: {@code null}</li>
 * </ul>
 *
 * 메시지와 로거 이름은 따옴표 없이 제어 문자만 이스케이프해 한 줄을 유지한다.
 */
public final class ValueRenderer {

    private ValueRenderer() {}

    public static String render(FieldValue value) {
        return switch (value.getKind()) {
            case STRING -> renderString((String) value.getRaw());
            case INTEGER -> value.getRaw().toString();
            case FLOAT -> renderFloat((Number) value.getRaw());
            case BOOLEAN -> value.getRaw().toString();
            case NULL -> "null";
        };
    }

    /** 필드 키. 값과 같은 규칙으로 따옴표 처리해 {@code key=value} 경계가 모호하지 않게 한다. */
    public static String renderKey(String key) {
        return renderString(key);
    }

    /** 메시지, 로거 이름용. 제어 문자만 이스케이프 */
    public static String escapeText(String text) {
        if (!hasControl(text)) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            appendControlEscaped(sb, text.charAt(i));
        }
        return sb.toString();
    }

    static String renderString(String value) {
        if (!needsQuoting(value)) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> appendControlEscaped(sb, c);
            }
        }
        return sb.append('"').toString();
    }

    private static void appendControlEscaped(StringBuilder sb, char c) {
        switch (c) {
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            default -> {
                if (Character.isISOControl(c)) {
                    sb.append(String.format("\\u%04x", (int) c));
                } else {
                    sb.append(c);
                }
            }
        }
    }

    private static boolean hasControl(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isISOControl(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean needsQuoting(String value) {
        if (value.isEmpty()) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c) || c == '"' || c == '=') {
                return true;
            }
        }
        return false;
    }

    static String renderFloat(Number number) {
        if (number instanceof BigDecimal) {
            return withFraction(((BigDecimal) number).toPlainString());
        }
        double d = number.doubleValue();
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        // Float은 Float.toString 기준이어야 3.14f 가 3.140000104904175 로 늘어나지 않는다
        String shortest = number instanceof Float ? Float.toString(number.floatValue()) : Double.toString(d);
        String plain = new BigDecimal(shortest).stripTrailingZeros().toPlainString();
        return withFraction(plain);
    }

    private static String withFraction(String plain) {
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }
}
