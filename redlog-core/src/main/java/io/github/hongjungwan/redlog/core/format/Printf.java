package io.github.hongjungwan.redlog.core.format;

import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * printf 스타일 메시지 포맷. {@link String#format}과 같은 문법이지만 인자 개수 불일치를
 * 엄격하게 검사한다 (남는 인자도 오류).
 *
 * <p>{@link Locale#ROOT} 기준으로 포맷하므로 소수점 표기는 로케일에 따라 바뀌지 않는다.</p>
 */
public final class Printf {

    // java.util.Formatter 의 format specifier 문법
    private static final Pattern SPECIFIER =
            Pattern.compile("%(\\d+\\$)?([-#+ 0,(<]*)?(\\d+)?(\\.\\d+)?([tT])?([a-zA-Z%])");

    private static final Object[] NO_ARGS = new Object[0];

    private Printf() {}

    /**
     * @throws FormatMismatchException 플레이스홀더와 인자가 맞지 않음
     */
    public static String format(String format, Object... args) {
        Objects.requireNonNull(format, "format");
        Object[] actualArgs = args == null ? NO_ARGS : args;

        int consumed = countConsumedArguments(format);
        if (actualArgs.length > consumed) {
            throw new FormatMismatchException(format,
                    "not all arguments converted (" + consumed + " placeholders, "
                            + actualArgs.length + " arguments)", null);
        }

        try {
            return String.format(Locale.ROOT, format, actualArgs);
        } catch (IllegalFormatException e) {
            throw new FormatMismatchException(format, describe(e), e);
        }
    }

    /**
     * 실패 시 예외 대신 {@code [format error: ...]} 마커를 반환.
     */
    public static String formatLenient(String format, Object... args) {
        try {
            return format(format, args);
        } catch (FormatMismatchException e) {
            return errorMarker(e);
        }
    }

    /** {@code [format error: <detail>]} */
    public static String errorMarker(FormatMismatchException e) {
        return "[format error: " + e.getDetail() + "]";
    }

    /** 포맷 문자열이 소비하는 인자 수. 명시적 인덱스는 최대값 기준. */
    static int countConsumedArguments(String format) {
        Matcher matcher = SPECIFIER.matcher(format);
        int ordinary = 0;
        int maxExplicit = 0;
        while (matcher.find()) {
            char conversion = matcher.group(6).charAt(0);
            if (conversion == '%' || conversion == 'n') {
                continue;
            }
            String explicitIndex = matcher.group(1);
            String flags = matcher.group(2);
            if (flags != null && flags.indexOf('<') >= 0) {
                continue;
            }
            if (explicitIndex != null) {
                int index = Integer.parseInt(explicitIndex.substring(0, explicitIndex.length() - 1));
                maxExplicit = Math.max(maxExplicit, index);
            } else {
                ordinary++;
            }
        }
        return Math.max(ordinary, maxExplicit);
    }

    private static String describe(IllegalFormatException e) {
        String message = e.getMessage();
        String type = e.getClass().getSimpleName();
        return message == null ? type : type + ": " + message;
    }

    /**
     * printf 인자 불일치. 호출자 버그이므로 기본적으로 전파된다.
     */
    public static class FormatMismatchException extends RuntimeException {

        private final String format;
        private final String detail;

        public FormatMismatchException(String format, String detail, Throwable cause) {
            super("Format mismatch for \"" + format + "\": " + detail, cause);
            this.format = format;
            this.detail = detail;
        }

        public String getFormat() {
            return format;
        }

        public String getDetail() {
            return detail;
        }
    }
}
