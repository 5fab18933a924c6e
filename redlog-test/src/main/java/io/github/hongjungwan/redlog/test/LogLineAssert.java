package io.github.hongjungwan.redlog.test;

import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.field.FieldValue;
import io.github.hongjungwan.redlog.api.theme.AnsiColor;
import io.github.hongjungwan.redlog.core.format.ValueRenderer;
import org.assertj.core.api.AbstractAssert;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 렌더링된 로그 한 줄 검증용 Fluent API TestKit. AssertJ 스타일 메서드 체이닝 지원.
 *
 * 색상 escape sequence는 {@link #hasAnsiEscapes()} 외의 검증에서 제거 후 비교한다.
 */
public class LogLineAssert extends AbstractAssert<LogLineAssert, String> {

    private static final Pattern ANSI = Pattern.compile(Pattern.quote(AnsiColor.ESCAPE) + "[0-9;]*m");

    public LogLineAssert(String actual) {
        super(actual, LogLineAssert.class);
    }

    public static LogLineAssert assertThatLine(String actual) {
        return new LogLineAssert(actual);
    }

    /** escape sequence 제거 */
    public static String stripAnsi(String line) {
        return ANSI.matcher(line).replaceAll("");
    }

    private String visible() {
        return stripAnsi(actual);
    }

    /** 레벨 배지 ({@code [err]}) 검증 */
    public LogLineAssert hasLevel(Level level) {
        isNotNull();

        String badge = "[" + level.shortName() + "]";
        if (!visible().contains(badge)) {
            failWithMessage("Expected line to have level badge <%s> but was <%s>", badge, visible());
        }

        return this;
    }

    /** 로거 이름 컬럼 ({@code [app.db]}) 검증 */
    public LogLineAssert hasLoggerName(String name) {
        isNotNull();

        if (!visible().contains("[" + name + "]")) {
            failWithMessage("Expected line to have logger name <%s> but was <%s>", name, visible());
        }

        return this;
    }

    /** 메시지에 텍스트 포함 검증 */
    public LogLineAssert messageContains(String text) {
        isNotNull();

        if (!visible().contains(text)) {
            failWithMessage("Expected line to contain <%s> but was <%s>", text, visible());
        }

        return this;
    }

    /** 필드 존재 검증 (값은 텍스트 포맷터 규칙으로 렌더링해 비교) */
    public LogLineAssert hasField(String key, Object value) {
        isNotNull();

        String rendered = ValueRenderer.renderKey(key) + "=" + ValueRenderer.render(FieldValue.of(value));
        Pattern pattern = Pattern.compile("(?:^|\\s)" + Pattern.quote(rendered) + "(?=\\s|$)");
        if (!pattern.matcher(visible()).find()) {
            failWithMessage("Expected line to have field <%s> but was <%s>", rendered, visible());
        }

        return this;
    }

    /** 키가 정확히 한 번만 렌더링되었는지 검증 */
    public LogLineAssert hasFieldOnce(String key) {
        isNotNull();

        int count = countKey(key);
        if (count != 1) {
            failWithMessage("Expected field <%s> exactly once but found <%d> in <%s>", key, count, visible());
        }

        return this;
    }

    /** 키 부재 검증 */
    public LogLineAssert doesNotHaveField(String key) {
        isNotNull();

        if (countKey(key) > 0) {
            failWithMessage("Expected line not to have field <%s> but was <%s>", key, visible());
        }

        return this;
    }

    public LogLineAssert hasNoAnsiEscapes() {
        isNotNull();

        if (actual.contains(AnsiColor.ESCAPE)) {
            failWithMessage("Expected line without escape sequences but was <%s>", actual.replace("\u001B", "\\e"));
        }

        return this;
    }

    public LogLineAssert hasAnsiEscapes() {
        isNotNull();

        if (!actual.contains(AnsiColor.ESCAPE)) {
            failWithMessage("Expected line with escape sequences but was <%s>", actual);
        }

        return this;
    }

    private int countKey(String key) {
        Matcher matcher = Pattern.compile("(?:^|\\s)" + Pattern.quote(ValueRenderer.renderKey(key)) + "=").matcher(visible());
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
