package io.github.hongjungwan.redlog.core.format;

import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.domain.LogEvent;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.theme.AnsiColor;
import io.github.hongjungwan.redlog.api.theme.Theme;
import io.github.hongjungwan.redlog.spi.Formatter;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 텍스트 포맷터 공통 기반. 컬럼 순서: timestamp, level badge, logger name, message, fields.
 */
public abstract class AbstractTextFormatter implements Formatter {

    private static final Map<String, DateTimeFormatter> TIMESTAMP_FORMATS = new ConcurrentHashMap<>();

    private static final int MAX_BADGE_WIDTH = maxBadgeWidth();

    @Override
    public final String format(LogEvent event, Theme theme, boolean colorEnabled) {
        return render(event, theme, colorEnabled && theme.isColorized());
    }

    /**
     * @param color 실제로 escape sequence를 출력할지 여부
     */
    protected abstract String render(LogEvent event, Theme theme, boolean color);

    protected String timestamp(LogEvent event, Theme theme) {
        DateTimeFormatter formatter = TIMESTAMP_FORMATS.computeIfAbsent(
                theme.getTimestampPattern(), DateTimeFormatter::ofPattern);
        return formatter.format(event.getTimestamp().atZone(event.getZone()));
    }

    protected String levelBadge(Level level, boolean pad) {
        String badge = "[" + level.shortName() + "]";
        return pad ? padRight(badge, MAX_BADGE_WIDTH) : badge;
    }

    protected String paintLevel(String text, Level level, Theme theme, boolean color) {
        return paint(text, theme.levelColor(level), theme.levelBackground(level), color);
    }

    protected String paint(String text, AnsiColor foreground, boolean color) {
        return paint(text, foreground, AnsiColor.NONE, color);
    }

    protected String paint(String text, AnsiColor foreground, AnsiColor background, boolean color) {
        return color ? AnsiColor.apply(text, foreground, background) : text;
    }

    /** 중복 키 해소 후 {@code key=value} 를 공백으로 연결. 키도 값과 같은 규칙으로 따옴표 처리 */
    protected void appendFields(StringBuilder sb, List<Field> fields, Theme theme, boolean color) {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            Field field = fields.get(i);
            sb.append(paint(ValueRenderer.renderKey(field.key()), theme.getFieldKeyColor(), color))
                    .append('=')
                    .append(paint(ValueRenderer.render(field.value()), theme.getFieldValueColor(), color));
        }
    }

    protected static String padRight(String text, int width) {
        int padding = width - text.length();
        return padding > 0 ? text + " ".repeat(padding) : text;
    }

    private static int maxBadgeWidth() {
        int max = 0;
        for (Level level : Level.values()) {
            max = Math.max(max, level.shortName().length() + 2);
        }
        return max;
    }
}
