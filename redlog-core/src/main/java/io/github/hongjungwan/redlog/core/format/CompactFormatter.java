package io.github.hongjungwan.redlog.core.format;

import io.github.hongjungwan.redlog.api.domain.LogEvent;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.theme.Theme;

import java.util.List;

/**
 * 정렬 패딩 없이 공백 하나로 구분하는 포맷터. 컬럼 순서는 {@link DefaultFormatter}와 동일.
 */
public class CompactFormatter extends AbstractTextFormatter {

    @Override
    protected String render(LogEvent event, Theme theme, boolean color) {
        StringBuilder sb = new StringBuilder(96);
        sb.append(paint(timestamp(event, theme), theme.getTimestampColor(), color));
        sb.append(' ').append(paintLevel(levelBadge(event.getLevel(), false), event.getLevel(), theme, color));

        if (!event.getLoggerName().isEmpty()) {
            String name = "[" + ValueRenderer.escapeText(event.getLoggerName()) + "]";
            sb.append(' ').append(paint(name, theme.getLoggerNameColor(), color));
        }

        sb.append(' ').append(paint(ValueRenderer.escapeText(event.getMessage()), theme.getMessageColor(), color));

        List<Field> fields = event.resolvedFields();
        if (!fields.isEmpty()) {
            sb.append(' ');
            appendFields(sb, fields, theme, color);
        }
        return sb.toString();
    }
}
