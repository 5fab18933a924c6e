package io.github.hongjungwan.redlog.core.format;

import io.github.hongjungwan.redlog.api.domain.LogEvent;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.theme.Theme;

import java.util.List;

/**
 * 컬럼 정렬 포맷터 (기본값).
 *
 * <pre>
 * 14:03:07.412 [err] [app.db]     conn failed                                  retry=3 host=db1
 * </pre>
 *
 * 로거 이름은 {@link Theme#getLoggerNameWidth()}, 메시지는 필드가 있을 때
 * {@link Theme#getMessageWidth()} 폭으로 패딩한다. 폭 계산은 escape sequence를 제외한 길이 기준.
 */
public class DefaultFormatter extends AbstractTextFormatter {

    @Override
    protected String render(LogEvent event, Theme theme, boolean color) {
        StringBuilder sb = new StringBuilder(128);

        sb.append(paint(timestamp(event, theme), theme.getTimestampColor(), color)).append(' ');

        sb.append(paintLevel(levelBadge(event.getLevel(), theme.isPadLevel()), event.getLevel(), theme, color))
                .append(' ');

        String name = ValueRenderer.escapeText(event.getLoggerName());
        if (name.isEmpty()) {
            sb.append(" ".repeat(Math.max(1, theme.getLoggerNameWidth())));
        } else {
            String namePart = "[" + name + "]";
            sb.append(paint(namePart, theme.getLoggerNameColor(), color));
            sb.append(" ".repeat(Math.max(1, theme.getLoggerNameWidth() - namePart.length())));
        }

        String message = ValueRenderer.escapeText(event.getMessage());
        sb.append(paint(message, theme.getMessageColor(), color));

        List<Field> fields = event.resolvedFields();
        if (!fields.isEmpty()) {
            int padding = theme.getMessageWidth() > 0 ? Math.max(1, theme.getMessageWidth() - message.length()) : 1;
            sb.append(" ".repeat(padding));
            appendFields(sb, fields, theme, color);
        }

        return sb.toString();
    }
}
