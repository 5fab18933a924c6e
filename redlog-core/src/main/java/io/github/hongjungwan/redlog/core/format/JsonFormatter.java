package io.github.hongjungwan.redlog.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.redlog.api.domain.LogEvent;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.field.FieldValue;
import io.github.hongjungwan.redlog.api.theme.Theme;
import io.github.hongjungwan.redlog.spi.Formatter;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * 한 줄 JSON 포맷터. 테마 색상은 무시하며 필드 값은 JSON 타입을 유지한다.
 *
 * <pre>{"timestamp":"2024-01-01T00:00:00Z","level":"error","logger":"app.db","message":"conn failed","fields":{"retry":3}}</pre>
 */
public class JsonFormatter implements Formatter {

    private final ObjectMapper objectMapper;

    public JsonFormatter() {
        this(new ObjectMapper());
    }

    public JsonFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format(LogEvent event, Theme theme, boolean colorEnabled) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("timestamp", event.getTimestamp().toString());
        root.put("level", event.getLevel().longName());
        root.put("logger", event.getLoggerName());
        root.put("message", event.getMessage());

        List<Field> fields = event.resolvedFields();
        if (!fields.isEmpty()) {
            ObjectNode fieldsNode = root.putObject("fields");
            for (Field field : fields) {
                putValue(fieldsNode, field.key(), field.value());
            }
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize log event as JSON", e);
        }
    }

    private void putValue(ObjectNode node, String key, FieldValue value) {
        Object raw = value.getRaw();
        switch (value.getKind()) {
            case STRING -> node.put(key, (String) raw);
            case INTEGER -> {
                if (raw instanceof BigInteger) {
                    node.put(key, (BigInteger) raw);
                } else {
                    node.put(key, ((Number) raw).longValue());
                }
            }
            case FLOAT -> {
                if (raw instanceof BigDecimal) {
                    node.put(key, (BigDecimal) raw);
                } else if (raw instanceof Float) {
                    node.put(key, (Float) raw);
                } else {
                    node.put(key, ((Number) raw).doubleValue());
                }
            }
            case BOOLEAN -> node.put(key, (Boolean) raw);
            case NULL -> node.putNull(key);
        }
    }
}
