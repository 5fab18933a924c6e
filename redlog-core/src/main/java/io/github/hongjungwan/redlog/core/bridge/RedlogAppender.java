package io.github.hongjungwan.redlog.core.bridge;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.core.internal.LogRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * SLF4J/Logback 이벤트를 redlog 포맷으로 출력하는 Appender.
 *
 * MDC 항목은 키 순서로 문자열 필드가 되고, 예외는 {@code error} 필드로 붙는다.
 * redlog 내부 로거의 이벤트는 재귀를 막기 위해 무시한다.
 */
public class RedlogAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    private static final String INTERNAL_LOGGER_PREFIX = "io.github.hongjungwan.redlog.";

    private LogRegistry registry;
    private boolean includeMdc = true;

    public RedlogAppender() {
        this(null);
    }

    /** null이면 전역 레지스트리를 사용 */
    public RedlogAppender(LogRegistry registry) {
        this.registry = registry;
    }

    public void setRegistry(LogRegistry registry) {
        this.registry = registry;
    }

    /** logback.xml {@code <includeMdc>} */
    public void setIncludeMdc(boolean includeMdc) {
        this.includeMdc = includeMdc;
    }

    public boolean isIncludeMdc() {
        return includeMdc;
    }

    @Override
    public void start() {
        if (registry == null) {
            registry = LogRegistry.getInstance();
        }
        super.start();
        addInfo("RedlogAppender started");
    }

    @Override
    protected void append(ILoggingEvent event) {
        String loggerName = event.getLoggerName() != null ? event.getLoggerName() : "";
        if (loggerName.startsWith(INTERNAL_LOGGER_PREFIX)) {
            return;
        }

        Level level = mapLevel(event.getLevel());
        try {
            registry.getLogger(loggerName)
                    .log(level, event.getFormattedMessage(), toFields(event));
        } catch (RuntimeException e) {
            addError("Failed to write event from " + loggerName, e);
        }
    }

    /**
     * Logback 레벨을 redlog 레벨로 매핑. redlog에서는 TRACE가 DEBUG보다 높으므로
     * Logback TRACE는 DEBUG 아래인 PEDANTIC으로 보내 Logback의 순서를 유지한다.
     */
    static Level mapLevel(ch.qos.logback.classic.Level level) {
        if (level == null) {
            return Level.INFO;
        }
        return switch (level.toInt()) {
            case ch.qos.logback.classic.Level.ERROR_INT -> Level.ERROR;
            case ch.qos.logback.classic.Level.WARN_INT -> Level.WARN;
            case ch.qos.logback.classic.Level.INFO_INT -> Level.INFO;
            case ch.qos.logback.classic.Level.DEBUG_INT -> Level.DEBUG;
            case ch.qos.logback.classic.Level.TRACE_INT -> Level.PEDANTIC;
            default -> Level.INFO;
        };
    }

    private Field[] toFields(ILoggingEvent event) {
        List<Field> fields = new ArrayList<>();
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (includeMdc && mdc != null && !mdc.isEmpty()) {
            new TreeMap<>(mdc).forEach((key, value) -> {
                if (key != null && !key.isBlank()) {
                    fields.add(Field.of(key, value));
                }
            });
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            String className = throwable.getClassName();
            String simpleName = className.substring(className.lastIndexOf('.') + 1);
            String message = throwable.getMessage();
            fields.add(Field.of(Field.ERROR_KEY, message == null ? simpleName : simpleName + ": " + message));
        }
        return fields.toArray(new Field[0]);
    }
}
