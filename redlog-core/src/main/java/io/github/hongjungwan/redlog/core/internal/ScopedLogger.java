package io.github.hongjungwan.redlog.core.internal;

import io.github.hongjungwan.redlog.api.FormatErrorPolicy;
import io.github.hongjungwan.redlog.api.Level;
import io.github.hongjungwan.redlog.api.Logger;
import io.github.hongjungwan.redlog.api.domain.LogEvent;
import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.field.FieldSet;
import io.github.hongjungwan.redlog.core.format.Printf;
import io.github.hongjungwan.redlog.spi.Formatter;
import io.github.hongjungwan.redlog.spi.Sink;

import java.util.List;
import java.util.Objects;

/**
 * 불변 스코프 로거. 이름 경로와 필드는 영속 리스트로 공유되며 파생 시 append만 일어난다.
 *
 * <p>레벨, 테마, 포맷터, Sink는 emit마다 {@link LogRegistry}에서 읽는다.
 * override가 지정된 경우에만 로거 자신의 Formatter/Sink를 사용한다.</p>
 */
public final class ScopedLogger implements Logger {

    private final LogRegistry registry;
    private final AppendOnlyList<String> namePath;
    private final String name;
    private final FieldSet fields;
    private final FormatErrorPolicy formatErrorPolicy;
    private final Sink sinkOverride;
    private final Formatter formatterOverride;

    private ScopedLogger(LogRegistry registry, AppendOnlyList<String> namePath, String name, FieldSet fields,
                         FormatErrorPolicy formatErrorPolicy, Sink sinkOverride, Formatter formatterOverride) {
        this.registry = registry;
        this.namePath = namePath;
        this.name = name;
        this.fields = fields;
        this.formatErrorPolicy = formatErrorPolicy;
        this.sinkOverride = sinkOverride;
        this.formatterOverride = formatterOverride;
    }

    static ScopedLogger root(LogRegistry registry, String name, FormatErrorPolicy policy) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(policy, "policy");
        return new ScopedLogger(registry, AppendOnlyList.of(name), name, FieldSet.empty(), policy, null, null);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<String> getNamePath() {
        return namePath.toList();
    }

    @Override
    public FieldSet getFields() {
        return fields;
    }

    @Override
    public FormatErrorPolicy getFormatErrorPolicy() {
        return formatErrorPolicy;
    }

    @Override
    public Logger withName(String child) {
        Objects.requireNonNull(child, "name");
        return new ScopedLogger(registry, namePath.append(child), joinName(name, child), fields,
                formatErrorPolicy, sinkOverride, formatterOverride);
    }

    @Override
    public Logger withField(Field field) {
        Objects.requireNonNull(field, "field");
        return new ScopedLogger(registry, namePath, name, fields.with(field), formatErrorPolicy, sinkOverride,
                formatterOverride);
    }

    @Override
    public Logger withFields(Field... more) {
        if (more == null || more.length == 0) {
            return this;
        }
        return new ScopedLogger(registry, namePath, name, fields.with(more), formatErrorPolicy, sinkOverride,
                formatterOverride);
    }

    @Override
    public Logger withSink(Sink sink) {
        Objects.requireNonNull(sink, "sink");
        return new ScopedLogger(registry, namePath, name, fields, formatErrorPolicy, sink, formatterOverride);
    }

    @Override
    public Logger withFormatter(Formatter formatter) {
        Objects.requireNonNull(formatter, "formatter");
        return new ScopedLogger(registry, namePath, name, fields, formatErrorPolicy, sinkOverride, formatter);
    }

    @Override
    public Logger withFormatErrorPolicy(FormatErrorPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return new ScopedLogger(registry, namePath, name, fields, policy, sinkOverride, formatterOverride);
    }

    @Override
    public boolean isEnabled(Level level) {
        return level.isAtLeast(registry.getLevel());
    }

    @Override
    public void log(Level level, String message, Field... callFields) {
        if (!isEnabled(level)) {
            return;
        }
        FieldSet effective = callFields == null || callFields.length == 0 ? fields : fields.with(callFields);
        emit(level, message, effective);
    }

    @Override
    public void logf(Level level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        String message;
        try {
            message = Printf.format(format, args);
        } catch (Printf.FormatMismatchException e) {
            if (formatErrorPolicy == FormatErrorPolicy.RAISE) {
                throw e;
            }
            message = Printf.errorMarker(e) + " " + format;
        }
        emit(level, message, fields);
    }

    private void emit(Level level, String message, FieldSet effective) {
        LogEvent event = LogEvent.builder()
                .timestamp(registry.now())
                .zone(registry.zone())
                .level(level)
                .loggerName(name)
                .message(String.valueOf(message))
                .fields(effective)
                .build();

        Formatter formatter = formatterOverride != null ? formatterOverride : registry.getFormatter();
        String line = formatter.format(event, registry.getTheme(), registry.isColorEnabled());

        registry.write(sinkOverride, line);
    }

    /** 빈 세그먼트는 표시 이름에서 생략 */
    private static String joinName(String parent, String child) {
        if (parent.isEmpty()) {
            return child;
        }
        if (child.isEmpty()) {
            return parent;
        }
        return parent + NAME_SEPARATOR + child;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopedLogger)) return false;
        ScopedLogger that = (ScopedLogger) o;
        return registry == that.registry
                && namePath.equals(that.namePath)
                && fields.equals(that.fields)
                && formatErrorPolicy == that.formatErrorPolicy
                && Objects.equals(sinkOverride, that.sinkOverride)
                && Objects.equals(formatterOverride, that.formatterOverride);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namePath, fields, formatErrorPolicy);
    }

    @Override
    public String toString() {
        return "Logger[" + name + (fields.isEmpty() ? "" : " " + fields) + "]";
    }
}
