package io.github.hongjungwan.redlog.api;

import io.github.hongjungwan.redlog.api.field.Field;
import io.github.hongjungwan.redlog.api.field.FieldSet;
import io.github.hongjungwan.redlog.spi.Formatter;
import io.github.hongjungwan.redlog.spi.Sink;

import java.util.ArrayList;
import java.util.List;

/**
 * redlog의 메인 로거 인터페이스. 불변 객체이며 {@code with*} 메서드는 항상 새 로거를 반환한다.
 *
 * <p>레벨 필터는 emit 시점마다 레지스트리에서 읽으므로 {@link Redlog#setLevel(Level)}은
 * 이미 만들어진 로거에도 즉시 반영된다.</p>
 */
public interface Logger {

    /** 이름 경로 표시 구분자 */
    String NAME_SEPARATOR = ".";

    /** 클래스 기반 로거 획득 */
    static Logger getLogger(Class<?> clazz) {
        return Redlog.getLogger(clazz);
    }

    /** 이름 기반 로거 획득 */
    static Logger getLogger(String name) {
        return Redlog.getLogger(name);
    }

    /** 구분자로 연결된 표시 이름 (예: {@code app.db}) */
    String getName();

    /** 이름 세그먼트 (읽기 전용) */
    List<String> getNamePath();

    /** 누적 필드 (누적 순서, 중복 포함) */
    FieldSet getFields();

    FormatErrorPolicy getFormatErrorPolicy();

    // ---- derivation ----

    /** 이름 경로에 세그먼트를 추가한 새 로거 */
    Logger withName(String name);

    /** 필드를 추가한 새 로거 */
    Logger withField(Field field);

    Logger withFields(Field... fields);

    default Logger withField(String key, String value) {
        return withField(Field.of(key, value));
    }

    default Logger withField(String key, char value) {
        return withField(Field.of(key, value));
    }

    default Logger withField(String key, long value) {
        return withField(Field.of(key, value));
    }

    default Logger withField(String key, double value) {
        return withField(Field.of(key, value));
    }

    default Logger withField(String key, boolean value) {
        return withField(Field.of(key, value));
    }

    /**
     * @throws Field.InvalidFieldValueException 지원하지 않는 값 타입
     */
    default Logger withField(String key, Object value) {
        return withField(Field.of(key, value));
    }

    /** 레지스트리 Sink 대신 지정한 Sink로 출력하는 새 로거 (파생 로거에 상속) */
    Logger withSink(Sink sink);

    /** 레지스트리 Formatter 대신 지정한 Formatter를 쓰는 새 로거 (파생 로거에 상속) */
    Logger withFormatter(Formatter formatter);

    Logger withFormatErrorPolicy(FormatErrorPolicy policy);

    // ---- emission ----

    boolean isEnabled(Level level);

    /**
     * 레벨이 필터를 통과하면 누적 필드 + 호출 필드로 한 줄 출력. 통과하지 못하면 아무 작업도 하지 않는다.
     */
    void log(Level level, String message, Field... fields);

    /**
     * printf 스타일. 필터를 통과한 경우에만 포맷한다.
     *
     * @throws io.github.hongjungwan.redlog.core.format.Printf.FormatMismatchException
     *         인자 불일치 + {@link FormatErrorPolicy#RAISE}
     */
    void logf(Level level, String format, Object... args);

    default void critical(String message, Field... fields) {
        log(Level.CRITICAL, message, fields);
    }

    default void error(String message, Field... fields) {
        log(Level.ERROR, message, fields);
    }

    default void warn(String message, Field... fields) {
        log(Level.WARN, message, fields);
    }

    default void info(String message, Field... fields) {
        log(Level.INFO, message, fields);
    }

    default void verbose(String message, Field... fields) {
        log(Level.VERBOSE, message, fields);
    }

    default void trace(String message, Field... fields) {
        log(Level.TRACE, message, fields);
    }

    default void debug(String message, Field... fields) {
        log(Level.DEBUG, message, fields);
    }

    default void pedantic(String message, Field... fields) {
        log(Level.PEDANTIC, message, fields);
    }

    default void annoying(String message, Field... fields) {
        log(Level.ANNOYING, message, fields);
    }

    default void crt(String message, Field... fields) {
        critical(message, fields);
    }

    default void err(String message, Field... fields) {
        error(message, fields);
    }

    default void wrn(String message, Field... fields) {
        warn(message, fields);
    }

    default void inf(String message, Field... fields) {
        info(message, fields);
    }

    default void vrb(String message, Field... fields) {
        verbose(message, fields);
    }

    default void trc(String message, Field... fields) {
        trace(message, fields);
    }

    default void dbg(String message, Field... fields) {
        debug(message, fields);
    }

    default void ped(String message, Field... fields) {
        pedantic(message, fields);
    }

    default void ayg(String message, Field... fields) {
        annoying(message, fields);
    }

    default void criticalf(String format, Object... args) {
        logf(Level.CRITICAL, format, args);
    }

    default void errorf(String format, Object... args) {
        logf(Level.ERROR, format, args);
    }

    default void warnf(String format, Object... args) {
        logf(Level.WARN, format, args);
    }

    default void infof(String format, Object... args) {
        logf(Level.INFO, format, args);
    }

    default void verbosef(String format, Object... args) {
        logf(Level.VERBOSE, format, args);
    }

    default void tracef(String format, Object... args) {
        logf(Level.TRACE, format, args);
    }

    default void debugf(String format, Object... args) {
        logf(Level.DEBUG, format, args);
    }

    default void pedanticf(String format, Object... args) {
        logf(Level.PEDANTIC, format, args);
    }

    default void annoyingf(String format, Object... args) {
        logf(Level.ANNOYING, format, args);
    }

    default void crtf(String format, Object... args) {
        criticalf(format, args);
    }

    default void errf(String format, Object... args) {
        errorf(format, args);
    }

    default void wrnf(String format, Object... args) {
        warnf(format, args);
    }

    default void inff(String format, Object... args) {
        infof(format, args);
    }

    default void vrbf(String format, Object... args) {
        verbosef(format, args);
    }

    default void trcf(String format, Object... args) {
        tracef(format, args);
    }

    default void dbgf(String format, Object... args) {
        debugf(format, args);
    }

    default void pedf(String format, Object... args) {
        pedanticf(format, args);
    }

    default void aygf(String format, Object... args) {
        annoyingf(format, args);
    }

    /** Fluent API 빌더 생성 */
    default LogBuilder atLevel(Level level) {
        return new LogBuilder(this, level);
    }

    /** 로그 엔트리 빌더. 메서드 체이닝 지원. */
    class LogBuilder {
        private final Logger logger;
        private final Level level;
        private final List<Field> fields = new ArrayList<>();
        private String message = "";

        LogBuilder(Logger logger, Level level) {
            this.logger = logger;
            this.level = level;
        }

        public LogBuilder message(String message) {
            this.message = message;
            return this;
        }

        public LogBuilder field(Field field) {
            fields.add(field);
            return this;
        }

        public LogBuilder field(String key, Object value) {
            return field(Field.of(key, value));
        }

        public LogBuilder throwable(Throwable throwable) {
            return field(Field.ofThrowable(throwable));
        }

        /** 설정된 레벨로 로그 출력 */
        public void log() {
            logger.log(level, message, fields.toArray(new Field[0]));
        }
    }
}
