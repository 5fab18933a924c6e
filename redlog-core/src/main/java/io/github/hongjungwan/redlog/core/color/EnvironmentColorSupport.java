package io.github.hongjungwan.redlog.core.color;

import io.github.hongjungwan.redlog.spi.ColorSupport;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * 환경 변수와 콘솔 연결 여부로 색상 지원을 판단하는 기본 오라클.
 *
 * <p>우선순위: NO_COLOR / REDLOG_NO_COLOR → false, FORCE_COLOR / REDLOG_FORCE_COLOR → true,
 * TERM=dumb → false, 그 외에는 콘솔이 연결된 경우에만 true.</p>
 */
@Slf4j
public final class EnvironmentColorSupport implements ColorSupport {

    private final Function<String, String> environment;
    private final BooleanSupplier consoleAttached;

    public EnvironmentColorSupport() {
        this(System::getenv, () -> System.console() != null);
    }

    /** 테스트용: 환경 변수 조회와 콘솔 판단을 주입 */
    public EnvironmentColorSupport(Function<String, String> environment, BooleanSupplier consoleAttached) {
        this.environment = environment;
        this.consoleAttached = consoleAttached;
    }

    @Override
    public boolean supportsColor() {
        if (isSet("NO_COLOR") || isSet("REDLOG_NO_COLOR")) {
            log.debug("Color disabled by NO_COLOR");
            return false;
        }
        if (isSet("FORCE_COLOR") || isSet("REDLOG_FORCE_COLOR")) {
            log.debug("Color forced by FORCE_COLOR");
            return true;
        }
        if ("dumb".equalsIgnoreCase(environment.apply("TERM"))) {
            return false;
        }
        return consoleAttached.getAsBoolean();
    }

    private boolean isSet(String name) {
        String value = environment.apply(name);
        return value != null && !value.isEmpty();
    }
}
