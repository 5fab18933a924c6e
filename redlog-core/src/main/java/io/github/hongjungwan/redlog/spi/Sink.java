package io.github.hongjungwan.redlog.spi;

import java.io.UncheckedIOException;

/**
 * 출력 목적지 SPI. append-only, seek/read 없음.
 *
 * <p>호출자는 {@code LogRegistry}의 전역 쓰기 락을 잡은 상태에서 {@link #write(String)}를
 * 호출하므로 구현체는 한 줄을 한 번에 기록하기만 하면 된다.</p>
 */
public interface Sink extends AutoCloseable {

    /**
     * 렌더링된 한 줄과 줄 종결자를 기록.
     *
     * @param line 줄 종결자를 포함하지 않는 렌더링 결과
     * @throws UncheckedIOException 기록 실패. 재시도하지 않고 호출자에게 전파된다.
     */
    void write(String line);

    /** 버퍼링된 출력 플러시 */
    void flush();

    /** 리소스 해제 (기본: 플러시만) */
    @Override
    default void close() {
        flush();
    }
}
