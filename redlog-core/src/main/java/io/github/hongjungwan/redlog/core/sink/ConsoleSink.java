package io.github.hongjungwan.redlog.core.sink;

import io.github.hongjungwan.redlog.spi.Sink;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 표준 에러(기본) 또는 표준 출력 Sink.
 *
 * <p>스트림은 쓰기 시점마다 조회하므로 {@code System.setErr} 로 교체된 스트림도 따라간다.
 * {@link PrintStream}은 IOException을 삼키므로 {@link PrintStream#checkError()}로 실패를 드러낸다.</p>
 *
 * <p>{@code PrintStream}의 오류 플래그는 한 번 켜지면 외부에서 지울 수 없다. 따라서
 * {@link #stderr()}, {@link #stdout()}, {@link #of(PrintStream)}는 스트림이 한 번 실패한 뒤로
 * 모든 쓰기에서 예외를 던진다. 실패를 쓰기 단위로 보고받으려면 {@link #of(OutputStream)}를 사용한다.</p>
 */
public final class ConsoleSink implements Sink {

    private final Supplier<PrintStream> stream;
    private final String description;

    private ConsoleSink(Supplier<PrintStream> stream, String description) {
        this.stream = stream;
        this.description = description;
    }

    public static ConsoleSink stderr() {
        return new ConsoleSink(() -> System.err, "stderr");
    }

    public static ConsoleSink stdout() {
        return new ConsoleSink(() -> System.out, "stdout");
    }

    public static ConsoleSink of(PrintStream printStream) {
        Objects.requireNonNull(printStream, "printStream");
        return new ConsoleSink(() -> printStream, "stream");
    }

    /**
     * Sink 전용 스트림으로 감싼다. 실패한 쓰기 후 오류 플래그를 지우므로 일시적 실패가 이후 쓰기에 남지 않는다.
     */
    public static ConsoleSink of(OutputStream outputStream) {
        Objects.requireNonNull(outputStream, "outputStream");
        ResettablePrintStream printStream = new ResettablePrintStream(outputStream);
        return new ConsoleSink(() -> printStream, "stream");
    }

    @Override
    public void write(String line) {
        PrintStream out = stream.get();
        out.print(line + System.lineSeparator());
        out.flush();
        if (out.checkError()) {
            if (out instanceof ResettablePrintStream) {
                ((ResettablePrintStream) out).reset();
            }
            throw new UncheckedIOException(new IOException("Failed to write log line to " + description));
        }
    }

    @Override
    public void flush() {
        stream.get().flush();
    }

    /** System 스트림은 닫지 않는다 */
    @Override
    public void close() {
        flush();
    }

    @Override
    public String toString() {
        return "ConsoleSink[" + description + "]";
    }

    private static final class ResettablePrintStream extends PrintStream {

        ResettablePrintStream(OutputStream out) {
            super(out, false, StandardCharsets.UTF_8);
        }

        void reset() {
            clearError();
        }
    }
}
