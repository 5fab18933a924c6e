package io.github.hongjungwan.redlog.core.sink;

import io.github.hongjungwan.redlog.spi.Sink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 여러 Sink로 동시 기록. 하나가 실패해도 나머지에는 기록한 뒤 첫 실패를 던진다
 * (이후 실패는 suppressed로 첨부).
 */
public final class MultiplexSink implements Sink {

    private final List<Sink> sinks = new CopyOnWriteArrayList<>();

    public MultiplexSink(Sink... sinks) {
        this.sinks.addAll(List.of(sinks));
    }

    public MultiplexSink addSink(Sink sink) {
        sinks.add(sink);
        return this;
    }

    public List<Sink> getSinks() {
        return List.copyOf(sinks);
    }

    @Override
    public void write(String line) {
        forEachSink(sink -> sink.write(line));
    }

    @Override
    public void flush() {
        forEachSink(Sink::flush);
    }

    @Override
    public void close() {
        forEachSink(Sink::close);
    }

    private void forEachSink(Consumer<Sink> action) {
        RuntimeException failure = null;
        for (Sink sink : sinks) {
            try {
                action.accept(sink);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
