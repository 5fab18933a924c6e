package io.github.hongjungwan.redlog.core.sink;

import io.github.hongjungwan.redlog.spi.Sink;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 파일 append Sink (UTF-8). 열기/쓰기 실패는 {@link UncheckedIOException}으로 전파된다.
 *
 * <p>로테이션, 보존 정책은 다루지 않는다.</p>
 */
@Slf4j
public final class FileSink implements Sink {

    private final Path path;
    private final boolean flushEachLine;
    private final ReentrantLock lock = new ReentrantLock();
    private final BufferedWriter writer;

    private boolean closed = false;

    public FileSink(Path path) {
        this(path, true);
    }

    /**
     * @param flushEachLine false면 {@link #flush()} 또는 {@link #close()} 시점에만 디스크 반영
     */
    public FileSink(Path path, boolean flushEachLine) {
        this.path = path;
        this.flushEachLine = flushEachLine;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open log file: " + path, e);
        }
        log.debug("FileSink opened: {}", path);
    }

    @Override
    public void write(String line) {
        lock.lock();
        try {
            ensureOpen();
            writer.write(line);
            writer.newLine();
            if (flushEachLine) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log line to " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            if (!closed) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            writer.close();
            log.debug("FileSink closed: {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close " + path, e);
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("FileSink already closed: " + path);
        }
    }

    @Override
    public String toString() {
        return "FileSink[" + path + "]";
    }
}
