package io.github.hongjungwan.redlog.core.sink;

import io.github.hongjungwan.redlog.spi.Sink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 메모리 캡처 Sink. 테스트 및 출력 검증용.
 */
public final class StringSink implements Sink {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<String> lines = new ArrayList<>();

    @Override
    public void write(String line) {
        lock.lock();
        try {
            lines.add(line);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() {
        // 메모리 버퍼
    }

    /** 기록된 줄 스냅샷 */
    public List<String> getLines() {
        lock.lock();
        try {
            return List.copyOf(lines);
        } finally {
            lock.unlock();
        }
    }

    /** 줄바꿈으로 연결한 전체 출력 */
    public String getOutput() {
        return String.join("\n", getLines());
    }

    public int size() {
        lock.lock();
        try {
            return lines.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            lines.clear();
        } finally {
            lock.unlock();
        }
    }
}
