package io.github.hongjungwan.redlog.core.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 영속(persistent) append-only 시퀀스. 노드가 부모를 공유하므로 append는 O(1)이며
 * 기존 인스턴스는 절대 변경되지 않는다.
 */
public final class AppendOnlyList<T> {

    private static final AppendOnlyList<?> EMPTY = new AppendOnlyList<>(null, null, 0);

    private final AppendOnlyList<T> parent;
    private final T last;
    private final int size;

    private volatile List<T> snapshot;

    private AppendOnlyList(AppendOnlyList<T> parent, T last, int size) {
        this.parent = parent;
        this.last = last;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <T> AppendOnlyList<T> empty() {
        return (AppendOnlyList<T>) EMPTY;
    }

    public static <T> AppendOnlyList<T> of(T element) {
        return AppendOnlyList.<T>empty().append(element);
    }

    public AppendOnlyList<T> append(T element) {
        Objects.requireNonNull(element, "element");
        return new AppendOnlyList<>(this, element, size + 1);
    }

    public AppendOnlyList<T> appendAll(Iterable<? extends T> elements) {
        AppendOnlyList<T> result = this;
        for (T element : elements) {
            result = result.append(element);
        }
        return result;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** 삽입 순서의 읽기 전용 리스트. 최초 호출 시 한 번만 구성. */
    public List<T> toList() {
        List<T> result = snapshot;
        if (result == null) {
            result = buildList();
            snapshot = result;
        }
        return result;
    }

    private List<T> buildList() {
        if (size == 0) {
            return Collections.emptyList();
        }
        Object[] elements = new Object[size];
        AppendOnlyList<T> node = this;
        for (int i = size - 1; i >= 0; i--) {
            elements[i] = node.last;
            node = node.parent;
        }
        List<T> list = new ArrayList<>(size);
        for (Object element : elements) {
            @SuppressWarnings("unchecked")
            T typed = (T) element;
            list.add(typed);
        }
        return Collections.unmodifiableList(list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppendOnlyList)) return false;
        AppendOnlyList<?> that = (AppendOnlyList<?>) o;
        return size == that.size && toList().equals(that.toList());
    }

    @Override
    public int hashCode() {
        return toList().hashCode();
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
