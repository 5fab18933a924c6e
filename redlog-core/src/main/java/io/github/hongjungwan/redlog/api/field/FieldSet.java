package io.github.hongjungwan.redlog.api.field;

import io.github.hongjungwan.redlog.core.internal.AppendOnlyList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * 누적된 필드의 불변 시퀀스. 저장은 append-only이며 중복 키 해소(shadowing)는
 * {@link #resolved()} 렌더링 시점에만 일어난다.
 */
public final class FieldSet implements Iterable<Field> {

    private static final FieldSet EMPTY = new FieldSet(AppendOnlyList.empty());

    private final AppendOnlyList<Field> fields;

    private FieldSet(AppendOnlyList<Field> fields) {
        this.fields = fields;
    }

    public static FieldSet empty() {
        return EMPTY;
    }

    public static FieldSet of(Field... fields) {
        return EMPTY.with(fields);
    }

    public FieldSet with(Field field) {
        return new FieldSet(fields.append(field));
    }

    public FieldSet with(Field... more) {
        if (more == null || more.length == 0) {
            return this;
        }
        AppendOnlyList<Field> result = fields;
        for (Field field : more) {
            result = result.append(field);
        }
        return new FieldSet(result);
    }

    public FieldSet with(FieldSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new FieldSet(fields.appendAll(other.fields.toList()));
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /** 누적 순서 그대로 (중복 포함) */
    public List<Field> toList() {
        return fields.toList();
    }

    /**
     * 키별 마지막 값만 남긴 뷰. 위치는 마지막 등장 위치를 따른다.
     * 예: {@code a=1 b=2 a=3} → {@code b=2 a=3}
     */
    public List<Field> resolved() {
        List<Field> all = fields.toList();
        if (all.size() <= 1) {
            return all;
        }
        Set<String> seen = new HashSet<>();
        List<Field> reversed = new ArrayList<>(all.size());
        for (int i = all.size() - 1; i >= 0; i--) {
            Field field = all.get(i);
            if (seen.add(field.key())) {
                reversed.add(field);
            }
        }
        if (reversed.size() == all.size()) {
            return all;
        }
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    @Override
    public Iterator<Field> iterator() {
        return fields.toList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSet)) return false;
        return fields.equals(((FieldSet) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
