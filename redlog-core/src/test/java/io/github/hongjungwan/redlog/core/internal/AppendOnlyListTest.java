package io.github.hongjungwan.redlog.core.internal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AppendOnlyList")
class AppendOnlyListTest {

    @Test
    @DisplayName("should append without changing the original")
    void shouldAppendPersistently() {
        AppendOnlyList<String> root = AppendOnlyList.of("app");
        AppendOnlyList<String> db = root.append("db");
        AppendOnlyList<String> cache = root.append("cache");

        assertThat(root.toList()).containsExactly("app");
        assertThat(db.toList()).containsExactly("app", "db");
        assertThat(cache.toList()).containsExactly("app", "cache");
    }

    @Test
    @DisplayName("should return read-only snapshot")
    void shouldReturnReadOnlySnapshot() {
        List<String> list = AppendOnlyList.<String>empty().append("a").toList();

        assertThatThrownBy(() -> list.add("b")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should reject null element")
    void shouldRejectNull() {
        assertThatThrownBy(() -> AppendOnlyList.empty().append(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("should compare by elements")
    void shouldCompareByElements() {
        assertThat(AppendOnlyList.of("a").append("b"))
                .isEqualTo(AppendOnlyList.<String>empty().appendAll(List.of("a", "b")))
                .hasSameHashCodeAs(List.of("a", "b"));
        assertThat(AppendOnlyList.empty().isEmpty()).isTrue();
    }
}
