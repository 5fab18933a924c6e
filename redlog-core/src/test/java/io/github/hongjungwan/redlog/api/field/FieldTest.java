package io.github.hongjungwan.redlog.api.field;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Field")
class FieldTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("should keep typed values")
        void shouldKeepTypedValues() {
            assertThat(Field.of("s", "x").value().getKind()).isEqualTo(FieldValue.Kind.STRING);
            assertThat(Field.of("i", 3).value().getKind()).isEqualTo(FieldValue.Kind.INTEGER);
            assertThat(Field.of("f", 1.5).value().getKind()).isEqualTo(FieldValue.Kind.FLOAT);
            assertThat(Field.of("b", true).value().getKind()).isEqualTo(FieldValue.Kind.BOOLEAN);
            assertThat(Field.ofNull("n").value().isNull()).isTrue();
        }

        @Test
        @DisplayName("should store char as string like the untyped factory")
        void shouldStoreCharAsString() {
            Field typed = Field.of("c", 'x');

            assertThat(typed.value().getKind()).isEqualTo(FieldValue.Kind.STRING);
            assertThat(typed.value().getRaw()).isEqualTo("x");
            assertThat(typed).isEqualTo(Field.of("c", (Object) 'x'));
        }

        @Test
        @DisplayName("should treat null string as null value")
        void shouldTreatNullStringAsNull() {
            assertThat(Field.of("s", (String) null).value().getKind()).isEqualTo(FieldValue.Kind.NULL);
        }

        @Test
        @DisplayName("should reject blank key")
        void shouldRejectBlankKey() {
            assertThatThrownBy(() -> Field.of("", "x")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Field.of("  ", 1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Field.of(null, 1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should render throwable as error field")
        void shouldRenderThrowable() {
            Field field = Field.ofThrowable(new IllegalStateException("pool exhausted"));

            assertThat(field.key()).isEqualTo("error");
            assertThat(field.value().getRaw()).isEqualTo("IllegalStateException: pool exhausted");
        }
    }

    @Nested
    @DisplayName("Untyped values")
    class UntypedValueTests {

        @Test
        @DisplayName("should classify supported java types")
        void shouldClassifySupportedTypes() {
            assertThat(FieldValue.of('c').getKind()).isEqualTo(FieldValue.Kind.STRING);
            assertThat(FieldValue.of(new StringBuilder("sb")).getRaw()).isEqualTo("sb");
            assertThat(FieldValue.of((short) 2).getRaw()).isEqualTo(2L);
            assertThat(FieldValue.of(new AtomicInteger(7)).getRaw()).isEqualTo(7L);
            assertThat(FieldValue.of(BigInteger.TEN).getKind()).isEqualTo(FieldValue.Kind.INTEGER);
            assertThat(FieldValue.of(2.5f).getKind()).isEqualTo(FieldValue.Kind.FLOAT);
            assertThat(FieldValue.of(new BigDecimal("0.1")).getKind()).isEqualTo(FieldValue.Kind.FLOAT);
            assertThat(FieldValue.of(null).isNull()).isTrue();
        }

        @Test
        @DisplayName("should reject unsupported type instead of stringifying it")
        void shouldRejectUnsupportedType() {
            assertThatThrownBy(() -> Field.of("list", (Object) List.of(1, 2)))
                    .isInstanceOf(Field.InvalidFieldValueException.class)
                    .satisfies(e -> assertThat(List.class.isAssignableFrom(
                            ((Field.InvalidFieldValueException) e).getValueType())).isTrue());
        }
    }

    @Test
    @DisplayName("should use structural equality")
    void shouldUseStructuralEquality() {
        assertThat(Field.of("retry", 3)).isEqualTo(Field.of("retry", (Object) 3));
        assertThat(Field.of("retry", 3)).isNotEqualTo(Field.of("retry", "3"));
        assertThat(Field.of("retry", 3)).hasSameHashCodeAs(Field.of("retry", 3L));
    }
}
