package org.foxesworld.hoard.core.property;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyTest {

    @Test
    void shouldCarryKindAndValue() {
        assertThat(Property.of("visible", true).kind()).isEqualTo(PropertyKind.BOOLEAN);
        assertThat(Property.of("count", 3L).asLong()).isEqualTo(3L);
        assertThat(Property.of("scale", 0.5).asDouble()).isEqualTo(0.5);
        assertThat(Property.of("filename", "test.txt").asString()).isEqualTo("test.txt");
    }

    @Test
    void shouldWidenIntegerToDouble() {
        assertThat(Property.of("count", 7L).asDouble()).isEqualTo(7.0);
    }

    @Test
    void shouldRejectKindMismatch() {
        Property p = Property.of("filename", "test.txt");

        assertThatThrownBy(p::asBoolean)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("filename");
        assertThatThrownBy(p::asDouble).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectIntOverflow() {
        assertThatThrownBy(() -> Property.of("big", Long.MAX_VALUE).asInt())
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void shouldRejectBlankNameAndNullString() {
        assertThatThrownBy(() -> Property.of(" ", 1L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Property.of("name", (String) null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompareByValue() {
        assertThat(Property.of("a", 1L)).isEqualTo(Property.of("a", 1L));
        assertThat(Property.of("a", 1L)).isNotEqualTo(Property.of("a", 1.0));
        assertThat(Property.of("a", "x").toString()).isEqualTo("a='x'");
    }
}
