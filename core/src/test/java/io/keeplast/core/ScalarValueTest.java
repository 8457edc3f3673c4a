package io.keeplast.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Normalization, integer coercion and release tracking of the default value type.
 */
class ScalarValueTest {

    @Test
    void integral_numbers_normalize_to_long() {
        assertEquals(42L, Value.of(42).unwrap());
        assertEquals(7L, Value.of((short) 7).unwrap());
        assertEquals(1.5d, Value.of(1.5f).unwrap());
    }

    @Test
    void as_long_follows_host_coercion() {
        assertEquals(0L, Value.ofNull().asLong());
        assertEquals(12L, Value.of(12.9d).asLong());
        assertEquals(1L, Value.of(true).asLong());
        assertEquals(-5L, Value.of(" -5 ").asLong());
        assertEquals(3L, Value.of("3.7").asLong());
        assertEquals(0L, Value.of("abc").asLong());
    }

    @Test
    void text_is_read_by_its_leading_number() {
        assertEquals(12L, Value.of("12abc").asLong());
        assertEquals(12L, Value.of("12d").asLong());
        assertEquals(1000L, Value.of("1e3").asLong());
        assertEquals(1000L, Value.of("1e3x").asLong());
        assertEquals(5L, Value.of("5.").asLong());
        assertEquals(7L, Value.of("+7 apples").asLong());
        assertEquals(0L, Value.of("-.5").asLong());
        assertEquals(12L, Value.of("12e").asLong());
        assertEquals(0L, Value.of("NaN").asLong());
        assertEquals(0L, Value.of("Infinity").asLong());
        assertEquals(0L, Value.of(".").asLong());
        assertEquals(0L, Value.of("").asLong());
    }

    @Test
    void integer_text_out_of_range_saturates() {
        assertEquals(Long.MAX_VALUE, Value.of("99999999999999999999").asLong());
        assertEquals(Long.MIN_VALUE, Value.of("-99999999999999999999").asLong());
    }

    @Test
    void unsupported_types_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Value.of(new Object()));
    }

    @Test
    void blobs_are_copied_in_and_out() {
        byte[] raw = {1, 2, 3};
        Value v = Value.of(raw);
        raw[0] = 9;

        byte[] out = (byte[]) v.unwrap();
        assertArrayEquals(new byte[]{1, 2, 3}, out);
        out[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) v.unwrap());
    }

    @Test
    void duplicate_is_equal_but_independent() {
        ScalarValue original = ScalarValue.of("x");
        Value copy = original.duplicate();

        assertEquals(original, copy);
        copy.release();
        assertFalse(original.isReleased());
        assertEquals("x", original.unwrap());
    }

    @Test
    void released_values_fail_loudly() {
        Value v = Value.of("x");
        v.release();

        assertThrows(ValueException.class, v::release);
        assertThrows(ValueException.class, v::unwrap);
        assertThrows(ValueException.class, v::duplicate);
    }
}
