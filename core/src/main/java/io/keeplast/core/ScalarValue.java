// file: src/main/java/io/keeplast/core/ScalarValue.java
package io.keeplast.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Default {@link Value}: one scalar cell of a row.
 * <p>
 * Supported payloads (after normalization):
 *  - null        SQL NULL
 *  - Long        any integral Java number
 *  - Double      any other Java number
 *  - String      UTF-8 text
 *  - Boolean
 *  - byte[]      blob, copied on input and output
 * <p>
 * A double release or any use after release throws {@link ValueException}.
 */
public final class ScalarValue implements Value {

    private final Object payload;
    private boolean released;

    private ScalarValue(Object payload) {
        this.payload = payload;
    }

    /** Wrap a Java scalar. Unsupported types are rejected. */
    public static ScalarValue of(Object scalar) {
        return new ScalarValue(normalize(scalar));
    }

    private static Object normalize(Object scalar) {
        if (scalar == null
                || scalar instanceof Long
                || scalar instanceof Double
                || scalar instanceof String
                || scalar instanceof Boolean) {
            return scalar;
        }
        if (scalar instanceof Integer || scalar instanceof Short || scalar instanceof Byte) {
            return ((Number) scalar).longValue();
        }
        if (scalar instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (scalar instanceof Float || scalar instanceof BigDecimal) {
            return ((Number) scalar).doubleValue();
        }
        if (scalar instanceof byte[] bytes) {
            return Arrays.copyOf(bytes, bytes.length);
        }
        throw new IllegalArgumentException("unsupported scalar type: " + scalar.getClass().getName());
    }

    @Override
    public boolean isNull() {
        checkLive();
        return payload == null;
    }

    @Override
    public long asLong() {
        checkLive();
        if (payload instanceof Long l) return l;
        if (payload instanceof Double d) return d.longValue();
        if (payload instanceof Boolean b) return b ? 1L : 0L;
        if (payload instanceof String s) return parseLeadingNumber(s);
        return 0L;
    }

    @Override
    public Value duplicate() {
        checkLive();
        return new ScalarValue(payload instanceof byte[] bytes ? Arrays.copyOf(bytes, bytes.length) : payload);
    }

    @Override
    public void release() {
        checkLive();
        released = true;
    }

    @Override
    public Object unwrap() {
        checkLive();
        return payload instanceof byte[] bytes ? Arrays.copyOf(bytes, bytes.length) : payload;
    }

    /** True once {@link #release()} has been called. */
    public boolean isReleased() {
        return released;
    }

    private void checkLive() {
        if (released) {
            throw new ValueException("value already released");
        }
    }

    // Longest numeric prefix after leading whitespace: "12abc" is 12, "1e3x" is 1000,
    // text without a leading number is 0. Integer prefixes that overflow saturate.
    private static long parseLeadingNumber(String s) {
        int n = s.length();
        int i = 0;
        while (i < n && Character.isWhitespace(s.charAt(i))) i++;
        int start = i;
        if (i < n && (s.charAt(i) == '+' || s.charAt(i) == '-')) i++;

        int digits = i;
        while (i < n && isDigit(s.charAt(i))) i++;
        boolean hasDigits = i > digits;
        boolean integral = true;

        if (i < n && s.charAt(i) == '.') {
            int j = i + 1;
            while (j < n && isDigit(s.charAt(j))) j++;
            if (hasDigits || j > i + 1) {
                hasDigits = true;
                integral = false;
                i = j;
            }
        }
        if (!hasDigits) {
            return 0L;
        }
        if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (s.charAt(j) == '+' || s.charAt(j) == '-')) j++;
            int expDigits = j;
            while (j < n && isDigit(s.charAt(j))) j++;
            if (j > expDigits) {
                integral = false;
                i = j;
            }
        }

        String prefix = s.substring(start, i);
        if (!integral) {
            return (long) Double.parseDouble(prefix);
        }
        try {
            return Long.parseLong(prefix);
        } catch (NumberFormatException overflow) {
            return prefix.charAt(0) == '-' ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarValue other)) return false;
        if (payload instanceof byte[] a && other.payload instanceof byte[] b) {
            return Arrays.equals(a, b);
        }
        return Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return payload instanceof byte[] bytes ? Arrays.hashCode(bytes) : Objects.hashCode(payload);
    }

    @Override
    public String toString() {
        if (payload == null) return "NULL";
        if (payload instanceof byte[] bytes) return "blob[" + bytes.length + "]";
        return payload.toString();
    }
}
