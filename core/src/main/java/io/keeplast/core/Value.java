// file: src/main/java/io/keeplast/core/Value.java
package io.keeplast.core;

/**
 * Opaque payload handed to keep_last by the host engine.
 * <p>
 * The resolver never inspects the payload itself. It only needs to:
 *  - test it for NULL,
 *  - read a 64-bit integer out of it (timestamp, origin id, sequence id arguments),
 *  - take an owned copy of it ({@link #duplicate()}), and
 *  - give that copy back ({@link #release()}).
 * <p>
 * Ownership rules:
 *  - Values passed in as call arguments are borrowed: they belong to the host and
 *    may be reused or released as soon as the call returns.
 *  - A value returned by {@link #duplicate()} is owned by the caller, who must call
 *    {@link #release()} on it exactly once.
 */
public interface Value {

    /** True when this is the SQL NULL value. */
    boolean isNull();

    /**
     * Read this value as a signed 64-bit integer, the way SQL integer coercion does:
     * NULL reads as 0, reals are truncated, and text is read by its leading number
     * ({@code "12abc"} is 12, {@code "abc"} is 0).
     */
    long asLong();

    /**
     * Independent, caller-owned copy of this value.
     *
     * @throws ValueException if the copy cannot be made
     */
    Value duplicate();

    /**
     * Give back an owned copy. Calling this on a value that was already released
     * is a programming error.
     *
     * @throws ValueException if the value was already released
     */
    void release();

    /**
     * Plain Java rendering of the payload: {@code null}, {@link Long}, {@link Double},
     * {@link String}, {@link Boolean} or {@code byte[]} (copied).
     */
    Object unwrap();

    /** Wrap a plain Java scalar as a host value. */
    static Value of(Object scalar) {
        return ScalarValue.of(scalar);
    }

    /** A fresh NULL value. */
    static Value ofNull() {
        return ScalarValue.of(null);
    }
}
