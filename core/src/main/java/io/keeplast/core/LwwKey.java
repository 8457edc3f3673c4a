// file: src/main/java/io/keeplast/core/LwwKey.java
package io.keeplast.core;

import java.util.Comparator;

/**
 * Ordering key of a write: (timestamp, originId, sequenceId).
 * <p>
 * Keys form a total order, compared field by field as signed 64-bit integers,
 * ascending:
 *  - a later timestamp wins;
 *  - at equal timestamps the higher origin (replica) id wins;
 *  - at equal timestamp and origin the higher sequence id wins.
 * <p>
 * Two writes with the same key are the same write by contract (sequence ids are
 * unique per origin), so {@link #beats(LwwKey)} is strict and never reports a winner
 * between equal keys.
 */
public record LwwKey(long timestamp, long originId, long sequenceId) implements Comparable<LwwKey> {

    private static final Comparator<LwwKey> ORDER = Comparator
            .comparingLong(LwwKey::timestamp)
            .thenComparingLong(LwwKey::originId)
            .thenComparingLong(LwwKey::sequenceId);

    /** Comparator implementing the key order described above. */
    public static Comparator<LwwKey> order() {
        return ORDER;
    }

    /** True iff this key strictly wins over {@code other}. */
    public boolean beats(LwwKey other) {
        return ORDER.compare(this, other) > 0;
    }

    @Override
    public int compareTo(LwwKey other) {
        return ORDER.compare(this, other);
    }
}
