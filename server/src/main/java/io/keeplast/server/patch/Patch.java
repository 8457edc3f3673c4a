package io.keeplast.server.patch;

import io.keeplast.core.LwwKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One replicated row update.
 *
 * @param at    hybrid logical clock value of the write
 * @param peer  id of the peer that made the write
 * @param seq   per-peer sequence id, 1 for a peer's first write
 * @param table target table
 * @param delta column -> scalar value (null allowed); includes the primary-key columns
 */
public record Patch(long at, long peer, long seq, String table, Map<String, Object> delta) {

    public Patch {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(delta, "delta");
        if (table.isBlank()) throw new IllegalArgumentException("table must not be blank");
        if (seq <= 0) throw new IllegalArgumentException("seq must be > 0");
        // Map.copyOf would reject null column values.
        delta = Collections.unmodifiableMap(new LinkedHashMap<>(delta));
    }

    /** Ordering key of this write for last-writer-wins resolution. */
    public LwwKey key() {
        return new LwwKey(at, peer, seq);
    }
}
