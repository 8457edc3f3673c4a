package io.keeplast.server.patch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Storage rules of the in-memory patch log: dedupe by (peer, seq), gap detection, retention.
 */
class PatchLogTest {

    private PatchLog log;

    @BeforeEach
    void setUp() {
        log = new PatchLog();
    }

    private static Patch patch(long at, long peer, long seq) {
        return new Patch(at, peer, seq, "items", Map.of("id", 1, "title", "t" + seq));
    }

    @Test
    void redelivered_patch_is_not_stored_twice() {
        assertTrue(log.append(patch(10, 2, 1)));
        assertFalse(log.append(patch(99, 2, 1)));

        assertEquals(1, log.size());
        assertEquals(10, log.patches("items").get(0).at());
    }

    @Test
    void unknown_table_has_no_patches() {
        assertTrue(log.patches("nope").isEmpty());
    }

    @Test
    void gaps_between_sequences_are_reported_per_peer() {
        log.append(patch(1, 2, 1));
        log.append(patch(2, 2, 4));
        log.append(patch(3, 2, 6));
        log.append(patch(4, 3, 2));
        log.append(patch(5, 3, 3));

        assertEquals(List.of(new MissingRange(2, 2, 3), new MissingRange(2, 5, 5)), log.missingRanges(1));
    }

    @Test
    void excluded_peer_is_never_reported_missing() {
        log.append(patch(1, 1, 1));
        log.append(patch(2, 1, 5));

        assertTrue(log.missingRanges(1).isEmpty());
        assertEquals(List.of(new MissingRange(1, 2, 4)), log.missingRanges(9));
    }

    @Test
    void from_peer_returns_a_sequence_range_in_order() {
        log.append(patch(3, 2, 3));
        log.append(patch(1, 2, 1));
        log.append(patch(2, 2, 2));
        log.append(patch(4, 5, 2));

        List<Patch> out = log.fromPeer(2, 2, 3);

        assertEquals(List.of(2L, 3L), out.stream().map(Patch::seq).toList());
    }

    @Test
    void delete_older_than_drops_only_old_patches() {
        log.append(patch(10, 2, 1));
        log.append(patch(20, 2, 2));
        log.append(patch(30, 2, 3));

        assertEquals(2, log.deleteOlderThan(30));

        assertEquals(1, log.size());
        assertFalse(log.contains(2, 1));
        assertTrue(log.contains(2, 3));
        assertTrue(log.missingRanges(1).isEmpty(), "purged prefix is not a gap");
    }

    @Test
    void patch_delta_is_immutable_and_keeps_nulls() {
        var delta = new java.util.HashMap<String, Object>();
        delta.put("id", 1);
        delta.put("title", null);
        Patch p = new Patch(1, 1, 1, "items", delta);

        assertTrue(p.delta().containsKey("title"));
        assertThrows(UnsupportedOperationException.class, () -> p.delta().put("x", 1));
    }
}
