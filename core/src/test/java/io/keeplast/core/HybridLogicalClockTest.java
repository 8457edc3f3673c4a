package io.keeplast.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.keeplast.core.HybridLogicalClock.UNIX_TIMESTAMP_OFFSET;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Hybrid logical clock layout and the create/receive interplay.
 */
class HybridLogicalClockTest {

    private MutableClock wall;
    private HybridLogicalClock hlc;

    @BeforeEach
    void setUp() {
        wall = new MutableClock(UNIX_TIMESTAMP_OFFSET + 1_000);
        hlc = new HybridLogicalClock(wall);
    }

    @Test
    void layout_splits_counter_and_millis() {
        assertEquals(8191, HybridLogicalClock.toCounter((1L << 13) - 1));
        assertEquals(1, HybridLogicalClock.toCounter((1L << 13) + 1));
        assertEquals(5, HybridLogicalClock.toTimestamp(5L * 8192 + 123));
        assertEquals(UNIX_TIMESTAMP_OFFSET + 1500, HybridLogicalClock.toUnixTimestamp(1500L * 8192 + 3));
        assertEquals(1500L * 8192 + 3, HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 1500, 3));
    }

    @Test
    void from_rejects_counter_out_of_range() {
        assertThrows(IllegalArgumentException.class, () -> HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET, -1));
        assertThrows(IllegalArgumentException.class, () -> HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET, 8192));
    }

    @Test
    void from_rejects_timestamps_that_would_overflow() {
        long max = UNIX_TIMESTAMP_OFFSET + HybridLogicalClock.MAX_TIMESTAMP;
        long min = UNIX_TIMESTAMP_OFFSET + HybridLogicalClock.MIN_TIMESTAMP;

        assertEquals(Long.MAX_VALUE, HybridLogicalClock.from(max, HybridLogicalClock.MAX_COUNTER));
        assertEquals(Long.MIN_VALUE, HybridLogicalClock.from(min, 0));
        assertThrows(IllegalArgumentException.class, () -> HybridLogicalClock.from(max + 1, 0));
        assertThrows(IllegalArgumentException.class, () -> HybridLogicalClock.from(min - 1, 0));
        assertThrows(IllegalArgumentException.class, () -> HybridLogicalClock.from(Long.MIN_VALUE, 0));
    }

    @Test
    void create_uses_wall_time_while_ahead_of_remotes() {
        long expected = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 1_000, 0);

        assertEquals(expected, hlc.create());
        // Same millisecond: same value, sequence ids order these writes.
        assertEquals(expected, hlc.create());
    }

    @Test
    void create_counts_past_remote_when_wall_time_lags() {
        long remote = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 5_000, 0);
        hlc.receive(remote);

        assertEquals(remote + 1, hlc.create());
        assertEquals(remote + 2, hlc.create());
        assertEquals(4_000, hlc.clockDriftMillis());
    }

    @Test
    void newer_remote_millisecond_resets_counter() {
        long r1 = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 5_000, 0);
        long r2 = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 6_000, 0);

        hlc.receive(r1);
        hlc.create();
        hlc.create();
        hlc.receive(r2);

        assertEquals(r2 + 1, hlc.create());
    }

    @Test
    void older_remote_values_are_ignored() {
        long r1 = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 5_000, 0);
        long r2 = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 6_000, 0);

        hlc.receive(r2);
        hlc.receive(r1);

        assertEquals(r2 + 1, hlc.create());
    }

    @Test
    void wall_time_catching_up_returns_to_local_time() {
        long remote = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 5_000, 0);
        hlc.receive(remote);
        hlc.create();

        wall.set(UNIX_TIMESTAMP_OFFSET + 7_000);

        assertEquals(HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 7_000, 0), hlc.create());
    }

    @Test
    void values_created_after_receive_sort_after_it() {
        long remote = HybridLogicalClock.from(UNIX_TIMESTAMP_OFFSET + 9_000, 17);
        hlc.receive(remote);

        assertTrue(hlc.create() > remote);
    }
}
