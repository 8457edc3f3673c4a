package io.keeplast.core;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hybrid logical clock producing the timestamp half of an {@link LwwKey}.
 * <p>
 * Layout of an HLC value (fits in 53 bits for the next few decades):
 *  - low 13 bits:  counter, up to 8191 writes within the same millisecond;
 *  - high bits:    milliseconds since 2025-01-01T00:00:00Z.
 * <p>
 * Behaviour:
 *  - {@link #receive(long)} remembers the highest HLC seen from a remote peer.
 *  - {@link #create()} returns local wall time while it is ahead of every remote
 *    value; otherwise it returns the highest remote value plus a counter so local
 *    writes still sort after everything already observed.
 * <p>
 * One instance per node. Thread safe.
 */
public final class HybridLogicalClock {

    private static final Logger log = Logger.getLogger(HybridLogicalClock.class.getName());

    /** Unix epoch millis of 2025-01-01T00:00:00Z, the zero point of the timestamp part. */
    public static final long UNIX_TIMESTAMP_OFFSET = 1_735_689_600_000L;
    public static final int COUNTER_BITS = 13;
    public static final int MAX_COUNTER = (1 << COUNTER_BITS) - 1;

    /** Range of the timestamp part (millis since the offset) that fits in an HLC value. */
    public static final long MIN_TIMESTAMP = Long.MIN_VALUE >> COUNTER_BITS;
    public static final long MAX_TIMESTAMP = Long.MAX_VALUE >> COUNTER_BITS;

    private final Clock clock;

    private long highestRemote;
    private int counter;
    private long clockDrift;

    public HybridLogicalClock() {
        this(Clock.systemUTC());
    }

    public HybridLogicalClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Build an HLC value from a unix timestamp in millis and a counter.
     *
     * @throws IllegalArgumentException if the counter or the timestamp does not fit
     */
    public static long from(long unixMillis, int counter) {
        if (counter < 0 || counter > MAX_COUNTER) {
            throw new IllegalArgumentException("counter out of range: " + counter);
        }
        if (unixMillis < UNIX_TIMESTAMP_OFFSET + MIN_TIMESTAMP || unixMillis > UNIX_TIMESTAMP_OFFSET + MAX_TIMESTAMP) {
            throw new IllegalArgumentException("timestamp out of HLC range: " + unixMillis);
        }
        return ((unixMillis - UNIX_TIMESTAMP_OFFSET) << COUNTER_BITS) + counter;
    }

    /** Counter part (low 13 bits). */
    public static int toCounter(long hlc) {
        return (int) (hlc & MAX_COUNTER);
    }

    /** Timestamp part, in millis since {@link #UNIX_TIMESTAMP_OFFSET}. */
    public static long toTimestamp(long hlc) {
        return hlc >> COUNTER_BITS;
    }

    /** Timestamp part as unix epoch millis. */
    public static long toUnixTimestamp(long hlc) {
        return toTimestamp(hlc) + UNIX_TIMESTAMP_OFFSET;
    }

    /** Record an HLC value observed on a patch from another peer. */
    public synchronized void receive(long remoteHlc) {
        if (remoteHlc > highestRemote) {
            if (toTimestamp(remoteHlc) > toTimestamp(highestRemote)) {
                counter = 0;
            }
            highestRemote = remoteHlc;
        }
    }

    /** New HLC value for a local write. */
    public synchronized long create() {
        long now = (clock.millis() - UNIX_TIMESTAMP_OFFSET) << COUNTER_BITS;
        if (now > highestRemote) {
            // Several local writes may share this value; their sequence ids order them.
            counter = 0;
            return now;
        }
        counter++;
        if (counter > MAX_COUNTER) {
            log.log(Level.WARNING,
                    "HLC counter overflow ({0}): clock skew too high, make sure system time is synchronized with NTP",
                    counter);
        }
        clockDrift = highestRemote - now;
        return highestRemote + counter;
    }

    /** How far (in millis) local wall time was behind the remote peers at the last fallback. */
    public synchronized long clockDriftMillis() {
        return toTimestamp(clockDrift);
    }

    /** Current wall time of the underlying clock in unix millis. */
    public long wallMillis() {
        return clock.millis();
    }
}
