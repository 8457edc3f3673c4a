// file: src/main/java/io/keeplast/core/LwwAccumulator.java
package io.keeplast.core;

import java.util.Objects;

/**
 * Mutable last-writer-wins accumulator for one group or window instance.
 * <p>
 * State machine:
 * <pre>
 *   Empty --accept--> Holding(key, payload)
 *   Holding --accept (key loses, or payload NULL)--> Holding (unchanged)
 *   Holding --accept (key wins and payload not NULL)--> Holding(new key, new payload)
 *   Holding --finish / close--> Empty
 * </pre>
 * {@link #retract(Candidate)} never changes state.
 * <p>
 * NULL rule: the first accepted candidate seeds the accumulator even when its
 * payload is NULL, so an all-NULL group reports NULL. After that a NULL payload
 * never displaces the current winner, whatever its key.
 * <p>
 * Ownership: the stored payload is always a copy taken with {@link Value#duplicate()}
 * and is released exactly once, when it is superseded, handed out by {@link #finish()},
 * or dropped by {@link #close()}.
 * <p>
 * Not thread safe: the host serializes calls for a given group.
 */
public final class LwwAccumulator implements AutoCloseable {

    private boolean initialized;
    private Value winningValue;   // owned copy, null when absent
    private LwwKey winningKey;

    /**
     * Offer one candidate.
     * <p>
     * If copying the candidate's payload (or releasing the superseded copy) fails,
     * the {@link ValueException} propagates and the previous winner is kept.
     */
    public void accept(Candidate candidate) {
        Objects.requireNonNull(candidate, "candidate");

        if (!initialized) {
            winningValue = candidate.value().duplicate();
            winningKey = candidate.key();
            initialized = true;
            return;
        }

        if (candidate.value().isNull() || !candidate.key().beats(winningKey)) {
            return;
        }

        Value copy = candidate.value().duplicate();
        if (winningValue != null) {
            try {
                winningValue.release();
            } catch (ValueException e) {
                try {
                    copy.release();
                } catch (ValueException suppressed) {
                    e.addSuppressed(suppressed);
                }
                throw e;
            }
        }
        winningValue = copy;
        winningKey = candidate.key();
    }

    /**
     * Sliding-window removal. Intentionally a no-op: the winner is kept even if it
     * was the retracted row. Hosts that need exact frames after a removal must rebuild
     * a fresh accumulator from the rows still in the frame.
     */
    public void retract(Candidate candidate) {
        // no-op
    }

    /**
     * Current winner without changing state, or {@code null} for "no value".
     * The returned value is still owned by this accumulator; callers must not release it.
     */
    public Value current() {
        return initialized ? winningValue : null;
    }

    /**
     * Hand over the winner and reset to empty.
     * <p>
     * Ownership of the returned copy moves to the caller, who must release it.
     * Returns {@code null} ("no value") on an accumulator that never accepted anything.
     */
    public Value finish() {
        Value out = initialized ? winningValue : null;
        reset();
        return out;
    }

    /** Key of the current winner, or {@code null} while empty. */
    public LwwKey winningKey() {
        return initialized ? winningKey : null;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Release any owned copy. Used when the host abandons a group without finishing it;
     * safe to call any number of times.
     */
    @Override
    public void close() {
        Value owned = winningValue;
        reset();
        if (owned != null) {
            owned.release();
        }
    }

    private void reset() {
        initialized = false;
        winningValue = null;
        winningKey = null;
    }

    @Override
    public String toString() {
        return initialized
                ? "LwwAccumulator{key=" + winningKey + ", value=" + winningValue + "}"
                : "LwwAccumulator{empty}";
    }
}
