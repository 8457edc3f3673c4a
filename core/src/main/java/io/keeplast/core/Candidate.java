package io.keeplast.core;

import java.util.Objects;

/**
 * One competing update for a key: a borrowed payload plus its ordering key.
 * The payload is NOT copied here; {@link LwwAccumulator} takes its own copy if
 * the candidate wins.
 */
public record Candidate(Value value, LwwKey key) {

    public Candidate {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(key, "key");
    }

    public static Candidate of(Value value, long timestamp, long originId, long sequenceId) {
        return new Candidate(value, new LwwKey(timestamp, originId, sequenceId));
    }
}
