package io.keeplast.server.patch;

/**
 * Gap in the sequence ids received from a peer: {@code [fromSeq, toSeq]} are not in the log.
 */
public record MissingRange(long peer, long fromSeq, long toSeq) {

    public MissingRange {
        if (fromSeq > toSeq) throw new IllegalArgumentException("fromSeq must be <= toSeq");
    }
}
