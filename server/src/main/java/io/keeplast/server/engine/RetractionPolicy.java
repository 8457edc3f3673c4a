package io.keeplast.server.engine;

/**
 * What the window executor does when rows leave the frame.
 */
public enum RetractionPolicy {
    /**
     * Discard the window state and rebuild it from the rows still in the frame.
     * Required for functions whose inverse callback cannot undo a step.
     */
    RECOMPUTE,
    /** Call the inverse callback and trust the function to update its state. */
    INCREMENTAL
}
