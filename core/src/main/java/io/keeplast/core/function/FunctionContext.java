package io.keeplast.core.function;

import io.keeplast.core.Value;

import java.util.function.Supplier;

/**
 * Per-group handle the host passes to every lifecycle callback.
 * <p>
 * Aggregate state: each group (or window instance) owns at most one state object.
 * The host creates it lazily on the first {@link #aggregateState} call and closes it
 * when the group is disposed, whether or not the function was finalized.
 * <p>
 * Results: a callback reports its output through {@link #result(Value)} or
 * {@link #resultNull()}. The host copies what it needs before returning, so the
 * value passed in stays owned by the caller.
 */
public interface FunctionContext {

    /**
     * State of this group, created with {@code factory} on first use.
     *
     * @throws OutOfMemoryError if the host cannot allocate the state; the group fails
     */
    <T extends AutoCloseable> T aggregateState(Class<T> type, Supplier<? extends T> factory);

    /** State of this group if one was created, else {@code null}. Never allocates. */
    <T extends AutoCloseable> T existingState(Class<T> type);

    /** Report {@code value} as this call's result. NULL payloads render as SQL NULL. */
    void result(Value value);

    /** Report SQL NULL as this call's result. */
    void resultNull();
}
