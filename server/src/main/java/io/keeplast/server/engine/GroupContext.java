package io.keeplast.server.engine;

import io.keeplast.core.Value;
import io.keeplast.core.function.FunctionContext;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Host-side state of one group or window instance.
 * <p>
 * Holds the function's aggregate state (created lazily) and the result of the last
 * value/finish callback. Results are copied out as plain Java objects, so the caller
 * keeps ownership of the {@link Value} it reported.
 * <p>
 * Closing the context closes the aggregate state, which is how owned payload copies
 * get released when a group is abandoned.
 */
public final class GroupContext implements FunctionContext, AutoCloseable {

    private AutoCloseable state;
    private Object result;
    private boolean hasResult;

    @Override
    public <T extends AutoCloseable> T aggregateState(Class<T> type, Supplier<? extends T> factory) {
        if (state == null) {
            state = Objects.requireNonNull(factory.get(), "aggregate state factory returned null");
        }
        return type.cast(state);
    }

    @Override
    public <T extends AutoCloseable> T existingState(Class<T> type) {
        return state == null ? null : type.cast(state);
    }

    @Override
    public void result(Value value) {
        result = value.isNull() ? null : value.unwrap();
        hasResult = true;
    }

    @Override
    public void resultNull() {
        result = null;
        hasResult = true;
    }

    /**
     * Result reported by the last value/finish callback.
     *
     * @throws IllegalStateException if the function reported nothing
     */
    public Object takeResult() {
        if (!hasResult) {
            throw new IllegalStateException("function did not report a result");
        }
        Object out = result;
        result = null;
        hasResult = false;
        return out;
    }

    public boolean hasState() {
        return state != null;
    }

    @Override
    public void close() {
        AutoCloseable s = state;
        state = null;
        if (s == null) {
            return;
        }
        try {
            s.close();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("failed to release aggregate state", e);
        }
    }
}
