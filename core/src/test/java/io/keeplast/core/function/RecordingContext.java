package io.keeplast.core.function;

import io.keeplast.core.Value;

import java.util.function.Supplier;

/** Minimal single-group host context for driving functions in tests. */
final class RecordingContext implements FunctionContext {

    static final Object NO_RESULT = new Object();

    private AutoCloseable state;
    private Object result = NO_RESULT;
    int allocations;

    @Override
    public <T extends AutoCloseable> T aggregateState(Class<T> type, Supplier<? extends T> factory) {
        if (state == null) {
            state = factory.get();
            allocations++;
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
    }

    @Override
    public void resultNull() {
        result = null;
    }

    Object takeResult() {
        Object out = result;
        result = NO_RESULT;
        return out;
    }
}
