package io.keeplast.core.function;

import io.keeplast.core.Value;

import java.util.List;

/**
 * Plain aggregate protocol: {@link #step} once per row of a group, then
 * {@link #finish} once when the group is complete.
 */
public interface AggregateFunction {

    /**
     * Feed one row. {@code args} are borrowed from the host for the duration of the call.
     */
    void step(FunctionContext ctx, List<Value> args);

    /**
     * Report the final result for the group and drop all state; the host will not
     * call back for this group again.
     */
    void finish(FunctionContext ctx);
}
