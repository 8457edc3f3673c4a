package io.keeplast.core.function;

import io.keeplast.core.Value;

import java.util.List;

/**
 * Window aggregate protocol. On top of {@link AggregateFunction}:
 *  - {@link #value} reports the result for the current frame and may be called
 *    many times while the frame is open;
 *  - {@link #inverse} removes a row that slid out of the frame.
 */
public interface WindowFunction extends AggregateFunction {

    void value(FunctionContext ctx);

    void inverse(FunctionContext ctx, List<Value> args);
}
