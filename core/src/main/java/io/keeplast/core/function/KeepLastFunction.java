// file: src/main/java/io/keeplast/core/function/KeepLastFunction.java
package io.keeplast.core.function;

import io.keeplast.core.Candidate;
import io.keeplast.core.LwwAccumulator;
import io.keeplast.core.Value;

import java.util.List;

/**
 * keep_last(value, timestamp, origin_id, sequence_id)
 * <p>
 * Reports the value of the update with the highest (timestamp, origin_id, sequence_id)
 * key in the group or frame, see {@link LwwAccumulator} for the exact rules.
 * <p>
 * Callback mapping:
 *  - step     -> {@link LwwAccumulator#accept}; rows with fewer than four arguments are ignored
 *  - value    -> {@link LwwAccumulator#current}
 *  - finish   -> {@link LwwAccumulator#finish}
 *  - inverse  -> {@link LwwAccumulator#retract} (no-op, hosts must recompute the frame)
 * <p>
 * Stateless: all per-group state lives in the {@link FunctionContext}, so one instance
 * serves any number of concurrent groups.
 */
public final class KeepLastFunction implements WindowFunction {

    public static final int ARITY = 4;

    @Override
    public void step(FunctionContext ctx, List<Value> args) {
        LwwAccumulator acc = ctx.aggregateState(LwwAccumulator.class, LwwAccumulator::new);
        if (args.size() < ARITY) {
            return;
        }
        acc.accept(toCandidate(args));
    }

    @Override
    public void inverse(FunctionContext ctx, List<Value> args) {
        LwwAccumulator acc = ctx.existingState(LwwAccumulator.class);
        if (acc == null || args.size() < ARITY) {
            return;
        }
        acc.retract(toCandidate(args));
    }

    @Override
    public void value(FunctionContext ctx) {
        LwwAccumulator acc = ctx.existingState(LwwAccumulator.class);
        Value current = acc == null ? null : acc.current();
        if (current == null) {
            ctx.resultNull();
        } else {
            ctx.result(current);
        }
    }

    @Override
    public void finish(FunctionContext ctx) {
        LwwAccumulator acc = ctx.existingState(LwwAccumulator.class);
        Value last = acc == null ? null : acc.finish();
        if (last == null) {
            ctx.resultNull();
            return;
        }
        try {
            ctx.result(last);
        } finally {
            last.release();
        }
    }

    private static Candidate toCandidate(List<Value> args) {
        return Candidate.of(
                args.get(0),
                args.get(1).asLong(),
                args.get(2).asLong(),
                args.get(3).asLong()
        );
    }
}
