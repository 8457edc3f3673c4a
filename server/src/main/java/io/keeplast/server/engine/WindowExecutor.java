package io.keeplast.server.engine;

import io.keeplast.core.Value;
import io.keeplast.core.function.WindowFunction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates a window function over an ordered partition with a sliding {@link WindowFrame}.
 * <p>
 * For every row: rows that left the frame are passed to {@code inverse}, the current row is
 * stepped, and {@code value} is read. With {@link RetractionPolicy#RECOMPUTE} the state is
 * rebuilt from the remaining frame rows whenever anything was retracted, so the reported value
 * is exact even though the function's inverse is a no-op.
 */
public final class WindowExecutor {

    private static final Logger log = Logger.getLogger(WindowExecutor.class.getName());

    private final FunctionCatalog catalog;
    private final RetractionPolicy policy;

    public WindowExecutor(FunctionCatalog catalog) {
        this(catalog, RetractionPolicy.RECOMPUTE);
    }

    public WindowExecutor(FunctionCatalog catalog, RetractionPolicy policy) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public RetractionPolicy policy() {
        return policy;
    }

    /**
     * @return one result per input row, in input order
     */
    public <R> List<Object> evaluate(String function,
                                     int arity,
                                     List<? extends R> orderedRows,
                                     Function<? super R, List<Value>> arguments,
                                     WindowFrame frame) {
        WindowFunction fn = catalog.lookupWindow(function, arity);
        List<Object> results = new ArrayList<>(orderedRows.size());
        GroupContext ctx = new GroupContext();
        try {
            int start = 0;
            for (int i = 0; i < orderedRows.size(); i++) {
                int newStart = frame.startFor(i);
                boolean retracted = newStart > start;
                for (int j = start; j < newStart; j++) {
                    fn.inverse(ctx, arguments.apply(orderedRows.get(j)));
                }
                start = newStart;

                if (retracted && policy == RetractionPolicy.RECOMPUTE) {
                    ctx.close();
                    ctx = new GroupContext();
                    for (int j = start; j < i; j++) {
                        fn.step(ctx, arguments.apply(orderedRows.get(j)));
                    }
                    log.log(Level.FINE, "row {0}: rebuilt window state from {1} rows",
                            new Object[]{i, i - start});
                }

                fn.step(ctx, arguments.apply(orderedRows.get(i)));
                fn.value(ctx);
                results.add(ctx.takeResult());
            }
            fn.finish(ctx);
            ctx.takeResult();
            return results;
        } finally {
            ctx.close();
        }
    }
}
