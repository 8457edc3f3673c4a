package io.keeplast.core.function;

import java.util.EnumSet;
import java.util.Set;

/**
 * Registration shims exposing {@link KeepLastFunction} to a host under two names:
 *  - {@code keep_last}:        plain aggregate (step/finish);
 *  - {@code keep_last_window}: window aggregate (step/finish/value/inverse).
 * Both are UTF-8, deterministic and innocuous, and take exactly four arguments:
 * value, timestamp, origin id, sequence id.
 */
public final class KeepLastFunctions {

    public static final String AGGREGATE_NAME = "keep_last";
    public static final String WINDOW_NAME = "keep_last_window";

    public static final Set<FunctionFlag> FLAGS =
            Set.copyOf(EnumSet.of(FunctionFlag.UTF8, FunctionFlag.DETERMINISTIC, FunctionFlag.INNOCUOUS));

    private KeepLastFunctions() {
        // utility
    }

    /** Register both names, window variant first. */
    public static void register(FunctionRegistry registry) {
        KeepLastFunction fn = new KeepLastFunction();
        registry.registerWindow(WINDOW_NAME, KeepLastFunction.ARITY, FLAGS, fn);
        registry.registerAggregate(AGGREGATE_NAME, KeepLastFunction.ARITY, FLAGS, fn);
    }
}
