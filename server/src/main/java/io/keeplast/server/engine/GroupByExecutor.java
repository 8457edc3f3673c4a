package io.keeplast.server.engine;

import io.keeplast.core.Value;
import io.keeplast.core.function.AggregateFunction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an aggregate function over rows grouped by key, like {@code SELECT k, f(...) ... GROUP BY k}.
 * <p>
 * Each group gets its own {@link GroupContext}. Rows are stepped in iteration order, then every
 * group is finished. Contexts are always closed, so a failure part way through releases the
 * state of every group that was not finished.
 */
public final class GroupByExecutor {

    private static final Logger log = Logger.getLogger(GroupByExecutor.class.getName());

    private final FunctionCatalog catalog;

    public GroupByExecutor(FunctionCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * @param function  registered function name
     * @param arity     number of arguments passed per row
     * @param rows      input rows
     * @param groupKey  grouping key of a row
     * @param arguments argument values of a row; they stay owned by the caller
     * @return result per group, in first-seen group order
     */
    public <R, K> Map<K, Object> aggregate(String function,
                                           int arity,
                                           Iterable<? extends R> rows,
                                           Function<? super R, ? extends K> groupKey,
                                           Function<? super R, List<Value>> arguments) {
        AggregateFunction fn = catalog.lookupAggregate(function, arity).function();
        Map<K, GroupContext> groups = new LinkedHashMap<>();
        try {
            for (R row : rows) {
                GroupContext ctx = groups.computeIfAbsent(groupKey.apply(row), k -> new GroupContext());
                fn.step(ctx, arguments.apply(row));
            }

            Map<K, Object> out = new LinkedHashMap<>();
            for (Map.Entry<K, GroupContext> e : groups.entrySet()) {
                fn.finish(e.getValue());
                out.put(e.getKey(), e.getValue().takeResult());
            }
            return out;
        } catch (RuntimeException e) {
            log.log(Level.FINE, "aggregate {0} failed, abandoning {1} groups",
                    new Object[]{function, groups.size()});
            throw e;
        } finally {
            for (GroupContext ctx : groups.values()) {
                ctx.close();
            }
        }
    }
}
