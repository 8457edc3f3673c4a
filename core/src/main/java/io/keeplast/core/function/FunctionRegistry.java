package io.keeplast.core.function;

import java.util.Set;

/**
 * Host-side registry that functions are exposed through.
 */
public interface FunctionRegistry {

    /**
     * Register a plain aggregate.
     *
     * @throws IllegalStateException if {@code name} is already taken for this arity
     */
    void registerAggregate(String name, int arity, Set<FunctionFlag> flags, AggregateFunction function);

    /**
     * Register a window aggregate.
     *
     * @throws IllegalStateException if {@code name} is already taken for this arity
     */
    void registerWindow(String name, int arity, Set<FunctionFlag> flags, WindowFunction function);
}
