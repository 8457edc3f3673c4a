package io.keeplast.core.function;

/**
 * Properties a function declares when it is registered with the host.
 */
public enum FunctionFlag {
    /** Text arguments and results are UTF-8. */
    UTF8,
    /** Same inputs always give the same output. */
    DETERMINISTIC,
    /** No side effects outside the call; safe to use from views and triggers. */
    INNOCUOUS
}
