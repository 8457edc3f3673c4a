package io.keeplast.server.engine;

import io.keeplast.core.function.AggregateFunction;
import io.keeplast.core.function.FunctionFlag;
import io.keeplast.core.function.FunctionRegistry;
import io.keeplast.core.function.WindowFunction;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory function registry of the host engine.
 * <p>
 * Functions are keyed by (case-insensitive name, arity). A window function may also be
 * looked up as a plain aggregate; a plain aggregate cannot be used over a window.
 */
public final class FunctionCatalog implements FunctionRegistry {

    private static final Logger log = Logger.getLogger(FunctionCatalog.class.getName());

    /** One registered function. */
    public record Entry(String name, int arity, Set<FunctionFlag> flags, AggregateFunction function, boolean window) {
        public Entry {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(function, "function");
            flags = Set.copyOf(flags);
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public void registerAggregate(String name, int arity, Set<FunctionFlag> flags, AggregateFunction function) {
        register(new Entry(name, arity, flags, function, false));
    }

    @Override
    public void registerWindow(String name, int arity, Set<FunctionFlag> flags, WindowFunction function) {
        register(new Entry(name, arity, flags, function, true));
    }

    private void register(Entry entry) {
        if (entry.name().isBlank()) throw new IllegalArgumentException("function name must not be blank");
        if (entry.arity() < 0) throw new IllegalArgumentException("arity must be >= 0");

        Entry previous = entries.putIfAbsent(key(entry.name(), entry.arity()), entry);
        if (previous != null) {
            throw new IllegalStateException(
                    "function already registered: %s/%d".formatted(entry.name(), entry.arity()));
        }
        log.log(Level.INFO, "registered {0} function {1}/{2}",
                new Object[]{entry.window() ? "window" : "aggregate", entry.name(), entry.arity()});
    }

    /**
     * Resolve a function for use as a plain aggregate.
     *
     * @throws IllegalArgumentException if nothing is registered under that name and arity
     */
    public Entry lookupAggregate(String name, int arity) {
        Entry e = entries.get(key(name, arity));
        if (e == null) {
            throw new IllegalArgumentException("no such function: %s/%d".formatted(name, arity));
        }
        return e;
    }

    /**
     * Resolve a function for use over a window.
     *
     * @throws IllegalArgumentException if it is unknown or was registered as a plain aggregate only
     */
    public WindowFunction lookupWindow(String name, int arity) {
        Entry e = lookupAggregate(name, arity);
        if (!e.window()) {
            throw new IllegalArgumentException("%s is not a window function".formatted(name));
        }
        return (WindowFunction) e.function();
    }

    private static String key(String name, int arity) {
        return name.toLowerCase(Locale.ROOT) + "/" + arity;
    }
}
