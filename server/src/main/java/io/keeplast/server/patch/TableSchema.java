package io.keeplast.server.patch;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table definition: primary-key columns plus the full column list.
 */
public record TableSchema(String name, List<String> primaryKey, List<String> columns) {

    public TableSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(primaryKey, "primaryKey");
        Objects.requireNonNull(columns, "columns");
        if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
        if (primaryKey.isEmpty()) throw new IllegalArgumentException("table " + name + " needs a primary key");

        Set<String> unique = new HashSet<>(columns);
        if (unique.size() != columns.size()) {
            throw new IllegalArgumentException("duplicate column in table " + name);
        }
        for (String pk : primaryKey) {
            if (!unique.contains(pk)) {
                throw new IllegalArgumentException("primary key column %s is not a column of %s".formatted(pk, name));
            }
        }
        primaryKey = List.copyOf(primaryKey);
        columns = List.copyOf(columns);
    }

    /** Columns resolved with keep_last, in declaration order. */
    public List<String> valueColumns() {
        List<String> out = new ArrayList<>(columns);
        out.removeAll(primaryKey);
        return out;
    }

    /**
     * Primary key of a row delta, normalized to strings so that {@code 1} (JSON) and
     * {@code "1"} (path segment) address the same row.
     */
    public List<String> primaryKeyOf(Map<String, Object> delta) {
        List<String> pk = new ArrayList<>(primaryKey.size());
        for (String column : primaryKey) {
            Object v = delta.get(column);
            if (v == null) {
                throw new IllegalArgumentException("missing primary key column: " + column);
            }
            pk.add(String.valueOf(v));
        }
        return pk;
    }

    /**
     * Check a row delta against this table.
     *
     * @throws IllegalArgumentException for unknown columns, missing key columns or non-scalar values
     */
    public void validate(Map<String, Object> delta) {
        if (delta == null || delta.isEmpty()) {
            throw new IllegalArgumentException("delta must not be empty");
        }
        for (Map.Entry<String, Object> e : delta.entrySet()) {
            if (!columns.contains(e.getKey())) {
                throw new IllegalArgumentException("unknown column %s in table %s".formatted(e.getKey(), name));
            }
            Object v = e.getValue();
            if (v instanceof Map<?, ?> || v instanceof Collection<?> || v instanceof Object[]) {
                throw new IllegalArgumentException("column values must be scalars: " + e.getKey());
            }
            if (v instanceof BigInteger big && big.bitLength() > 63) {
                throw new IllegalArgumentException("integer out of range in column " + e.getKey());
            }
        }
        primaryKeyOf(delta);
    }
}
