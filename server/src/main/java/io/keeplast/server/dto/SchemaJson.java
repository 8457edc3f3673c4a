package io.keeplast.server.dto;

import java.util.List;

/**
 * JSON shape of the table schema file:
 * <pre>
 * { "tables": [ { "name": "items", "primaryKey": ["id"], "columns": ["id", "title"] } ] }
 * </pre>
 */
public final class SchemaJson {
    public List<Table> tables;

    public static final class Table {
        public String name;
        public List<String> primaryKey;
        public List<String> columns;
    }
}
