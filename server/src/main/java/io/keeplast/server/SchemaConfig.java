package io.keeplast.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.keeplast.server.dto.SchemaJson;
import io.keeplast.server.patch.TableSchema;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the replicated table definitions from a JSON file.
 */
public final class SchemaConfig {

    private SchemaConfig() {
    }

    /**
     * @throws IllegalArgumentException if a table definition is invalid
     * @throws RuntimeException         if the file cannot be read or parsed
     */
    public static List<TableSchema> fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            SchemaJson cfg = mapper.readValue(path.toFile(), SchemaJson.class);
            if (cfg.tables == null) {
                throw new IllegalArgumentException("schema " + path + " has no tables");
            }
            return cfg.tables.stream()
                    .map(t -> new TableSchema(
                            t.name,
                            t.primaryKey == null ? List.of() : t.primaryKey,
                            t.columns == null ? List.of() : t.columns))
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to load schema from " + path, e);
        }
    }
}
