package io.keeplast.server;

import io.keeplast.server.patch.TableSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaConfigJsonTest {

    @TempDir
    Path tmp;

    @Test
    void loads_tables_from_json() throws Exception {
        Path file = tmp.resolve("schema.json");
        Files.writeString(file, """
            {
              "tables": [
                { "name": "items", "primaryKey": ["id"], "columns": ["id", "title", "price"] },
                { "name": "tags",  "primaryKey": ["item", "tag"], "columns": ["item", "tag", "weight"] }
              ]
            }
            """);

        List<TableSchema> tables = SchemaConfig.fromJsonFile(file);

        assertEquals(2, tables.size());
        assertEquals("items", tables.get(0).name());
        assertEquals(List.of("title", "price"), tables.get(0).valueColumns());
        assertEquals(List.of("item", "tag"), tables.get(1).primaryKey());
    }

    @Test
    void invalid_table_definition_is_rejected() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, """
            { "tables": [ { "name": "items", "primaryKey": ["id"], "columns": ["title"] } ] }
            """);

        assertThrows(IllegalArgumentException.class, () -> SchemaConfig.fromJsonFile(file));
    }

    @Test
    void unreadable_file_is_wrapped() {
        Path missing = tmp.resolve("missing.json");

        var ex = assertThrows(RuntimeException.class, () -> SchemaConfig.fromJsonFile(missing));
        assertTrue(ex.getMessage().contains("missing.json"));
    }
}
