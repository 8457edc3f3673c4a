package io.keeplast.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaults_apply_without_flags() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[0]);

        assertEquals(1, cfg.peerId());
        assertEquals(8080, cfg.httpPort());
        assertNull(cfg.schemaPath());
        assertEquals(ServerConfig.DEFAULT_RETENTION_MS, cfg.maxPatchRetentionMs());
    }

    @Test
    void long_and_short_flags_are_parsed() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{
                "-i", "7", "--http-port", "9090", "-s", "schema.json", "--max-patch-retention-ms", "1000"
        });

        assertEquals(7, cfg.peerId());
        assertEquals(9090, cfg.httpPort());
        assertEquals("schema.json", cfg.schemaPath());
        assertEquals(1000, cfg.maxPatchRetentionMs());
    }

    @Test
    void out_of_range_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(1, 0, null, 1000));
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(1, 8080, null, 0));
    }

    @Test
    void max_long_retention_is_accepted() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{
                "--max-patch-retention-ms", String.valueOf(Long.MAX_VALUE)
        });

        assertEquals(Long.MAX_VALUE, cfg.maxPatchRetentionMs());
    }
}
