// file: server/src/main/java/io/keeplast/server/Main.java
package io.keeplast.server;

import io.keeplast.core.HybridLogicalClock;
import io.keeplast.core.function.KeepLastFunctions;
import io.keeplast.server.engine.FunctionCatalog;
import io.keeplast.server.patch.TableSchema;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point for a single keep-last peer.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Register keep_last / keep_last_window in the function catalog.
 *  - Create PatchService and WebServer.
 *  - Start the retention daemon that purges old patches.
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        List<TableSchema> schema = cfg.schemaPath() == null || cfg.schemaPath().isBlank()
                ? List.of()
                : SchemaConfig.fromJsonFile(Path.of(cfg.schemaPath()));
        if (schema.isEmpty()) {
            log.warning("no tables configured, pass --schema <file>");
        }

        var catalog = new FunctionCatalog();
        KeepLastFunctions.register(catalog);

        var service = new PatchService(cfg.peerId(), schema, new HybridLogicalClock(), catalog);
        var web = new WebServer(cfg.httpPort(), service);
        var retention = new RetentionDaemon(
                service,
                Duration.ofMillis(cfg.maxPatchRetentionMs()),
                Duration.ofHours(1)
        );

        retention.start();
        web.start();
        System.out.printf("Peer %d listening on http://localhost:%d (%d tables)%n",
                cfg.peerId(), cfg.httpPort(), schema.size());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            retention.stop();
            web.stop();
        }));
    }
}
