// file: server/src/main/java/io/keeplast/server/ServerConfig.java
package io.keeplast.server;

/**
 * Per-peer server configuration parsed from CLI args.
 *
 * Supports:
 *  - peerId:               numeric peer identity, stamped on every local patch
 *  - httpPort:             HTTP API port
 *  - schemaPath:           JSON file describing the replicated tables
 *  - maxPatchRetentionMs:  patches older than this are purged
 */
public record ServerConfig(
        long peerId,
        int httpPort,
        String schemaPath,
        long maxPatchRetentionMs
) {

    /** 25 hours: a peer offline for a day can still catch up. */
    public static final long DEFAULT_RETENTION_MS = 25L * 60 * 60 * 1000;

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("httpPort out of range");
        if (maxPatchRetentionMs <= 0) throw new IllegalArgumentException("maxPatchRetentionMs must be > 0");
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --peer-id,   -i   <id>
     *   --http-port, -p   <port>
     *   --schema,    -s   <path>
     *   --max-patch-retention-ms <millis>
     *   --help,      -h
     */
    public static ServerConfig fromArgs(String[] args) {
        long peerId = 1;
        int httpPort = 8080;
        String schemaPath = null;
        long retentionMs = DEFAULT_RETENTION_MS;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--peer-id", "-i" -> {
                    ensureValue(args, i);
                    peerId = parseLong("peer-id", args[++i]);
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = (int) parseLong("http-port", args[++i]);
                }

                case "--schema", "-s" -> {
                    ensureValue(args, i);
                    schemaPath = args[++i];
                }

                case "--max-patch-retention-ms" -> {
                    ensureValue(args, i);
                    retentionMs = parseLong("max-patch-retention-ms", args[++i]);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(peerId, httpPort, schemaPath, retentionMs);
    }

    private static long parseLong(String option, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + option + ": " + raw);
            System.exit(1);
            return 0;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --peer-id,   -i          Numeric peer id (default: 1)
              --http-port, -p          HTTP port (default: 8080)
              --schema,    -s          Path to JSON table schema
              --max-patch-retention-ms Drop patches older than this (default: 90000000, 25h)
              --help,      -h          Show this help message
            """);
        System.exit(0);
    }
}
