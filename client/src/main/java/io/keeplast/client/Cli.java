// file: client/src/main/java/io/keeplast/client/Cli.java
package io.keeplast.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Simple CLI for interacting with a running keep-last peer over HTTP.
 *
 * Usage:
 *   keeplast-cli [--base-url http://host:port] put <table> <column=value>...
 *   keeplast-cli [--base-url http://host:port] get <table> <pk>
 *   keeplast-cli [--base-url http://host:port] status
 *
 * Values that look like JSON literals (numbers, true, false, null) are sent as such,
 * everything else as a string.
 *
 * Examples:
 *   keeplast-cli put items id=1 title=hello price=10
 *   keeplast-cli get items 1
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(parsed.getKey());

            switch (cmd) {
                case "put" -> {
                    if (rest.length < 3) {
                        usageAndExit("put requires <table> <column=value>...");
                    }
                    cli.put(rest[1], Arrays.copyOfRange(rest, 2, rest.length));
                }
                case "get" -> {
                    if (rest.length != 3) {
                        usageAndExit("get requires <table> <pk>");
                    }
                    cli.get(rest[1], rest[2]);
                }
                case "status" -> {
                    if (rest.length != 1) {
                        usageAndExit("status takes no arguments");
                    }
                    cli.status();
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** Request body of an upsert built from {@code column=value} arguments. */
    static String upsertBody(String[] assignments) {
        StringBuilder sb = new StringBuilder("{\"delta\":{");
        for (int i = 0; i < assignments.length; i++) {
            String a = assignments[i];
            int eq = a.indexOf('=');
            if (eq <= 0) {
                throw new CliException("expected column=value, got: " + a);
            }
            if (i > 0) sb.append(',');
            sb.append(quote(a.substring(0, eq))).append(':').append(literal(a.substring(eq + 1)));
        }
        return sb.append("}}").toString();
    }

    static String literal(String raw) {
        if ("null".equals(raw) || "true".equals(raw) || "false".equals(raw) || NUMBER.matcher(raw).matches()) {
            return raw;
        }
        return quote(raw);
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private void put(String table, String[] assignments) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/tables/" + segment(table) + "/rows"))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(upsertBody(assignments)))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("PUT failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    private void get(String table, String pk) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/tables/" + segment(table) + "/rows/" + segment(pk)))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) {
            System.out.println("(not found)");
            return;
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    private void status() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/admin/status"))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("STATUS failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    static String segment(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  keeplast-cli [--base-url http://host:port] put <table> <column=value>...
                  keeplast-cli [--base-url http://host:port] get <table> <pk>
                  keeplast-cli [--base-url http://host:port] status
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
