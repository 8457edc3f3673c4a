// file: server/src/main/java/io/keeplast/server/WebServer.java
package io.keeplast.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.keeplast.server.dto.*;
import io.keeplast.server.patch.MissingRange;
import io.keeplast.server.patch.Patch;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over PatchService.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - PUT  /tables/{table}/rows                          Local upsert, returns the patch
 *   - GET  /tables/{table}/rows                          All merged rows
 *   - GET  /tables/{table}/rows/{pk}                     Merged row (single-column key)
 *   - GET  /tables/{table}/rows/{pk}/history/{column}    Windowed keep_last, ?frame=N
 *   - POST /patches                                      Patch from another peer
 *   - GET  /patches?peer=P&from=A&to=B                   Patches of peer P with seq in [A, B]
 *   - GET  /admin/health                                 Basic health check
 *   - GET  /admin/status                                 Replication status
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String TABLES = "/tables/";

    /** Status code plus JSON body of a read-only request. */
    private record Reply(int status, Object body) {}

    @FunctionalInterface
    private interface Query {
        Reply run(HttpServerExchange ex) throws Exception;
    }

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final PatchService service;

    public WebServer(int port, PatchService service) {
        this.service = service;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if (path.startsWith(TABLES)) {
                        routeTables(exchange, method, path.substring(TABLES.length()).split("/", -1));
                    } else if ("/patches".equals(path)) {
                        switch (method) {
                            case "POST" -> handleReceive(exchange);
                            case "GET" -> handleQuery(exchange, this::patchesFrom);
                            default -> reject(exchange, 405, "method not allowed");
                        }
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok", "peerId", service.peerId()));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else if ("/admin/status".equals(path)) {
                        if ("GET".equals(method)) {
                            handleQuery(exchange, ex -> new Reply(200, toDto(service.status())));
                        } else {
                            reject(exchange, 405, "method not allowed");
                        }
                    } else {
                        reject(exchange, 404, "not found");
                    }
                })
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    // segments: {table}, "rows", [{pk}, ["history", {column}]]
    private void routeTables(HttpServerExchange ex, String method, String[] segments) {
        if (segments.length < 2 || !"rows".equals(segments[1])) {
            reject(ex, 404, "not found");
            return;
        }
        String table = segments[0];
        if (table.isBlank()) {
            reject(ex, 400, "table must not be empty");
            return;
        }

        if (segments.length == 2) {
            switch (method) {
                case "PUT" -> handleUpsert(ex, table);
                case "GET" -> handleQuery(ex, e -> readAll(table));
                default -> reject(ex, 405, "method not allowed");
            }
            return;
        }

        String pk = segments[2];
        if (pk.isBlank()) {
            reject(ex, 400, "primary key must not be empty");
            return;
        }
        if (!"GET".equals(method)) {
            reject(ex, 405, "method not allowed");
            return;
        }
        if (segments.length == 3) {
            handleQuery(ex, e -> read(table, pk));
        } else if (segments.length == 5 && "history".equals(segments[3]) && !segments[4].isBlank()) {
            handleQuery(ex, e -> history(e, table, pk, segments[4]));
        } else {
            reject(ex, 404, "not found");
        }
    }

    // ---------- handlers ----------

    /** GET requests: run the query, map exceptions, log. */
    private void handleQuery(HttpServerExchange ex, Query query) {
        long start = System.nanoTime();
        int status;
        long serviceMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Reply reply = query.run(ex);
            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
            status = reply.status();
            send(ex, status, reply.body());
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, totalMs, serviceMs, error);
    }

    /** PUT /tables/{table}/rows */
    private void handleUpsert(HttpServerExchange ex, String table) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long serviceMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, UpsertRequest.class);
                            if (req.delta == null) {
                                throw new IllegalArgumentException("delta is required");
                            }
                            long sStart = System.nanoTime();
                            Patch p = service.upsert(table, req.delta);
                            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
                            status = 200;
                            send(exchange, status, toDto(p));
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("PUT", path, exchange.getStatusCode(), totalMs, serviceMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("PUT", exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    /** POST /patches */
    private void handleReceive(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long serviceMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var msg = json.readValue(data, PatchMessage.class);
                            if (msg.tab == null || msg.delta == null) {
                                throw new IllegalArgumentException("tab and delta are required");
                            }
                            long sStart = System.nanoTime();
                            boolean applied = service.receive(new Patch(msg.at, msg.peer, msg.seq, msg.tab, msg.delta));
                            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;

                            var dto = new ReceiveResponse();
                            dto.ok = true;
                            dto.applied = applied;
                            status = 200;
                            send(exchange, status, dto);
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("POST", path, exchange.getStatusCode(), totalMs, serviceMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    // ---------- queries ----------

    private Reply read(String table, String pk) {
        PatchService.Read r = service.read(table, List.of(pk));
        var dto = new RowResponse();
        dto.found = r.found();
        dto.table = table;
        dto.row = r.row();
        return new Reply(r.found() ? 200 : 404, dto);
    }

    private Reply readAll(String table) {
        var dto = new RowsResponse();
        dto.table = table;
        dto.rows = service.readAll(table);
        return new Reply(200, dto);
    }

    private Reply history(HttpServerExchange ex, String table, String pk, String column) {
        String rawFrame = firstOrNull(ex.getQueryParameters().get("frame"));
        Integer frame = rawFrame == null ? null : parseInt("frame", rawFrame);

        var dto = new HistoryResponse();
        dto.table = table;
        dto.pk = pk;
        dto.column = column;
        dto.frame = frame;
        dto.entries = new ArrayList<>();
        for (PatchService.HistoryEntry e : service.history(table, List.of(pk), column, frame)) {
            var entry = new HistoryResponse.Entry();
            entry.at = e.at();
            entry.peer = e.peer();
            entry.seq = e.seq();
            entry.value = e.value();
            entry.kept = e.kept();
            dto.entries.add(entry);
        }
        return new Reply(200, dto);
    }

    private Reply patchesFrom(HttpServerExchange ex) {
        var params = ex.getQueryParameters();
        long peer = parseLong("peer", required(params.get("peer"), "peer"));
        long from = parseLong("from", required(params.get("from"), "from"));
        long to = parseLong("to", required(params.get("to"), "to"));

        List<PatchMessage> out = new ArrayList<>();
        for (Patch p : service.patchesFrom(peer, from, to)) {
            out.add(toDto(p));
        }
        return new Reply(200, out);
    }

    // ---------- helpers ----------

    private static PatchMessage toDto(Patch p) {
        var dto = new PatchMessage();
        dto.at = p.at();
        dto.peer = p.peer();
        dto.seq = p.seq();
        dto.tab = p.table();
        dto.delta = p.delta();
        return dto;
    }

    private static StatusResponse toDto(PatchService.Status s) {
        var dto = new StatusResponse();
        dto.peerId = s.peerId();
        dto.lastSequenceId = s.lastSequenceId();
        dto.lastPatchAt = s.lastPatchAt();
        dto.clockDriftMs = s.clockDriftMillis();
        dto.patchCount = s.patchCount();
        dto.peers = new LinkedHashMap<>();
        s.peers().forEach((id, ps) -> {
            var peer = new StatusResponse.Peer();
            peer.lastSequenceId = ps.lastSequenceId();
            peer.lastPatchAt = ps.lastPatchAt();
            peer.contiguousSequenceId = ps.contiguousSequenceId();
            dto.peers.put(String.valueOf(id), peer);
        });
        dto.missing = new ArrayList<>();
        for (MissingRange m : s.missing()) {
            var missing = new StatusResponse.Missing();
            missing.peer = m.peer();
            missing.fromSeq = m.fromSeq();
            missing.toSeq = m.toSeq();
            dto.missing.add(missing);
        }
        return dto;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    private static String required(Deque<String> deque, String name) {
        String v = firstOrNull(deque);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("query parameter " + name + " is required");
        }
        return v;
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer", e);
        }
    }

    private static long parseLong(String name, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer", e);
        }
    }

    private void reject(HttpServerExchange ex, int code, String message) {
        send(ex, code, Map.of("error", message));
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), code, 0, -1, null);
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
