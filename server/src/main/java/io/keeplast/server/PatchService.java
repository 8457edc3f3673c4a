package io.keeplast.server;

import io.keeplast.core.HybridLogicalClock;
import io.keeplast.core.Value;
import io.keeplast.core.function.KeepLastFunction;
import io.keeplast.core.function.KeepLastFunctions;
import io.keeplast.server.engine.FunctionCatalog;
import io.keeplast.server.engine.GroupByExecutor;
import io.keeplast.server.engine.RetractionPolicy;
import io.keeplast.server.engine.WindowExecutor;
import io.keeplast.server.engine.WindowFrame;
import io.keeplast.server.patch.MissingRange;
import io.keeplast.server.patch.Patch;
import io.keeplast.server.patch.PatchLog;
import io.keeplast.server.patch.TableSchema;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-peer replication engine.
 *
 * Responsibilities:
 *  - Stamp local writes with (HLC timestamp, local peer id, next sequence id).
 *  - Accept patches from other peers and keep per-peer progress.
 *  - Merge a row's patches column by column with keep_last (GROUP BY primary key).
 *  - Expose per-patch windowed resolution for debugging conflicts.
 *
 * Reads always recompute from the patch log; there is no materialized row state.
 */
public class PatchService {

    private static final Logger log = Logger.getLogger(PatchService.class.getName());

    /** Result of a single-row read. */
    public record Read(boolean found, Map<String, Object> row) {}

    /** One line of a column's history: the patch's own value and the value kept at that point. */
    public record HistoryEntry(long at, long peer, long seq, Object value, Object kept) {}

    /** Progress of one remote peer as seen by this node. */
    public record PeerStatus(long lastSequenceId, long lastPatchAt, long contiguousSequenceId) {}

    /** Node-level replication status. */
    public record Status(
            long peerId,
            long lastSequenceId,
            long lastPatchAt,
            long clockDriftMillis,
            int patchCount,
            Map<Long, PeerStatus> peers,
            List<MissingRange> missing
    ) {}

    private static final class PeerProgress {
        long lastSeq;
        long lastAt;
        long contiguousSeq;
    }

    private final long peerId;
    private final Map<String, TableSchema> tables = new LinkedHashMap<>();
    private final HybridLogicalClock clock;
    private final PatchLog patchLog = new PatchLog();
    private final GroupByExecutor groupBy;
    private final WindowExecutor window;
    private final Map<Long, PeerProgress> peers = new TreeMap<>();

    private long lastSequenceId;
    private long lastPatchAt;

    /**
     * @param catalog registry that keep_last and keep_last_window are registered in
     */
    public PatchService(long peerId, List<TableSchema> schema, HybridLogicalClock clock, FunctionCatalog catalog) {
        this.peerId = peerId;
        this.clock = Objects.requireNonNull(clock, "clock");
        for (TableSchema t : schema) {
            if (tables.putIfAbsent(t.name(), t) != null) {
                throw new IllegalArgumentException("duplicate table: " + t.name());
            }
        }
        this.groupBy = new GroupByExecutor(catalog);
        this.window = new WindowExecutor(catalog, RetractionPolicy.RECOMPUTE);
    }

    public long peerId() {
        return peerId;
    }

    public List<TableSchema> tables() {
        return List.copyOf(tables.values());
    }

    // ---------- writes ----------

    /** Local write of (part of) a row. */
    public synchronized Patch upsert(String table, Map<String, Object> delta) {
        TableSchema t = table(table);
        t.validate(delta);

        long at = clock.create();
        Patch p = new Patch(at, peerId, lastSequenceId + 1, table, delta);
        patchLog.append(p);
        lastSequenceId = p.seq();
        lastPatchAt = at;
        log.log(Level.FINE, "local patch {0}/{1} on {2}", new Object[]{peerId, p.seq(), table});
        return p;
    }

    /**
     * Apply a patch from another peer.
     *
     * @return true if the patch was new to this node
     */
    public synchronized boolean receive(Patch patch) {
        if (patch.peer() == peerId) {
            log.log(Level.FINE, "ignoring own patch seq={0}", patch.seq());
            return false;
        }
        table(patch.table()).validate(patch.delta());

        clock.receive(patch.at());
        boolean fresh = patchLog.append(patch);
        track(patch);
        return fresh;
    }

    private void track(Patch patch) {
        PeerProgress s = peers.computeIfAbsent(patch.peer(), p -> new PeerProgress());
        if (patch.seq() > s.lastSeq) {
            s.lastSeq = patch.seq();
            s.lastAt = patch.at();
        }
        if (patch.seq() > s.contiguousSeq + 1) {
            log.log(Level.INFO, "missing patches from peer {0}: expected seq {1}, received {2}",
                    new Object[]{patch.peer(), s.contiguousSeq + 1, patch.seq()});
        }
        while (patchLog.contains(patch.peer(), s.contiguousSeq + 1)) {
            s.contiguousSeq++;
        }
    }

    // ---------- reads ----------

    /** Merged row for a primary key. */
    public Read read(String table, List<String> primaryKey) {
        TableSchema t = table(table);
        if (primaryKey.size() != t.primaryKey().size()) {
            throw new IllegalArgumentException("table %s has a %d-column primary key"
                    .formatted(table, t.primaryKey().size()));
        }
        List<Patch> patches = patchLog.patches(table).stream()
                .filter(p -> t.primaryKeyOf(p.delta()).equals(primaryKey))
                .toList();
        Map<String, Object> row = merge(t, patches).get(primaryKey);
        return row == null ? new Read(false, null) : new Read(true, row);
    }

    /** Every merged row of a table, ordered by each row's oldest patch. */
    public List<Map<String, Object>> readAll(String table) {
        TableSchema t = table(table);
        return new ArrayList<>(merge(t, patchLog.patches(table)).values());
    }

    /**
     * Windowed keep_last over one column of one row.
     *
     * @param frameRows rows preceding each patch in the frame, or null for all preceding patches
     */
    public List<HistoryEntry> history(String table, List<String> primaryKey, String column, Integer frameRows) {
        TableSchema t = table(table);
        if (!t.valueColumns().contains(column)) {
            throw new IllegalArgumentException("unknown value column %s in table %s".formatted(column, table));
        }
        WindowFrame frame = frameRows == null
                ? WindowFrame.unboundedPreceding()
                : WindowFrame.rowsPreceding(frameRows);

        List<Patch> patches = patchLog.patches(table).stream()
                .filter(p -> t.primaryKeyOf(p.delta()).equals(primaryKey))
                .sorted(Comparator.comparing(Patch::key))
                .toList();

        List<Object> kept = window.evaluate(
                KeepLastFunctions.WINDOW_NAME,
                KeepLastFunction.ARITY,
                patches,
                p -> keepLastArguments(p, column),
                frame
        );

        List<HistoryEntry> out = new ArrayList<>(patches.size());
        for (int i = 0; i < patches.size(); i++) {
            Patch p = patches.get(i);
            out.add(new HistoryEntry(p.at(), p.peer(), p.seq(), p.delta().get(column), kept.get(i)));
        }
        return out;
    }

    // Patches are fed in key order: the oldest write seeds each group, so a NULL can only
    // survive when no non-NULL value exists and the merged row is independent of delivery order.
    private Map<List<String>, Map<String, Object>> merge(TableSchema t, List<Patch> unordered) {
        List<Patch> patches = unordered.stream().sorted(Comparator.comparing(Patch::key)).toList();
        Map<List<String>, Map<String, Object>> rows = new LinkedHashMap<>();
        for (Patch p : patches) {
            rows.computeIfAbsent(t.primaryKeyOf(p.delta()), pk -> {
                Map<String, Object> row = new LinkedHashMap<>();
                for (String column : t.primaryKey()) {
                    row.put(column, p.delta().get(column));
                }
                return row;
            });
        }

        for (String column : t.valueColumns()) {
            Map<List<String>, Object> kept = groupBy.aggregate(
                    KeepLastFunctions.AGGREGATE_NAME,
                    KeepLastFunction.ARITY,
                    patches,
                    p -> t.primaryKeyOf(p.delta()),
                    p -> keepLastArguments(p, column)
            );
            kept.forEach((pk, value) -> rows.get(pk).put(column, value));
        }
        return rows;
    }

    // A column absent from the delta counts as NULL, so it never overrides an earlier value.
    private static List<Value> keepLastArguments(Patch p, String column) {
        return List.of(
                Value.of(p.delta().get(column)),
                Value.of(p.at()),
                Value.of(p.peer()),
                Value.of(p.seq())
        );
    }

    // ---------- replication support ----------

    /** Patches written by {@code peer} in {@code [minSeq, maxSeq]}, for a peer filling a gap. */
    public List<Patch> patchesFrom(long peer, long minSeq, long maxSeq) {
        if (minSeq > maxSeq) {
            throw new IllegalArgumentException("minSeq must be <= maxSeq");
        }
        return patchLog.fromPeer(peer, minSeq, maxSeq);
    }

    public List<MissingRange> missing() {
        return patchLog.missingRanges(peerId);
    }

    public synchronized Status status() {
        Map<Long, PeerStatus> peerStatus = new TreeMap<>();
        peers.forEach((id, s) -> peerStatus.put(id, new PeerStatus(s.lastSeq, s.lastAt, s.contiguousSeq)));
        return new Status(
                peerId,
                lastSequenceId,
                lastPatchAt,
                clock.clockDriftMillis(),
                patchLog.size(),
                peerStatus,
                missing()
        );
    }

    /**
     * Drop patches whose HLC timestamp is older than {@code retention} before now.
     *
     * @return number of patches removed
     */
    public int purge(Duration retention) {
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative");
        }
        long cutoffMillis = clock.wallMillis() - retention.toMillis();
        if (cutoffMillis < HybridLogicalClock.UNIX_TIMESTAMP_OFFSET) {
            // No HLC value predates the clock's epoch.
            return 0;
        }
        long cutoff = HybridLogicalClock.from(cutoffMillis, 0);
        int removed = patchLog.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.log(Level.INFO, "purged {0} patches older than {1}", new Object[]{removed, retention});
        }
        return removed;
    }

    private TableSchema table(String name) {
        TableSchema t = tables.get(name);
        if (t == null) {
            throw new IllegalArgumentException("unknown table: " + name);
        }
        return t;
    }
}
