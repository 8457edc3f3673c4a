package io.keeplast.server.patch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory, per-table, append-only store of patches.
 * <p>
 * A patch is identified by (peer, seq); appending the same id twice is a no-op so
 * re-delivered patches are harmless. Old patches are dropped with {@link #deleteOlderThan(long)}.
 * <p>
 * Thread safe (coarse lock).
 */
public final class PatchLog {

    private record PatchId(long peer, long seq) {}

    private final Map<String, List<Patch>> byTable = new HashMap<>();
    private final Set<PatchId> ids = new HashSet<>();
    private final Map<Long, NavigableSet<Long>> seqsByPeer = new TreeMap<>();

    /**
     * @return true if the patch was stored, false if a patch with the same (peer, seq) was already present
     */
    public synchronized boolean append(Patch patch) {
        if (!ids.add(new PatchId(patch.peer(), patch.seq()))) {
            return false;
        }
        byTable.computeIfAbsent(patch.table(), t -> new ArrayList<>()).add(patch);
        seqsByPeer.computeIfAbsent(patch.peer(), p -> new TreeSet<>()).add(patch.seq());
        return true;
    }

    public synchronized boolean contains(long peer, long seq) {
        return ids.contains(new PatchId(peer, seq));
    }

    /** Patches of a table in arrival order. */
    public synchronized List<Patch> patches(String table) {
        return List.copyOf(byTable.getOrDefault(table, List.of()));
    }

    /** Patches written by {@code peer} with {@code minSeq <= seq <= maxSeq}, ordered by seq. */
    public synchronized List<Patch> fromPeer(long peer, long minSeq, long maxSeq) {
        List<Patch> out = new ArrayList<>();
        for (List<Patch> patches : byTable.values()) {
            for (Patch p : patches) {
                if (p.peer() == peer && p.seq() >= minSeq && p.seq() <= maxSeq) {
                    out.add(p);
                }
            }
        }
        out.sort(Comparator.comparingLong(Patch::seq));
        return out;
    }

    /**
     * Holes between consecutive stored sequence ids, per peer, skipping {@code excludePeer}.
     * Sequences before the lowest stored one are not reported: they may have been purged.
     */
    public synchronized List<MissingRange> missingRanges(long excludePeer) {
        List<MissingRange> out = new ArrayList<>();
        for (Map.Entry<Long, NavigableSet<Long>> e : seqsByPeer.entrySet()) {
            if (e.getKey() == excludePeer) {
                continue;
            }
            long previous = -1;
            for (long seq : e.getValue()) {
                if (previous >= 0 && seq - previous > 1) {
                    out.add(new MissingRange(e.getKey(), previous + 1, seq - 1));
                }
                previous = seq;
            }
        }
        return out;
    }

    /**
     * Drop every patch with {@code at < cutoff}.
     *
     * @return number of patches removed
     */
    public synchronized int deleteOlderThan(long cutoff) {
        int removed = 0;
        for (Iterator<List<Patch>> tables = byTable.values().iterator(); tables.hasNext(); ) {
            List<Patch> patches = tables.next();
            for (Iterator<Patch> it = patches.iterator(); it.hasNext(); ) {
                Patch p = it.next();
                if (p.at() < cutoff) {
                    it.remove();
                    ids.remove(new PatchId(p.peer(), p.seq()));
                    NavigableSet<Long> seqs = seqsByPeer.get(p.peer());
                    seqs.remove(p.seq());
                    if (seqs.isEmpty()) seqsByPeer.remove(p.peer());
                    removed++;
                }
            }
            if (patches.isEmpty()) tables.remove();
        }
        return removed;
    }

    public synchronized int size() {
        return ids.size();
    }
}
