package io.keeplast.server.dto;

import java.util.List;

/**
 * Windowed keep_last over one column of one row.
 * {@code frame} is null for an unbounded frame.
 */
public final class HistoryResponse {
    public String table;
    public String pk;
    public String column;
    public Integer frame;
    public List<Entry> entries;

    public static final class Entry {
        public long at;
        public long peer;
        public long seq;
        public Object value;
        public Object kept;
    }
}
