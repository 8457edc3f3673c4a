package io.keeplast.server.dto;

import java.util.List;
import java.util.Map;

public final class StatusResponse {
    public long peerId;
    public long lastSequenceId;
    public long lastPatchAt;
    public long clockDriftMs;
    public int patchCount;
    public Map<String, Peer> peers;
    public List<Missing> missing;

    public static final class Peer {
        public long lastSequenceId;
        public long lastPatchAt;
        public long contiguousSequenceId;
    }

    public static final class Missing {
        public long peer;
        public long fromSeq;
        public long toSeq;
    }
}
