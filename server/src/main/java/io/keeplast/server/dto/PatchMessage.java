package io.keeplast.server.dto;

import java.util.Map;

/**
 * Wire form of a patch, used by POST /patches, GET /patches and PUT responses.
 * {@code tab} is the table name.
 */
public final class PatchMessage {
    public long at;
    public long peer;
    public long seq;
    public String tab;
    public Map<String, Object> delta;
}
