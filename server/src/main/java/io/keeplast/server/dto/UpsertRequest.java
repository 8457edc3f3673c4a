package io.keeplast.server.dto;

import java.util.Map;

/** Body of PUT /tables/{table}/rows. */
public final class UpsertRequest {
    public Map<String, Object> delta;
}
