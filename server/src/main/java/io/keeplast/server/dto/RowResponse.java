package io.keeplast.server.dto;

import java.util.Map;

public final class RowResponse {
    public boolean found;
    public String table;
    public Map<String, Object> row;
}
