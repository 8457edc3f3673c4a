package io.keeplast.server.dto;

import java.util.List;
import java.util.Map;

public final class RowsResponse {
    public String table;
    public List<Map<String, Object>> rows;
}
