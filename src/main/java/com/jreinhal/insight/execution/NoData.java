package com.jreinhal.insight.execution;

import java.util.LinkedHashMap;
import java.util.Map;

public record NoData(String tool, String detail) implements ToolResult {

    @Override
    public String kind() {
        return "no_data";
    }

    @Override
    public Map<String, Object> summary() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("kind", this.kind());
        map.put("tool", this.tool);
        map.put("detail", this.detail);
        return map;
    }
}
