package com.jreinhal.insight.validation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One argument the validator changed rather than rejected.
 */
public record Coercion(String parameter, Object original, Object applied, String reason) {

    public Map<String, Object> toTraceMap() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("parameter", this.parameter);
        map.put("original", this.original == null ? null : String.valueOf(this.original));
        map.put("applied", this.applied);
        map.put("reason", this.reason);
        return map;
    }
}
