package com.jreinhal.insight.tools;

import com.jreinhal.insight.util.LogSanitizer;
import com.jreinhal.insight.validation.RejectionReason;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A validated (or fallback) tool invocation: the only input the executor accepts.
 *
 * <p>Parameters are stored with sorted keys and immutable values. Values are {@link Integer},
 * {@link String} or {@code List<String>}.</p>
 */
public record ToolCall(ToolName tool, Map<String, Object> parameters, boolean fallback,
                       RejectionReason rejectionReason, String rationale) {

    public ToolCall {
        if (tool == null) {
            throw new IllegalArgumentException("Tool is required");
        }
        parameters = normalize(parameters);
    }

    public static ToolCall of(ToolName tool, Map<String, Object> parameters) {
        return new ToolCall(tool, parameters, false, null, null);
    }

    public static ToolCall fallback(ToolName tool, Map<String, Object> parameters, RejectionReason reason, String rationale) {
        return new ToolCall(tool, parameters, true, reason, rationale);
    }

    public ToolCall asFallback(RejectionReason reason, String rationale) {
        return new ToolCall(this.tool, this.parameters, true, reason, rationale);
    }

    public Integer intParam(String name) {
        Object value = this.parameters.get(name);
        return value instanceof Integer i ? i : null;
    }

    public String stringParam(String name) {
        Object value = this.parameters.get(name);
        return value instanceof String s ? s : null;
    }

    @SuppressWarnings("unchecked")
    public List<String> listParam(String name) {
        Object value = this.parameters.get(name);
        return value instanceof List<?> list ? (List<String>) list : null;
    }

    /**
     * Stable identity of what the call computes. Fallback flag, reason and rationale are
     * excluded so a fallback and an equivalent direct call share cache entries.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder(this.tool.wireName());
        for (Map.Entry<String, Object> entry : this.parameters.entrySet()) {
            sb.append('|').append(entry.getKey()).append('=');
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                sb.append('[');
                for (Object item : list) {
                    sb.append(String.valueOf(item).length()).append(':').append(item).append(';');
                }
                sb.append(']');
            } else {
                sb.append(String.valueOf(value).length()).append(':').append(value);
            }
        }
        return LogSanitizer.sha256Hex(sb.toString());
    }

    public Map<String, Object> toTraceMap() {
        LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("tool", this.tool.wireName());
        map.put("parameters", new LinkedHashMap<String, Object>(this.parameters));
        map.put("fallback", this.fallback);
        if (this.rejectionReason != null) {
            map.put("rejectionReason", this.rejectionReason.code());
        }
        return map;
    }

    private static Map<String, Object> normalize(Map<String, Object> raw) {
        TreeMap<String, Object> sorted = new TreeMap<String, Object>();
        if (raw == null) {
            return Collections.unmodifiableMap(sorted);
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            Object value = entry.getValue();
            if (entry.getKey() == null || value == null) {
                continue;
            }
            if (value instanceof List<?> list) {
                ArrayList<String> copy = new ArrayList<String>(list.size());
                for (Object item : list) {
                    copy.add(String.valueOf(item));
                }
                sorted.put(entry.getKey(), List.copyOf(copy));
            } else if (value instanceof Integer || value instanceof String) {
                sorted.put(entry.getKey(), value);
            } else {
                throw new IllegalArgumentException("Unsupported parameter type for " + entry.getKey() + ": " + value.getClass().getSimpleName());
            }
        }
        return Collections.unmodifiableMap(sorted);
    }
}
