package com.jreinhal.insight.routing;

import com.jreinhal.insight.tools.ToolName;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the interpreter proposed, as a closed set of shapes. Nothing in here has been
 * validated; field presence means only that the interpreter said so.
 */
public interface RouterDecision {

    Map<String, Object> toTraceMap();

    /**
     * A proposal naming a registered tool.
     */
    record Proposal(ToolName tool, Map<String, Object> arguments, double confidence, boolean ambiguous,
                    String rationale) implements RouterDecision {

        public Proposal {
            arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(arguments));
        }

        @Override
        public Map<String, Object> toTraceMap() {
            LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
            map.put("type", "proposal");
            map.put("tool", this.tool.wireName());
            map.put("arguments", new LinkedHashMap<String, Object>(this.arguments));
            map.put("confidence", this.confidence);
            map.put("ambiguous", this.ambiguous);
            if (this.rationale != null) {
                map.put("rationale", this.rationale);
            }
            return map;
        }
    }

    /**
     * A reply that named no tool, an unrecognized tool, or could not be parsed at all.
     * A null or blank {@code rawToolName} means the interpreter declined to pick one.
     */
    record Unknown(String rawToolName, double confidence, boolean ambiguous, String detail) implements RouterDecision {

        public static final String MALFORMED = "unknown";

        public static Unknown malformed(String detail) {
            return new Unknown(MALFORMED, 0.0, false, detail);
        }

        public boolean hasToolName() {
            return this.rawToolName != null && !this.rawToolName.isBlank();
        }

        @Override
        public Map<String, Object> toTraceMap() {
            LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
            map.put("type", "unknown");
            map.put("rawToolName", this.rawToolName);
            map.put("confidence", this.confidence);
            map.put("ambiguous", this.ambiguous);
            map.put("detail", this.detail);
            return map;
        }
    }

    /**
     * Sentinel returned when every attempt failed or a non-retryable error occurred.
     */
    record Unavailable(String detail, int attempts) implements RouterDecision {

        @Override
        public Map<String, Object> toTraceMap() {
            LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
            map.put("type", "unavailable");
            map.put("detail", this.detail);
            map.put("attempts", this.attempts);
            return map;
        }
    }
}
