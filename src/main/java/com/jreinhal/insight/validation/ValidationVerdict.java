package com.jreinhal.insight.validation;

import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public interface ValidationVerdict {

    Outcome outcome();

    Map<String, Object> toTraceMap();

    /**
     * The call is safe to execute exactly as it stands.
     */
    record Validated(ToolCall call, List<Coercion> coercions) implements ValidationVerdict {

        public Validated {
            coercions = coercions == null ? List.of() : List.copyOf(coercions);
        }

        @Override
        public Outcome outcome() {
            return this.coercions.isEmpty() ? Outcome.PASS : Outcome.COERCE;
        }

        @Override
        public Map<String, Object> toTraceMap() {
            LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
            map.put("outcome", this.outcome().name());
            ArrayList<Map<String, Object>> applied = new ArrayList<Map<String, Object>>();
            for (Coercion coercion : this.coercions) {
                applied.add(coercion.toTraceMap());
            }
            map.put("coercions", applied);
            return map;
        }
    }

    /**
     * The proposal cannot run. {@code tool} and {@code arguments} hold whatever the validator
     * had normalized before rejecting, for the fallback policy; {@code offendingCategory} is
     * recorded in the trace only.
     */
    record Rejected(RejectionReason reason, String detail, String offendingCategory, ToolName tool,
                    Map<String, Object> arguments) implements ValidationVerdict {

        public Rejected {
            arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<String, Object>(arguments));
        }

        public static Rejected of(RejectionReason reason, String detail) {
            return new Rejected(reason, detail, null, null, Map.of());
        }

        @Override
        public Outcome outcome() {
            return Outcome.REJECT;
        }

        @Override
        public Map<String, Object> toTraceMap() {
            LinkedHashMap<String, Object> map = new LinkedHashMap<String, Object>();
            map.put("outcome", Outcome.REJECT.name());
            map.put("reason", this.reason.code());
            map.put("detail", this.detail);
            if (this.offendingCategory != null) {
                map.put("offendingCategory", this.offendingCategory);
            }
            if (this.tool != null) {
                map.put("tool", this.tool.wireName());
            }
            return map;
        }
    }

    static enum Outcome {
        PASS,
        COERCE,
        REJECT;

    }
}
