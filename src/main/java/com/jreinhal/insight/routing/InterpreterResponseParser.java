package com.jreinhal.insight.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.insight.tools.ToolName;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the interpreter's raw reply into a {@link RouterDecision}. Never throws: anything that
 * does not fit the expected shape becomes {@link RouterDecision.Unknown#malformed(String)}.
 *
 * <p>Accepted: a JSON object, or an array whose first element is an object, optionally inside
 * a markdown code fence, with {@code tool}, {@code args} and optionally {@code confidence},
 * {@code ambiguous}, {@code rationale}.</p>
 */
@Component
public class InterpreterResponseParser {
    private static final Logger log = LoggerFactory.getLogger(InterpreterResponseParser.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS_TYPE = new TypeReference<LinkedHashMap<String, Object>>() {};
    static final double DEFAULT_CONFIDENCE = 1.0;
    private static final int MAX_RATIONALE_CHARS = 500;

    private final ObjectMapper objectMapper;

    public InterpreterResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RouterDecision parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return RouterDecision.Unknown.malformed("empty reply");
        }
        JsonNode root;
        try {
            root = this.objectMapper.readTree(stripFence(raw.trim()));
        }
        catch (JsonProcessingException e) {
            log.debug("Interpreter reply is not JSON: {}", e.getOriginalMessage());
            return RouterDecision.Unknown.malformed("reply is not valid JSON");
        }
        if (root != null && root.isArray()) {
            root = root.size() > 0 ? root.get(0) : null;
        }
        if (root == null || !root.isObject()) {
            return RouterDecision.Unknown.malformed("reply is not a JSON object");
        }
        double confidence = readConfidence(root.get("confidence"));
        boolean ambiguous = root.path("ambiguous").asBoolean(false);
        String rationale = readRationale(root.get("rationale"));
        JsonNode toolNode = root.get("tool");
        if (toolNode == null || toolNode.isNull() || (toolNode.isTextual() && toolNode.asText().isBlank())) {
            return new RouterDecision.Unknown(null, confidence, true, "no tool selected");
        }
        if (!toolNode.isTextual()) {
            return RouterDecision.Unknown.malformed("tool is not a string");
        }
        JsonNode argsNode = root.get("args");
        if (argsNode == null || argsNode.isNull() || !argsNode.isObject()) {
            return RouterDecision.Unknown.malformed("args missing or not an object");
        }
        Map<String, Object> arguments = this.objectMapper.convertValue(argsNode, ARGS_TYPE);
        String toolName = toolNode.asText().trim();
        Optional<ToolName> tool = ToolName.fromWireName(toolName);
        if (tool.isEmpty()) {
            return new RouterDecision.Unknown(toolName, confidence, ambiguous, "unrecognized tool");
        }
        return new RouterDecision.Proposal(tool.get(), arguments, confidence, ambiguous, rationale);
    }

    static String stripFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text.replace("```", "").trim();
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private static double readConfidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return DEFAULT_CONFIDENCE;
        }
        if (!node.isNumber()) {
            return 0.0;
        }
        double value = node.asDouble();
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String readRationale(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String text = node.asText().trim();
        return text.length() > MAX_RATIONALE_CHARS ? text.substring(0, MAX_RATIONALE_CHARS) : text;
    }
}
