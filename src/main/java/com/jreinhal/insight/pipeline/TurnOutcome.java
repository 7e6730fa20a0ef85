package com.jreinhal.insight.pipeline;

import com.jreinhal.insight.execution.ToolResult;
import java.util.Map;

/**
 * What the caller gets back for one message: the reply plus enough of the pipeline's
 * decisions to render a chart or explain a fallback.
 */
public record TurnOutcome(String traceId, String conversationId, int turnIndex, String tool, Map<String, Object> parameters,
                          boolean fallback, String rejectionReason, String verdict, String reply, String resultKind,
                          ToolResult result) {
}
