package com.jreinhal.insight.synthesis;

import com.jreinhal.insight.execution.ToolResult;
import com.jreinhal.insight.tools.ToolCall;

public record SynthesisRequest(String utterance, ToolCall call, ToolResult result) {
}
