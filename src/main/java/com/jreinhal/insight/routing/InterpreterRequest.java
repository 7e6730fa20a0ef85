package com.jreinhal.insight.routing;

public record InterpreterRequest(String systemPrompt, String userPayload) {
}
