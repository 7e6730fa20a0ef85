package com.jreinhal.insight.trace;

import com.jreinhal.insight.model.User;

/**
 * Who asked what, where: the fixed facts of one turn, known before routing starts.
 */
public record TurnIdentity(String traceId, String conversationId, int turnIndex, User user, long accessVersion, String utterance) {
}
