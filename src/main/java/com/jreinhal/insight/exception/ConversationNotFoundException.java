package com.jreinhal.insight.exception;

/**
 * The conversation does not exist or is not owned by the caller. Both cases look the same
 * from outside.
 */
public class ConversationNotFoundException
extends RuntimeException {
    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
    }
}
