package com.jreinhal.insight.exception;

/**
 * A turn could not be completed. The message is safe to show; the cause is not.
 */
public class TurnFailedException
extends RuntimeException {
    public TurnFailedException(String traceId, Throwable cause) {
        super("The request could not be completed (reference " + traceId + ")", cause);
    }
}
