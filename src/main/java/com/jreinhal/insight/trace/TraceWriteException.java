package com.jreinhal.insight.trace;

public class TraceWriteException
extends RuntimeException {
    public TraceWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
