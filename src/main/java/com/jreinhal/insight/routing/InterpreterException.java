package com.jreinhal.insight.routing;

/**
 * Interpreter failure that a retry will not fix (bad credentials, rejected request).
 */
public class InterpreterException
extends RuntimeException {
    public InterpreterException(String message) {
        super(message);
    }

    public InterpreterException(String message, Throwable cause) {
        super(message, cause);
    }
}
