package com.jreinhal.insight.routing;

/**
 * Interpreter failure that may succeed on retry (rate limiting, timeouts, overload).
 */
public class InterpreterTransientException
extends InterpreterException {
    public InterpreterTransientException(String message) {
        super(message);
    }

    public InterpreterTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
