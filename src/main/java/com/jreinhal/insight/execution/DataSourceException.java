package com.jreinhal.insight.execution;

/**
 * The review store could not answer. Fatal for the current turn.
 */
public class DataSourceException
extends RuntimeException {
    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
