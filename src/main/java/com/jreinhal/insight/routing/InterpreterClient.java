package com.jreinhal.insight.routing;

/**
 * Outbound call to the language model that interprets utterances.
 *
 * <p>Implementations throw {@link InterpreterTransientException} for failures worth retrying
 * and {@link InterpreterException} for everything else.</p>
 */
public interface InterpreterClient {

    String propose(InterpreterRequest request);
}
