package com.jreinhal.insight.synthesis;

/**
 * Turns a tool result into the reply shown to the user. Implementations may only state
 * numbers present in the result and must disclose when the call was a fallback.
 */
public interface ResponseSynthesizer {

    String synthesize(SynthesisRequest request);
}
