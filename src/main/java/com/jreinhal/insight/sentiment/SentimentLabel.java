package com.jreinhal.insight.sentiment;

import java.util.List;

/**
 * Label for the review at {@code index} of a batch.
 */
public record SentimentLabel(int index, String sentiment, List<String> reasons) {

    public SentimentLabel {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
