package com.jreinhal.insight.sentiment;

public record BackfillResult(String category, int reviewsConsidered, int cacheHits, int labelled, int unlabelled) {
}
