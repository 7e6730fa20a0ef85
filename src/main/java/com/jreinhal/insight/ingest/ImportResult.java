package com.jreinhal.insight.ingest;

public record ImportResult(int rowsRead, int rowsSkipped, int reviewsInserted, int categoriesCreated) {
}
