package com.jreinhal.insight.tools;

import java.util.List;

/**
 * Canonical parameter names and enum domains shared by the registry, validator, fallback
 * policy and executor.
 */
public final class ToolParameters {
    public static final String METRIC = "metric";
    public static final String TOP_N = "top_n";
    public static final String ORDER = "order";
    public static final String CATEGORIES = "categories";
    public static final String CATEGORY = "category";
    public static final String CATEGORY_A = "category_a";
    public static final String CATEGORY_B = "category_b";
    public static final String MAX_REVIEWS = "max_reviews";
    public static final String QUERY_TYPE = "query_type";

    public static final String METRIC_REVIEW_COUNT = "review_count";
    public static final String METRIC_AVG_RATING = "avg_rating";
    public static final String METRIC_NPS = "nps";
    public static final List<String> METRICS = List.of(METRIC_REVIEW_COUNT, METRIC_AVG_RATING, METRIC_NPS);

    public static final String ORDER_TOP = "top";
    public static final String ORDER_BOTTOM = "bottom";
    public static final List<String> ORDERS = List.of(ORDER_TOP, ORDER_BOTTOM);

    public static final String QUERY_SUMMARY_STATS = "summary_stats";
    public static final String QUERY_COUNT_CATEGORIES = "count_categories";
    public static final String QUERY_LIST_CATEGORIES = "list_categories";
    public static final String QUERY_CATEGORY_INFO = "category_info";
    public static final List<String> QUERY_TYPES = List.of(QUERY_SUMMARY_STATS, QUERY_COUNT_CATEGORIES, QUERY_LIST_CATEGORIES, QUERY_CATEGORY_INFO);

    private ToolParameters() {
    }
}
