package com.jreinhal.insight.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * The enumerable tool set. Schemas are built once from configuration and never change
 * afterwards; a disabled tool is simply absent.
 */
@Component
public class ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<ToolName, ToolSchema> schemas;

    public ToolRegistry(@Value("${insight.tools.top-n.min:1}") int topNMin,
                        @Value("${insight.tools.top-n.max:50}") int topNMax,
                        @Value("${insight.tools.top-n.default:5}") int topNDefault,
                        @Value("${insight.tools.max-reviews.min:5}") int maxReviewsMin,
                        @Value("${insight.tools.max-reviews.max:50}") int maxReviewsMax,
                        @Value("${insight.tools.max-reviews.default:30}") int maxReviewsDefault,
                        @Value("${insight.tools.disabled:}") String disabledTools) {
        Set<ToolName> disabled = parseDisabled(disabledTools);
        EnumMap<ToolName, ToolSchema> built = new EnumMap<ToolName, ToolSchema>(ToolName.class);
        this.register(built, disabled, new ToolSchema(ToolName.METRICS_TOP_CATEGORIES,
                "Rank categories by review count, average rating or NPS.",
                List.of(ParameterSpec.enumeration(ToolParameters.METRIC, ToolParameters.METRICS, ToolParameters.METRIC_REVIEW_COUNT),
                        ParameterSpec.integer(ToolParameters.TOP_N, topNMin, topNMax, topNDefault, "n"),
                        ParameterSpec.enumeration(ToolParameters.ORDER, ToolParameters.ORDERS, ToolParameters.ORDER_TOP),
                        ParameterSpec.categoryList(ToolParameters.CATEGORIES))));
        this.register(built, disabled, new ToolSchema(ToolName.RATING_DISTRIBUTION,
                "Count of 1-5 star ratings for one category.",
                List.of(ParameterSpec.category(ToolParameters.CATEGORY, true))));
        this.register(built, disabled, new ToolSchema(ToolName.SENTIMENT_SUMMARY,
                "Sentiment split and most common reasons for one category.",
                List.of(ParameterSpec.category(ToolParameters.CATEGORY, true),
                        ParameterSpec.integer(ToolParameters.MAX_REVIEWS, maxReviewsMin, maxReviewsMax, maxReviewsDefault))));
        this.register(built, disabled, new ToolSchema(ToolName.COMPARE_CATEGORIES,
                "Side-by-side metrics and rating distributions for two categories.",
                List.of(ParameterSpec.category(ToolParameters.CATEGORY_A, true),
                        ParameterSpec.category(ToolParameters.CATEGORY_B, true))));
        this.register(built, disabled, new ToolSchema(ToolName.GENERAL_QUERY,
                "Counts, lists and summary statistics over the visible categories.",
                List.of(ParameterSpec.enumeration(ToolParameters.QUERY_TYPE, ToolParameters.QUERY_TYPES, ToolParameters.QUERY_SUMMARY_STATS),
                        ParameterSpec.category(ToolParameters.CATEGORY, false))));
        this.schemas = Collections.unmodifiableMap(built);
        log.info("Tool registry initialized with {} tools (disabled: {})", this.schemas.size(), disabled);
    }

    public static ToolRegistry withDefaults() {
        return new ToolRegistry(1, 50, 5, 5, 50, 30, "");
    }

    public Optional<ToolSchema> lookup(String toolName) {
        return ToolName.fromWireName(toolName).flatMap(this::lookup);
    }

    public Optional<ToolSchema> lookup(ToolName tool) {
        return Optional.ofNullable(this.schemas.get(tool));
    }

    public List<ToolSchema> catalog() {
        return new ArrayList<ToolSchema>(this.schemas.values());
    }

    private void register(Map<ToolName, ToolSchema> target, Set<ToolName> disabled, ToolSchema schema) {
        if (disabled.contains(schema.tool())) {
            log.info("Tool {} disabled by configuration", schema.name());
            return;
        }
        target.put(schema.tool(), schema);
    }

    private static Set<ToolName> parseDisabled(String raw) {
        LinkedHashSet<ToolName> disabled = new LinkedHashSet<ToolName>();
        if (raw == null || raw.isBlank()) {
            return disabled;
        }
        for (String part : raw.split(",")) {
            String name = part.trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            Optional<ToolName> tool = ToolName.fromWireName(name);
            if (tool.isPresent()) {
                disabled.add(tool.get());
            } else {
                log.warn("Ignoring unknown tool in insight.tools.disabled: {}", name);
            }
        }
        return disabled;
    }
}
