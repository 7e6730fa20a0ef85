package com.jreinhal.insight.fallback;

import com.jreinhal.insight.access.AccessModel;
import com.jreinhal.insight.access.CategoryGrant;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolName;
import com.jreinhal.insight.tools.ToolParameters;
import com.jreinhal.insight.validation.RejectionReason;
import com.jreinhal.insight.validation.ToolCallValidator;
import com.jreinhal.insight.validation.ValidationVerdict;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps a rejection to a safe substitute call. Rules are evaluated in order and the first
 * match wins; every call produced here is flagged as a fallback and carries the rejection
 * reason and a rationale for the reply.
 */
@Component
public class FallbackPolicy {
    private static final Logger log = LoggerFactory.getLogger(FallbackPolicy.class);

    private final AccessModel accessModel;
    private final ToolCallValidator validator;
    private final String defaultMetric;
    private final int defaultTopN;

    public FallbackPolicy(AccessModel accessModel, ToolCallValidator validator,
                          @Value("${insight.fallback.metric:review_count}") String defaultMetric,
                          @Value("${insight.fallback.top-n:5}") int defaultTopN) {
        this.accessModel = accessModel;
        this.validator = validator;
        this.defaultMetric = ToolParameters.METRICS.contains(defaultMetric) ? defaultMetric : ToolParameters.METRIC_REVIEW_COUNT;
        this.defaultTopN = Math.max(1, defaultTopN);
    }

    public ToolCall resolve(ValidationVerdict.Rejected rejection, User user, ToolCall lastGoodCall) {
        RejectionReason reason = rejection.reason();
        ToolCall substitute = switch (reason) {
            case UNSUPPORTED_TOOL, INTERPRETER_UNAVAILABLE -> ToolCall.fallback(ToolName.GENERAL_QUERY,
                    Map.of(ToolParameters.QUERY_TYPE, ToolParameters.QUERY_SUMMARY_STATS), reason,
                    reason == RejectionReason.INTERPRETER_UNAVAILABLE
                            ? "The question could not be interpreted right now, so here is a summary of the data you can access."
                            : "That request is not something this service can answer, so here is a summary of the data you can access.");
            case ACCESS_DENIED -> this.visibleTopCategories(user);
            case INVALID_ARGUMENTS -> this.invalidArguments(rejection);
            case AMBIGUOUS_INTENT -> this.ambiguous(user, lastGoodCall);
        };
        log.info("Fallback for {}: {}", reason.code(), substitute.tool().wireName());
        return substitute;
    }

    private ToolCall visibleTopCategories(User user) {
        Map<String, Object> params = this.defaultRanking();
        CategoryGrant grant = this.accessModel.grantFor(user);
        if (!grant.universal()) {
            TreeSet<String> visible = new TreeSet<String>(this.accessModel.resolveVisibleCategories(user));
            if (!visible.isEmpty()) {
                params.put(ToolParameters.CATEGORIES, new ArrayList<String>(visible));
            }
        }
        return ToolCall.fallback(ToolName.METRICS_TOP_CATEGORIES, params, RejectionReason.ACCESS_DENIED,
                "That category is outside your access, so here are the top categories you can view.");
    }

    private ToolCall invalidArguments(ValidationVerdict.Rejected rejection) {
        if (rejection.tool() == ToolName.COMPARE_CATEGORIES) {
            Object first = rejection.arguments().get(ToolParameters.CATEGORY_A);
            Object second = rejection.arguments().get(ToolParameters.CATEGORY_B);
            if (first instanceof String a && second instanceof String b && a.equalsIgnoreCase(b)) {
                return ToolCall.fallback(ToolName.RATING_DISTRIBUTION, Map.of(ToolParameters.CATEGORY, a),
                        RejectionReason.INVALID_ARGUMENTS,
                        "A comparison needs two different categories, so here is the rating distribution for " + a + ".");
            }
        }
        return ToolCall.fallback(ToolName.METRICS_TOP_CATEGORIES, this.defaultRanking(), RejectionReason.INVALID_ARGUMENTS,
                "The category could not be identified, so here are the top categories you can view.");
    }

    private ToolCall ambiguous(User user, ToolCall lastGoodCall) {
        if (lastGoodCall != null && !lastGoodCall.fallback()) {
            ValidationVerdict verdict = this.validator.revalidate(lastGoodCall, user);
            if (verdict instanceof ValidationVerdict.Validated validated) {
                return validated.call().asFallback(RejectionReason.AMBIGUOUS_INTENT,
                        "The question was unclear, so the previous analysis in this conversation was repeated.");
            }
            log.debug("Previous call no longer validates: {}", ((ValidationVerdict.Rejected) verdict).reason().code());
        }
        return ToolCall.fallback(ToolName.METRICS_TOP_CATEGORIES, this.defaultRanking(), RejectionReason.AMBIGUOUS_INTENT,
                "The question was unclear, so here are the top categories you can view.");
    }

    private Map<String, Object> defaultRanking() {
        LinkedHashMap<String, Object> params = new LinkedHashMap<String, Object>();
        params.put(ToolParameters.METRIC, this.defaultMetric);
        params.put(ToolParameters.TOP_N, this.defaultTopN);
        return params;
    }
}
