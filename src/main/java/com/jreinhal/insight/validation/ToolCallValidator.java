package com.jreinhal.insight.validation;

import com.jreinhal.insight.access.AccessDecision;
import com.jreinhal.insight.access.AccessModel;
import com.jreinhal.insight.model.User;
import com.jreinhal.insight.routing.RouterDecision;
import com.jreinhal.insight.tools.ParameterSpec;
import com.jreinhal.insight.tools.ToolCall;
import com.jreinhal.insight.tools.ToolName;
import com.jreinhal.insight.tools.ToolParameters;
import com.jreinhal.insight.tools.ToolRegistry;
import com.jreinhal.insight.tools.ToolSchema;
import com.jreinhal.insight.util.LogSanitizer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Deterministic gate between the interpreter and the executor.
 *
 * <p>Checks run in a fixed order: interpreter availability and ambiguity, tool support,
 * the schema pass (clamp, default, drop), category authorization, then cross-parameter
 * consistency. Out-of-range numbers and unknown enum values are coerced; a missing required
 * category, an unauthorized category or an inconsistent call is rejected.</p>
 */
@Component
public class ToolCallValidator {
    private static final Logger log = LoggerFactory.getLogger(ToolCallValidator.class);

    private final ToolRegistry toolRegistry;
    private final AccessModel accessModel;
    private final double minConfidence;

    public ToolCallValidator(ToolRegistry toolRegistry, AccessModel accessModel,
                             @Value("${insight.validation.min-confidence:0.4}") double minConfidence) {
        this.toolRegistry = toolRegistry;
        this.accessModel = accessModel;
        this.minConfidence = minConfidence;
    }

    public ValidationVerdict validate(RouterDecision decision, User user) {
        if (decision == null || decision instanceof RouterDecision.Unavailable) {
            String detail = decision == null ? "no decision" : ((RouterDecision.Unavailable) decision).detail();
            return ValidationVerdict.Rejected.of(RejectionReason.INTERPRETER_UNAVAILABLE, detail);
        }
        if (decision instanceof RouterDecision.Unknown unknown) {
            if (!unknown.hasToolName() || unknown.ambiguous()) {
                return ValidationVerdict.Rejected.of(RejectionReason.AMBIGUOUS_INTENT, "interpreter did not select a tool");
            }
            return ValidationVerdict.Rejected.of(RejectionReason.UNSUPPORTED_TOOL,
                    "unsupported tool '" + LogSanitizer.sanitize(unknown.rawToolName()) + "'");
        }
        RouterDecision.Proposal proposal = (RouterDecision.Proposal) decision;
        if (proposal.ambiguous() || proposal.confidence() < this.minConfidence) {
            return ValidationVerdict.Rejected.of(RejectionReason.AMBIGUOUS_INTENT,
                    "intent unclear (confidence " + proposal.confidence() + ")");
        }
        return this.validateArguments(proposal.tool(), proposal.arguments(), user);
    }

    /**
     * Re-runs the schema and access checks on an existing call, for example a previous turn's
     * call that may no longer be permitted.
     */
    public ValidationVerdict revalidate(ToolCall call, User user) {
        return this.validateArguments(call.tool(), call.parameters(), user);
    }

    private ValidationVerdict validateArguments(ToolName tool, Map<String, Object> rawArguments, User user) {
        Optional<ToolSchema> found = this.toolRegistry.lookup(tool);
        if (found.isEmpty()) {
            return ValidationVerdict.Rejected.of(RejectionReason.UNSUPPORTED_TOOL, "tool '" + tool.wireName() + "' is not enabled");
        }
        ToolSchema schema = found.get();
        List<Coercion> coercions = new ArrayList<Coercion>();
        Map<String, Object> resolved = this.resolveNames(schema, rawArguments, coercions);
        Set<String> visible = this.accessModel.resolveVisibleCategories(user);
        TreeMap<String, Object> params = new TreeMap<String, Object>();
        for (ParameterSpec spec : schema.parameters()) {
            Object value = resolved.get(spec.name());
            switch (spec.kind()) {
                case INTEGER -> params.put(spec.name(), this.coerceInteger(spec, value, coercions));
                case ENUM -> params.put(spec.name(), this.coerceEnum(spec, value, coercions));
                case CATEGORY -> {
                    String category = this.coerceCategory(spec, value, visible, coercions);
                    if (category == null && spec.required()) {
                        return new ValidationVerdict.Rejected(RejectionReason.INVALID_ARGUMENTS,
                                "missing required category '" + spec.name() + "'", null, tool, params);
                    }
                    if (category != null) {
                        params.put(spec.name(), category);
                    }
                }
                case CATEGORY_LIST -> {
                    List<String> categories = this.coerceCategoryList(spec, value, visible, coercions);
                    if (categories != null) {
                        params.put(spec.name(), categories);
                    }
                }
            }
        }
        if (tool == ToolName.GENERAL_QUERY) {
            this.normalizeGeneralQuery(params, coercions);
        }
        for (ParameterSpec spec : schema.parameters()) {
            if (!spec.isCategoryReference() || !params.containsKey(spec.name())) {
                continue;
            }
            Object value = params.get(spec.name());
            List<String> referenced = value instanceof List<?> ? castList(value) : List.of((String) value);
            for (String category : referenced) {
                if (this.accessModel.authorize(user, category) != AccessDecision.ALLOWED) {
                    log.info("Validator denied category for user {} on {}", user != null ? user.getId() : null, tool.wireName());
                    return new ValidationVerdict.Rejected(RejectionReason.ACCESS_DENIED,
                            "category not permitted for this user", category, tool, params);
                }
                if (!visible.contains(category)) {
                    return new ValidationVerdict.Rejected(RejectionReason.INVALID_ARGUMENTS,
                            "unknown category", category, tool, params);
                }
            }
        }
        if (tool == ToolName.COMPARE_CATEGORIES) {
            String first = (String) params.get(ToolParameters.CATEGORY_A);
            String second = (String) params.get(ToolParameters.CATEGORY_B);
            if (first.equalsIgnoreCase(second)) {
                return new ValidationVerdict.Rejected(RejectionReason.INVALID_ARGUMENTS,
                        "comparison needs two distinct categories", null, tool, params);
            }
        }
        return new ValidationVerdict.Validated(ToolCall.of(tool, params), coercions);
    }

    private Map<String, Object> resolveNames(ToolSchema schema, Map<String, Object> rawArguments, List<Coercion> coercions) {
        LinkedHashMap<String, Object> resolved = new LinkedHashMap<String, Object>();
        if (rawArguments == null) {
            return resolved;
        }
        for (Map.Entry<String, Object> entry : rawArguments.entrySet()) {
            Optional<ParameterSpec> spec = schema.parameterFor(entry.getKey());
            if (spec.isEmpty()) {
                coercions.add(new Coercion(entry.getKey(), entry.getValue(), null, "unknown parameter dropped"));
                continue;
            }
            String name = spec.get().name();
            if (resolved.containsKey(name)) {
                coercions.add(new Coercion(entry.getKey(), entry.getValue(), null, "duplicate of " + name + " dropped"));
                continue;
            }
            resolved.put(name, entry.getValue());
        }
        return resolved;
    }

    private Integer coerceInteger(ParameterSpec spec, Object value, List<Coercion> coercions) {
        Integer defaultValue = (Integer) spec.defaultValue();
        if (value == null) {
            return defaultValue;
        }
        BigDecimal number = toNumber(value);
        if (number == null) {
            coercions.add(new Coercion(spec.name(), value, defaultValue, "not a number, default applied"));
            return defaultValue;
        }
        // clamp on the raw value so rounding only ever sees in-range numbers
        if (number.compareTo(BigDecimal.valueOf(spec.min())) < 0) {
            coercions.add(new Coercion(spec.name(), value, spec.min(), "below minimum, clamped"));
            return spec.min();
        }
        if (number.compareTo(BigDecimal.valueOf(spec.max())) > 0) {
            coercions.add(new Coercion(spec.name(), value, spec.max(), "above maximum, clamped"));
            return spec.max();
        }
        BigDecimal rounded = number.setScale(0, RoundingMode.HALF_UP);
        if (rounded.compareTo(number) != 0) {
            coercions.add(new Coercion(spec.name(), value, rounded.toPlainString(), "rounded to integer"));
        }
        return Math.max(spec.min(), Math.min(spec.max(), rounded.intValueExact()));
    }

    private String coerceEnum(ParameterSpec spec, Object value, List<Coercion> coercions) {
        String defaultValue = (String) spec.defaultValue();
        if (value == null) {
            return defaultValue;
        }
        String candidate = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (spec.allowedValues().contains(candidate)) {
            return candidate;
        }
        coercions.add(new Coercion(spec.name(), value, defaultValue, "value outside allowed set, default applied"));
        return defaultValue;
    }

    private String coerceCategory(ParameterSpec spec, Object value, Set<String> visible, List<Coercion> coercions) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            coercions.add(new Coercion(spec.name(), value, null, "not a category name, dropped"));
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String canonical = canonicalCategory(trimmed, visible);
        if (!canonical.equals(trimmed)) {
            coercions.add(new Coercion(spec.name(), value, canonical, "category name normalized"));
        }
        return canonical;
    }

    private List<String> coerceCategoryList(ParameterSpec spec, Object value, Set<String> visible, List<Coercion> coercions) {
        if (value == null) {
            return null;
        }
        List<?> items;
        if (value instanceof List<?> list) {
            items = list;
        } else if (value instanceof String single) {
            items = List.of(single);
            coercions.add(new Coercion(spec.name(), value, null, "single category wrapped in list"));
        } else {
            coercions.add(new Coercion(spec.name(), value, null, "not a category list, dropped"));
            return null;
        }
        TreeSet<String> categories = new TreeSet<String>();
        for (Object item : items) {
            if (!(item instanceof String text) || text.isBlank()) {
                coercions.add(new Coercion(spec.name(), item, null, "invalid list entry dropped"));
                continue;
            }
            categories.add(canonicalCategory(text.trim(), visible));
        }
        return categories.isEmpty() ? null : new ArrayList<String>(categories);
    }

    private void normalizeGeneralQuery(Map<String, Object> params, List<Coercion> coercions) {
        Object queryType = params.get(ToolParameters.QUERY_TYPE);
        boolean hasCategory = params.containsKey(ToolParameters.CATEGORY);
        if (ToolParameters.QUERY_CATEGORY_INFO.equals(queryType) && !hasCategory) {
            params.put(ToolParameters.QUERY_TYPE, ToolParameters.QUERY_SUMMARY_STATS);
            coercions.add(new Coercion(ToolParameters.QUERY_TYPE, queryType, ToolParameters.QUERY_SUMMARY_STATS, "category_info without category"));
        } else if (!ToolParameters.QUERY_CATEGORY_INFO.equals(queryType) && hasCategory) {
            Object dropped = params.remove(ToolParameters.CATEGORY);
            coercions.add(new Coercion(ToolParameters.CATEGORY, dropped, null, "category ignored for " + queryType));
        }
    }

    private static String canonicalCategory(String name, Set<String> visible) {
        if (visible.contains(name)) {
            return name;
        }
        for (String candidate : visible) {
            if (candidate.equalsIgnoreCase(name)) {
                return candidate;
            }
        }
        return name;
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            }
            catch (NumberFormatException | ArithmeticException e) {
                return null;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static List<String> castList(Object value) {
        return (List<String>) value;
    }
}
