package com.jreinhal.insight.ingest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans the comma-separated category field of the review export. Marketplace noise
 * (store names, bare domains, fragments) is dropped.
 */
public final class CategoryNameFilter {
    private static final Set<String> BLOCKLIST = Set.of("buy a kindle", "amazon.co.uk", "mazon.co.uk");
    private static final Pattern HAS_LETTER = Pattern.compile("[a-z]");
    private static final int MIN_LENGTH = 3;

    private CategoryNameFilter() {
    }

    public static boolean isValid(String category) {
        if (category == null) {
            return false;
        }
        String c = category.trim().toLowerCase(Locale.ROOT);
        if (c.isEmpty() || BLOCKLIST.contains(c) || c.length() < MIN_LENGTH) {
            return false;
        }
        if (!HAS_LETTER.matcher(c).find()) {
            return false;
        }
        // domain-like tokens
        return !(c.contains(".") && !c.contains(" "));
    }

    /**
     * Valid, trimmed categories in their original order, without duplicates.
     */
    public static List<String> extract(String rawField) {
        if (rawField == null || rawField.isBlank()) {
            return List.of();
        }
        LinkedHashSet<String> categories = new LinkedHashSet<String>();
        for (String part : rawField.split(",")) {
            if (isValid(part)) {
                categories.add(part.trim());
            }
        }
        return new ArrayList<String>(categories);
    }
}
