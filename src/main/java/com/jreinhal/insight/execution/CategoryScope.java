package com.jreinhal.insight.execution;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * The set of categories a data-source query may touch. Every {@link ReviewDataSource} method
 * takes one; there is no unscoped query.
 */
public record CategoryScope(Set<String> categories) {

    public CategoryScope {
        categories = categories == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<String>(categories));
    }

    public static CategoryScope of(Collection<String> categories) {
        return new CategoryScope(categories == null ? Set.of() : new TreeSet<String>(categories));
    }

    public boolean contains(String category) {
        return category != null && this.categories.contains(category);
    }

    /**
     * Intersection with the requested names. Never widens the scope.
     */
    public CategoryScope narrowTo(Collection<String> requested) {
        TreeSet<String> narrowed = new TreeSet<String>();
        for (String name : requested) {
            if (this.contains(name)) {
                narrowed.add(name);
            }
        }
        return new CategoryScope(narrowed);
    }

    public boolean isEmpty() {
        return this.categories.isEmpty();
    }

    public int size() {
        return this.categories.size();
    }
}
