package com.jreinhal.insight.access;

import com.jreinhal.insight.model.Category;
import com.jreinhal.insight.repository.CategoryRepository;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * The universe of category names. Always read from the store.
 */
@Component
public class CategoryCatalog {
    private final CategoryRepository categoryRepository;

    public CategoryCatalog(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    public Set<String> allCategoryNames() {
        TreeSet<String> names = new TreeSet<String>();
        for (Category category : this.categoryRepository.findAll()) {
            if (category.getName() != null && !category.getName().isBlank()) {
                names.add(category.getName());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    public boolean exists(String name) {
        return name != null && this.categoryRepository.existsByName(name);
    }
}
