package com.jreinhal.insight.tools;

import java.util.List;

/**
 * One typed parameter of a tool. Integer parameters carry inclusive bounds, enum parameters
 * their allowed values; both carry the default used when a value is missing or unusable.
 */
public record ParameterSpec(String name, List<String> aliases, Kind kind, boolean required,
                            Integer min, Integer max, List<String> allowedValues, Object defaultValue) {

    public ParameterSpec {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public static ParameterSpec integer(String name, int min, int max, int defaultValue, String... aliases) {
        if (min > max) {
            throw new IllegalArgumentException("Invalid bounds for " + name + ": " + min + " > " + max);
        }
        int clampedDefault = Math.max(min, Math.min(max, defaultValue));
        return new ParameterSpec(name, List.of(aliases), Kind.INTEGER, false, min, max, null, clampedDefault);
    }

    public static ParameterSpec enumeration(String name, List<String> allowedValues, String defaultValue) {
        if (!allowedValues.contains(defaultValue)) {
            throw new IllegalArgumentException("Default " + defaultValue + " not allowed for " + name);
        }
        return new ParameterSpec(name, List.of(), Kind.ENUM, false, null, null, allowedValues, defaultValue);
    }

    public static ParameterSpec category(String name, boolean required) {
        return new ParameterSpec(name, List.of(), Kind.CATEGORY, required, null, null, null, null);
    }

    public static ParameterSpec categoryList(String name) {
        return new ParameterSpec(name, List.of(), Kind.CATEGORY_LIST, false, null, null, null, null);
    }

    public boolean matches(String key) {
        if (key == null) {
            return false;
        }
        if (this.name.equalsIgnoreCase(key)) {
            return true;
        }
        for (String alias : this.aliases) {
            if (alias.equalsIgnoreCase(key)) {
                return true;
            }
        }
        return false;
    }

    public boolean isCategoryReference() {
        return this.kind == Kind.CATEGORY || this.kind == Kind.CATEGORY_LIST;
    }

    public static enum Kind {
        INTEGER,
        ENUM,
        CATEGORY,
        CATEGORY_LIST;

    }
}
