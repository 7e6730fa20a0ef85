package com.jreinhal.insight.tools;

import java.util.List;
import java.util.Optional;

public record ToolSchema(ToolName tool, String description, List<ParameterSpec> parameters) {

    public ToolSchema {
        parameters = List.copyOf(parameters);
    }

    public String name() {
        return this.tool.wireName();
    }

    /**
     * Resolves a raw argument key, canonical or alias, to its parameter.
     */
    public Optional<ParameterSpec> parameterFor(String key) {
        for (ParameterSpec spec : this.parameters) {
            if (spec.matches(key)) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }

    public Optional<ParameterSpec> parameter(String name) {
        for (ParameterSpec spec : this.parameters) {
            if (spec.name().equals(name)) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }
}
