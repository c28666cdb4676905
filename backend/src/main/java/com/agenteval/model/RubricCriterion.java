package com.agenteval.model;

public record RubricCriterion(
        String name,
        int weight,
        String description
) {
    public static final int MIN_WEIGHT = 1;
    public static final int MAX_WEIGHT = 100;

    public RubricCriterion {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("criterion name is required");
        }
        if (weight < MIN_WEIGHT || weight > MAX_WEIGHT) {
            throw new IllegalArgumentException(
                    "Criterion '" + name + "' weight must be between " + MIN_WEIGHT + " and " + MAX_WEIGHT
            );
        }
        name = name.trim();
        description = description == null ? "" : description.trim();
    }
}
