package com.agenteval.model;

import java.util.Locale;

/**
 * How a task's solutions are scored. Parsed from the {@code evaluation.type} field of a task document.
 */
public enum EvaluationStrategy {
    RULE_BASED("rule_based"),
    AI_JUDGE("ai_judge"),
    HYBRID("hybrid");

    private final String configValue;

    EvaluationStrategy(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    public boolean usesJudge() {
        return this != RULE_BASED;
    }

    public static EvaluationStrategy fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return RULE_BASED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EvaluationStrategy strategy : values()) {
            if (strategy.configValue.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unsupported evaluation type '" + value + "'");
    }
}
