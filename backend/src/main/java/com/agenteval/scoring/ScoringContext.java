package com.agenteval.scoring;

import com.agenteval.model.TaskDefinition;

import java.util.Objects;

public record ScoringContext(TaskDefinition task, String agentName) {
    public ScoringContext {
        Objects.requireNonNull(task, "task is required");
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName is required");
        }
    }
}
