package com.agenteval.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Collections;

/**
 * Parsed, validated view of a task configuration document.
 */
public record TaskDefinition(
        String taskId,
        String name,
        String description,
        String category,
        EvaluationStrategy strategy,
        List<RubricCriterion> rubric,
        String judgeModel,
        String judgePromptTemplate,
        Map<String, String> agentPrompts
) {
    public TaskDefinition {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        taskId = taskId.trim();
        name = name == null || name.isBlank() ? taskId : name.trim();
        strategy = strategy == null ? EvaluationStrategy.RULE_BASED : strategy;
        rubric = rubric == null ? List.of() : List.copyOf(rubric);
        agentPrompts = agentPrompts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(agentPrompts));
    }

    public boolean hasJudgeModel() {
        return judgeModel != null && !judgeModel.isBlank();
    }
}
