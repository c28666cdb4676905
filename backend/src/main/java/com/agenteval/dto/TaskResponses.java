package com.agenteval.dto;

import com.agenteval.model.EvaluationStrategy;
import com.agenteval.model.RubricCriterion;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public final class TaskResponses {

    private TaskResponses() {
    }

    public record TaskSummary(
            String taskId,
            String name,
            String description,
            String category,
            EvaluationStrategy evaluationStrategy,
            boolean active,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }

    public record TaskDetail(
            String taskId,
            String name,
            String description,
            String category,
            EvaluationStrategy evaluationStrategy,
            String judgeModel,
            List<RubricCriterion> rubric,
            Map<String, String> agentPrompts,
            boolean active,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }
}
