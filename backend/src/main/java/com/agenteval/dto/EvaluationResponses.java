package com.agenteval.dto;

import com.agenteval.model.AgentStatus;
import com.agenteval.model.EvaluationStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public final class EvaluationResponses {

    private EvaluationResponses() {
    }

    public record EvaluationSummary(
            String evaluationId,
            String taskId,
            List<String> agents,
            EvaluationStatus status,
            Map<String, AgentStatus> agentStatus,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record EvaluationDetail(
            String evaluationId,
            String taskId,
            List<String> agents,
            EvaluationStatus status,
            Map<String, AgentStatus> agentStatus,
            JsonNode metadata,
            String failureReason,
            Map<String, AgentResultView> results,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record AgentResultView(
            String agentName,
            Integer score,
            Map<String, Integer> breakdown,
            String feedback,
            List<String> strengths,
            List<String> improvements,
            AgentStatus status,
            OffsetDateTime startedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record AgentSubmission(
            String evaluationId,
            String agentName,
            AgentStatus agentStatus,
            String message
    ) {
    }
}
