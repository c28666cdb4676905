package com.agenteval.service;

import com.agenteval.model.AgentStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Values written for one (evaluation, agent) result row.
 */
public record AgentResultRecord(
        String evaluationId,
        String agentName,
        AgentStatus status,
        int score,
        Map<String, Integer> breakdown,
        String feedback,
        List<String> strengths,
        List<String> improvements,
        JsonNode outputs,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt
) {
    public AgentResultRecord {
        Objects.requireNonNull(evaluationId, "evaluationId is required");
        Objects.requireNonNull(agentName, "agentName is required");
        Objects.requireNonNull(status, "status is required");
        breakdown = breakdown == null ? Map.of() : breakdown;
        strengths = strengths == null ? List.of() : strengths;
        improvements = improvements == null ? List.of() : improvements;
    }
}
