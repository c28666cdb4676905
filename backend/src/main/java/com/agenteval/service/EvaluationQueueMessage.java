package com.agenteval.service;

import com.agenteval.provider.JudgeCredentials;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One agent scoring request. Credentials stay in process and are dropped when the message is serialized.
 */
public record EvaluationQueueMessage(
        String evaluationId,
        String agentName,
        @JsonIgnore JudgeCredentials credentials
) {
    public EvaluationQueueMessage {
        if (evaluationId == null || evaluationId.isBlank()) {
            throw new IllegalArgumentException("evaluationId is required");
        }
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName is required");
        }
        evaluationId = evaluationId.trim();
        agentName = agentName.trim();
        credentials = credentials == null ? JudgeCredentials.none() : credentials;
    }

    public EvaluationQueueMessage(String evaluationId, String agentName) {
        this(evaluationId, agentName, JudgeCredentials.none());
    }
}
