package com.agenteval.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class EvaluationRequestException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public EvaluationRequestException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static EvaluationRequestException evaluationNotFound(String evaluationId) {
        return new EvaluationRequestException(
                HttpStatus.NOT_FOUND,
                "evaluation_not_found",
                "Evaluation not found: " + evaluationId
        );
    }

    public static EvaluationRequestException taskNotFound(String taskId) {
        return new EvaluationRequestException(
                HttpStatus.NOT_FOUND,
                "task_not_found",
                "Task not found: " + taskId
        );
    }

    public static EvaluationRequestException invalidAgent(String evaluationId, String agentName) {
        return new EvaluationRequestException(
                HttpStatus.BAD_REQUEST,
                "invalid_agent",
                "Agent " + agentName + " is not part of evaluation " + evaluationId
        );
    }

    public static EvaluationRequestException duplicateAgent(String agentName) {
        return new EvaluationRequestException(
                HttpStatus.BAD_REQUEST,
                "duplicate_agent",
                "Agent listed more than once: " + agentName
        );
    }

    public static EvaluationRequestException evaluationFailed(String evaluationId) {
        return new EvaluationRequestException(
                HttpStatus.CONFLICT,
                "evaluation_failed",
                "Evaluation " + evaluationId + " has failed and must be reset before scoring"
        );
    }
}
