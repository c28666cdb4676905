package com.agenteval.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class EvaluationRequests {

    private EvaluationRequests() {
    }

    public record CreateEvaluationRequest(
            @NotBlank(message = "taskId is required")
            @Size(max = 128, message = "taskId must be at most 128 characters")
            String taskId,

            @NotEmpty(message = "at least one agent is required")
            @Size(max = 32, message = "at most 32 agents can be compared")
            List<
                    @NotBlank(message = "agent name must not be blank")
                    @Pattern(
                            regexp = "^[A-Za-z0-9][A-Za-z0-9._-]{0,127}$",
                            message = "agent name may only contain letters, digits, '.', '_' and '-'"
                    )
                    String> agents,

            JsonNode metadata
    ) {
    }
}
