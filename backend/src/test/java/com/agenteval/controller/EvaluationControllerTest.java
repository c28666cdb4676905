package com.agenteval.controller;

import com.agenteval.dto.EvaluationResponses;
import com.agenteval.model.AgentStatus;
import com.agenteval.model.EvaluationStatus;
import com.agenteval.provider.JudgeCredentials;
import com.agenteval.service.EvaluationService;
import com.agenteval.web.EvaluationRequestException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EvaluationController.class)
class EvaluationControllerTest {

    private static final String EVALUATION_ID = "eval-20261018-0001";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EvaluationService evaluationService;

    @Test
    void createEvaluationReturnsCreatedPayload() throws Exception {
        when(evaluationService.createEvaluation(any())).thenReturn(sampleDetail(EvaluationStatus.ACTIVE));

        mockMvc.perform(post("/api/evaluations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "taskId": "css-consolidation",
                                  "agents": ["claude", "cursor"]
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.evaluationId").value(EVALUATION_ID))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.agentStatus.claude").value("PENDING"))
                .andExpect(jsonPath("$.agents.length()").value(2));
    }

    @Test
    void createEvaluationValidationFailureReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/evaluations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "taskId": "",
                                  "agents": []
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.fieldErrors.taskId").value("taskId is required"));

        verify(evaluationService, never()).createEvaluation(any());
    }

    @Test
    void createEvaluationRejectsAgentNamesWithPathSeparators() throws Exception {
        mockMvc.perform(post("/api/evaluations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "taskId": "css-consolidation",
                                  "agents": ["../claude"]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"));

        verify(evaluationService, never()).createEvaluation(any());
    }

    @Test
    void createEvaluationForUnknownTaskReturnsNotFound() throws Exception {
        when(evaluationService.createEvaluation(any()))
                .thenThrow(EvaluationRequestException.taskNotFound("missing-task"));

        mockMvc.perform(post("/api/evaluations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "taskId": "missing-task",
                                  "agents": ["claude"]
                                }
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("task_not_found"))
                .andExpect(jsonPath("$.message").value("Task not found: missing-task"));
    }

    @Test
    void listEvaluationsPassesStatusFilterAndLimit() throws Exception {
        when(evaluationService.listEvaluations(EvaluationStatus.COMPLETED, 5))
                .thenReturn(List.of(sampleSummary()));

        mockMvc.perform(get("/api/evaluations")
                        .param("status", "COMPLETED")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].evaluationId").value(EVALUATION_ID))
                .andExpect(jsonPath("$[0].status").value("COMPLETED"));
    }

    @Test
    void getUnknownEvaluationReturnsNotFound() throws Exception {
        when(evaluationService.getEvaluation("eval-missing"))
                .thenThrow(EvaluationRequestException.evaluationNotFound("eval-missing"));

        mockMvc.perform(get("/api/evaluations/{evaluationId}", "eval-missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("evaluation_not_found"));
    }

    @Test
    void completeAgentForwardsJudgeKeyAndReturnsAccepted() throws Exception {
        when(evaluationService.markAgentReady(eq(EVALUATION_ID), eq("claude"), any(JudgeCredentials.class)))
                .thenReturn(new EvaluationResponses.AgentSubmission(
                        EVALUATION_ID,
                        "claude",
                        AgentStatus.READY,
                        "Agent claude queued for scoring"
                ));

        mockMvc.perform(post("/api/evaluations/{evaluationId}/agents/{agentName}/complete", EVALUATION_ID, "claude")
                        .header(EvaluationController.JUDGE_API_KEY_HEADER, "sk-or-test"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.agentName").value("claude"))
                .andExpect(jsonPath("$.agentStatus").value("READY"));

        verify(evaluationService).markAgentReady(EVALUATION_ID, "claude", JudgeCredentials.of("sk-or-test"));
    }

    @Test
    void completeAgentWithoutHeaderUsesNoCredentials() throws Exception {
        when(evaluationService.markAgentReady(eq(EVALUATION_ID), eq("cursor"), any(JudgeCredentials.class)))
                .thenReturn(new EvaluationResponses.AgentSubmission(
                        EVALUATION_ID,
                        "cursor",
                        AgentStatus.READY,
                        "Agent cursor queued for scoring"
                ));

        mockMvc.perform(post("/api/evaluations/{evaluationId}/agents/{agentName}/complete", EVALUATION_ID, "cursor"))
                .andExpect(status().isAccepted());

        verify(evaluationService).markAgentReady(EVALUATION_ID, "cursor", JudgeCredentials.none());
    }

    @Test
    void completeAgentOnFailedEvaluationReturnsConflict() throws Exception {
        when(evaluationService.markAgentReady(eq(EVALUATION_ID), eq("claude"), any(JudgeCredentials.class)))
                .thenThrow(EvaluationRequestException.evaluationFailed(EVALUATION_ID));

        mockMvc.perform(post("/api/evaluations/{evaluationId}/agents/{agentName}/complete", EVALUATION_ID, "claude"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("evaluation_failed"));
    }

    @Test
    void completeUnknownAgentReturnsBadRequest() throws Exception {
        when(evaluationService.markAgentReady(eq(EVALUATION_ID), eq("gemini"), any(JudgeCredentials.class)))
                .thenThrow(EvaluationRequestException.invalidAgent(EVALUATION_ID, "gemini"));

        mockMvc.perform(post("/api/evaluations/{evaluationId}/agents/{agentName}/complete", EVALUATION_ID, "gemini"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_agent"));
    }

    @Test
    void resetEvaluationReturnsActiveDetail() throws Exception {
        when(evaluationService.resetEvaluation(EVALUATION_ID)).thenReturn(sampleDetail(EvaluationStatus.ACTIVE));

        mockMvc.perform(post("/api/evaluations/{evaluationId}/reset", EVALUATION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    private static EvaluationResponses.EvaluationDetail sampleDetail(EvaluationStatus status) {
        OffsetDateTime now = OffsetDateTime.parse("2026-10-18T10:00:00Z");
        return new EvaluationResponses.EvaluationDetail(
                EVALUATION_ID,
                "css-consolidation",
                List.of("claude", "cursor"),
                status,
                agentStatus(AgentStatus.PENDING),
                null,
                null,
                Map.of(),
                now,
                now,
                null
        );
    }

    private static EvaluationResponses.EvaluationSummary sampleSummary() {
        OffsetDateTime now = OffsetDateTime.parse("2026-10-18T10:00:00Z");
        return new EvaluationResponses.EvaluationSummary(
                EVALUATION_ID,
                "css-consolidation",
                List.of("claude", "cursor"),
                EvaluationStatus.COMPLETED,
                agentStatus(AgentStatus.COMPLETED),
                now,
                now,
                now
        );
    }

    private static Map<String, AgentStatus> agentStatus(AgentStatus status) {
        Map<String, AgentStatus> agentStatus = new LinkedHashMap<>();
        agentStatus.put("claude", status);
        agentStatus.put("cursor", status);
        return agentStatus;
    }
}
