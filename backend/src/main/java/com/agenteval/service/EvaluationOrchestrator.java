package com.agenteval.service;

import com.agenteval.model.AgentStatus;
import com.agenteval.model.Evaluation;
import com.agenteval.model.EvaluationStatus;
import com.agenteval.model.TaskDefinition;
import com.agenteval.provider.JudgeCredentials;
import com.agenteval.provider.JudgeScorerFactory;
import com.agenteval.scoring.ScoreResult;
import com.agenteval.scoring.Scorer;
import com.agenteval.scoring.ScorerSelector;
import com.agenteval.scoring.ScoringContext;
import com.agenteval.web.EvaluationRequestException;
import com.agenteval.workspace.WorkspaceException;
import com.agenteval.workspace.WorkspaceProvider;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Scores one agent of an evaluation and advances the evaluation lifecycle.
 * <p>
 * Scoring runs outside any transaction. The result upsert, the per-agent status change and the completion
 * check share one transaction holding the evaluation row lock, so concurrent calls for different agents
 * observe each other's status and only one of them performs the COMPLETED transition. The comparison
 * report is published after that transaction commits.
 */
@Service
@RequiredArgsConstructor
public class EvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);
    private static final int MAX_REASON_LENGTH = 512;

    private final ResultStore resultStore;
    private final WorkspaceProvider workspaceProvider;
    private final TaskCatalogService taskCatalogService;
    private final ScorerSelector scorerSelector;
    private final JudgeScorerFactory judgeScorerFactory;
    private final ReportSink reportSink;
    private final TransactionTemplate transactionTemplate;

    public ScoreResult evaluate(String evaluationId, String agentName) {
        return evaluate(evaluationId, agentName, JudgeCredentials.none());
    }

    public ScoreResult evaluate(String evaluationId, String agentName, JudgeCredentials credentials) {
        OffsetDateTime startedAt = OffsetDateTime.now();
        TaskDefinition task;
        try {
            task = transactionTemplate.execute(status -> beginEvaluation(evaluationId, agentName, startedAt));
        } catch (TaskConfigurationException ex) {
            failEvaluation(evaluationId, ex.getMessage());
            throw ex;
        }

        Map<String, String> baselineFiles = loadBaseline(task.taskId());
        Map<String, String> solutionFiles = loadSolution(evaluationId, agentName);

        Scorer scorer = scorerSelector.select(task.strategy(), judgeScorerFactory.create(credentials));
        ScoreResult result = scorer.score(baselineFiles, solutionFiles, new ScoringContext(task, agentName));
        log.info(
                "Scored agent {} for evaluation {}: {} ({})",
                agentName,
                evaluationId,
                result.totalScore(),
                result.kind()
        );

        CompletionOutcome outcome = transactionTemplate.execute(
                status -> recordResult(evaluationId, agentName, result, startedAt)
        );
        if (outcome != null && outcome.completedNow()) {
            publishReport(evaluationId, outcome.rankedResults());
        }
        return result;
    }

    /**
     * Records a scoring failure for one agent so it reaches a terminal status. An agent that already holds a
     * completed result keeps it.
     */
    public void markFailed(String evaluationId, String agentName, String reason) {
        String safeReason = truncate(reason);
        transactionTemplate.executeWithoutResult(status -> {
            Evaluation evaluation = resultStore.findEvaluationForUpdate(evaluationId).orElse(null);
            if (evaluation == null || !evaluation.hasAgent(agentName)) {
                log.warn(
                        "Cannot record failure for agent {} of evaluation {}: evaluation or agent unknown",
                        agentName,
                        evaluationId
                );
                return;
            }
            if (evaluation.agentStatusOf(agentName) == AgentStatus.COMPLETED) {
                log.warn(
                        "Agent {} of evaluation {} keeps its completed result after a failed re-run: {}",
                        agentName,
                        evaluationId,
                        safeReason
                );
                return;
            }

            OffsetDateTime now = OffsetDateTime.now();
            ObjectNode outputs = JsonNodeFactory.instance.objectNode();
            outputs.put("evaluation_type", "failed");
            outputs.put("error", safeReason);
            resultStore.upsertAgentResult(new AgentResultRecord(
                    evaluationId,
                    agentName,
                    AgentStatus.FAILED,
                    0,
                    Map.of(),
                    "Evaluation failed: " + safeReason,
                    List.of(),
                    List.of(),
                    outputs,
                    null,
                    now
            ));
            evaluation.updateAgentStatus(agentName, AgentStatus.FAILED);
            evaluation.setUpdatedAt(now);
            resultStore.updateEvaluationStatus(evaluation);
            log.warn("Marked agent {} of evaluation {} as FAILED: {}", agentName, evaluationId, safeReason);
        });
    }

    /**
     * Moves the evaluation to FAILED after an unrecoverable orchestration error. Completed evaluations are
     * left untouched.
     */
    public void failEvaluation(String evaluationId, String reason) {
        String safeReason = truncate(reason);
        transactionTemplate.executeWithoutResult(status -> {
            Evaluation evaluation = resultStore.findEvaluationForUpdate(evaluationId)
                    .orElseThrow(() -> EvaluationRequestException.evaluationNotFound(evaluationId));
            if (evaluation.getStatus() == EvaluationStatus.COMPLETED
                    || evaluation.getStatus() == EvaluationStatus.FAILED) {
                return;
            }
            OffsetDateTime now = OffsetDateTime.now();
            evaluation.setStatus(EvaluationStatus.FAILED);
            evaluation.setFailureReason(safeReason);
            evaluation.setUpdatedAt(now);
            resultStore.updateEvaluationStatus(evaluation);
            log.error("Evaluation {} moved to FAILED: {}", evaluationId, safeReason);
        });
    }

    private TaskDefinition beginEvaluation(String evaluationId, String agentName, OffsetDateTime now) {
        Evaluation evaluation = resultStore.findEvaluationForUpdate(evaluationId)
                .orElseThrow(() -> EvaluationRequestException.evaluationNotFound(evaluationId));
        if (!evaluation.hasAgent(agentName)) {
            throw EvaluationRequestException.invalidAgent(evaluationId, agentName);
        }
        TaskDefinition task = resolveTask(evaluation.getTaskId());

        if (evaluation.getStatus() == EvaluationStatus.FAILED) {
            throw EvaluationRequestException.evaluationFailed(evaluationId);
        }
        if (evaluation.getStatus() == EvaluationStatus.COMPLETED) {
            log.info("Re-scoring agent {} of completed evaluation {}", agentName, evaluationId);
            return task;
        }

        evaluation.updateAgentStatus(agentName, AgentStatus.EVALUATING);
        if (evaluation.getStatus() == EvaluationStatus.PENDING) {
            evaluation.setStatus(EvaluationStatus.ACTIVE);
            log.info("Evaluation {} moved to ACTIVE", evaluationId);
        }
        evaluation.setUpdatedAt(now);
        resultStore.updateEvaluationStatus(evaluation);
        return task;
    }

    private TaskDefinition resolveTask(String taskId) {
        try {
            return taskCatalogService.requireTaskDefinition(taskId);
        } catch (IllegalArgumentException ex) {
            throw new TaskConfigurationException(
                    "Task " + taskId + " has an invalid configuration: " + ex.getMessage(),
                    ex
            );
        }
    }

    private CompletionOutcome recordResult(
            String evaluationId,
            String agentName,
            ScoreResult result,
            OffsetDateTime startedAt
    ) {
        Evaluation evaluation = resultStore.findEvaluationForUpdate(evaluationId)
                .orElseThrow(() -> EvaluationRequestException.evaluationNotFound(evaluationId));
        OffsetDateTime now = OffsetDateTime.now();

        resultStore.upsertAgentResult(new AgentResultRecord(
                evaluationId,
                agentName,
                AgentStatus.COMPLETED,
                result.totalScore(),
                result.breakdown(),
                result.feedback(),
                result.strengths(),
                result.improvements(),
                result.details(),
                startedAt,
                now
        ));
        evaluation.updateAgentStatus(agentName, AgentStatus.COMPLETED);

        boolean completedNow = false;
        if (evaluation.getStatus().isOpen() && evaluation.allAgentsCompleted()) {
            evaluation.setStatus(EvaluationStatus.COMPLETED);
            evaluation.setCompletedAt(now);
            completedNow = true;
            log.info("Evaluation {} moved to COMPLETED", evaluationId);
        }
        evaluation.setUpdatedAt(now);
        resultStore.updateEvaluationStatus(evaluation);

        if (!completedNow) {
            return new CompletionOutcome(false, List.of());
        }
        return new CompletionOutcome(
                true,
                ResultRanking.rank(evaluation.getAgents(), resultStore.findAgentResults(evaluationId))
        );
    }

    private Map<String, String> loadBaseline(String taskId) {
        try {
            return workspaceProvider.loadBaseline(taskId);
        } catch (WorkspaceException ex) {
            log.warn("Failed to load baseline for task {}: {}", taskId, ex.getMessage());
            return Map.of();
        }
    }

    private Map<String, String> loadSolution(String evaluationId, String agentName) {
        try {
            return workspaceProvider.loadSolution(evaluationId, agentName);
        } catch (WorkspaceException ex) {
            log.warn(
                    "Failed to load solution for evaluation {} agent {}: {}",
                    evaluationId,
                    agentName,
                    ex.getMessage()
            );
            return Map.of();
        }
    }

    private void publishReport(String evaluationId, List<RankedResult> rankedResults) {
        try {
            reportSink.publish(evaluationId, rankedResults);
        } catch (RuntimeException ex) {
            log.error("Failed to publish comparison report for evaluation {}", evaluationId, ex);
        }
    }

    private static String truncate(String reason) {
        if (reason == null || reason.isBlank()) {
            return "unknown error";
        }
        String normalized = reason.trim();
        return normalized.length() <= MAX_REASON_LENGTH ? normalized : normalized.substring(0, MAX_REASON_LENGTH);
    }

    private record CompletionOutcome(boolean completedNow, List<RankedResult> rankedResults) {
    }
}
