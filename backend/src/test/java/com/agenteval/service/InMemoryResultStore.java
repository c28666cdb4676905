package com.agenteval.service;

import com.agenteval.model.AgentResult;
import com.agenteval.model.Evaluation;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link ResultStore} for orchestration tests. Row locking is provided by the test's
 * transaction manager.
 */
class InMemoryResultStore implements ResultStore {

    private final Map<String, Evaluation> evaluations = new ConcurrentHashMap<>();
    private final Map<String, AgentResult> results = new ConcurrentHashMap<>();

    void save(Evaluation evaluation) {
        evaluations.put(evaluation.getEvaluationId(), evaluation);
    }

    int resultCount() {
        return results.size();
    }

    Optional<AgentResult> result(String evaluationId, String agentName) {
        return Optional.ofNullable(results.get(key(evaluationId, agentName)));
    }

    @Override
    public Optional<Evaluation> findEvaluation(String evaluationId) {
        return Optional.ofNullable(evaluations.get(evaluationId));
    }

    @Override
    public Optional<Evaluation> findEvaluationForUpdate(String evaluationId) {
        return findEvaluation(evaluationId);
    }

    @Override
    public AgentResult upsertAgentResult(AgentResultRecord record) {
        AgentResult result = results.computeIfAbsent(key(record.evaluationId(), record.agentName()), ignored -> {
            AgentResult created = new AgentResult();
            created.setResultId(UUID.randomUUID());
            created.setEvaluationId(record.evaluationId());
            created.setAgentName(record.agentName());
            return created;
        });
        result.setStatus(record.status());
        result.setScore(record.score());
        result.setBreakdown(new LinkedHashMap<>(record.breakdown()));
        result.setFeedback(record.feedback());
        result.setStrengths(new ArrayList<>(record.strengths()));
        result.setImprovements(new ArrayList<>(record.improvements()));
        result.setOutputs(record.outputs());
        result.setStartedAt(record.startedAt());
        result.setCompletedAt(record.completedAt());
        result.setUpdatedAt(OffsetDateTime.now());
        return result;
    }

    @Override
    public Evaluation updateEvaluationStatus(Evaluation evaluation) {
        evaluations.put(evaluation.getEvaluationId(), evaluation);
        return evaluation;
    }

    @Override
    public List<AgentResult> findAgentResults(String evaluationId) {
        return results.values().stream()
                .filter(result -> result.getEvaluationId().equals(evaluationId))
                .toList();
    }

    private static String key(String evaluationId, String agentName) {
        return evaluationId + "/" + agentName;
    }
}
