package com.agenteval.service;

import com.agenteval.model.AgentResult;
import com.agenteval.model.Evaluation;
import com.agenteval.repository.AgentResultRepository;
import com.agenteval.repository.EvaluationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
public class JpaResultStore implements ResultStore {

    private final EvaluationRepository evaluationRepository;
    private final AgentResultRepository agentResultRepository;

    @Override
    public Optional<Evaluation> findEvaluation(String evaluationId) {
        return wrap("load evaluation " + evaluationId, () -> evaluationRepository.findById(evaluationId));
    }

    @Override
    public Optional<Evaluation> findEvaluationForUpdate(String evaluationId) {
        return wrap(
                "lock evaluation " + evaluationId,
                () -> evaluationRepository.findByEvaluationIdForUpdate(evaluationId)
        );
    }

    @Override
    public AgentResult upsertAgentResult(AgentResultRecord record) {
        return wrap("store result for " + record.evaluationId() + "/" + record.agentName(), () -> {
            OffsetDateTime now = OffsetDateTime.now();
            AgentResult result = agentResultRepository
                    .findByEvaluationIdAndAgentName(record.evaluationId(), record.agentName())
                    .orElseGet(() -> {
                        AgentResult created = new AgentResult();
                        created.setResultId(UUID.randomUUID());
                        created.setEvaluationId(record.evaluationId());
                        created.setAgentName(record.agentName());
                        created.setCreatedAt(now);
                        return created;
                    });
            result.setStatus(record.status());
            result.setScore(record.score());
            result.setBreakdown(new LinkedHashMap<>(record.breakdown()));
            result.setFeedback(record.feedback());
            result.setStrengths(new ArrayList<>(record.strengths()));
            result.setImprovements(new ArrayList<>(record.improvements()));
            result.setOutputs(record.outputs() == null ? null : record.outputs().deepCopy());
            result.setStartedAt(record.startedAt());
            result.setCompletedAt(record.completedAt());
            result.setUpdatedAt(now);
            return agentResultRepository.saveAndFlush(result);
        });
    }

    @Override
    public Evaluation updateEvaluationStatus(Evaluation evaluation) {
        return wrap(
                "update evaluation " + evaluation.getEvaluationId(),
                () -> evaluationRepository.saveAndFlush(evaluation)
        );
    }

    @Override
    public List<AgentResult> findAgentResults(String evaluationId) {
        return wrap(
                "load results for evaluation " + evaluationId,
                () -> agentResultRepository.findByEvaluationIdOrderByCreatedAtAsc(evaluationId)
        );
    }

    private static <T> T wrap(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            throw new ResultStoreException("Failed to " + action + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }
}
