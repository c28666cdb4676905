package com.agenteval.service;

import com.agenteval.model.AgentResult;
import com.agenteval.model.Evaluation;

import java.util.List;
import java.util.Optional;

/**
 * Durable evaluation state. Implementations raise {@link ResultStoreException} on persistence failures.
 * Methods are expected to run inside the caller's transaction.
 */
public interface ResultStore {

    Optional<Evaluation> findEvaluation(String evaluationId);

    /**
     * Loads the evaluation holding a write lock on its row until the surrounding transaction ends.
     */
    Optional<Evaluation> findEvaluationForUpdate(String evaluationId);

    /**
     * Inserts or updates the single result row for the record's (evaluation, agent) pair.
     */
    AgentResult upsertAgentResult(AgentResultRecord record);

    /**
     * Persists the evaluation's status, per-agent status map and timestamps.
     */
    Evaluation updateEvaluationStatus(Evaluation evaluation);

    List<AgentResult> findAgentResults(String evaluationId);
}
