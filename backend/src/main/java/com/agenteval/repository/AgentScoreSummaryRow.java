package com.agenteval.repository;

/**
 * Per-agent aggregate over completed results, used by the results summary and leaderboard endpoints.
 */
public interface AgentScoreSummaryRow {
    String getAgentName();

    Long getEvaluationCount();

    Double getAverageScore();

    Integer getBestScore();

    Integer getWorstScore();
}
