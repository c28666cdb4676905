package com.agenteval.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

public final class ComparisonResponses {

    private ComparisonResponses() {
    }

    public record Comparison(
            String evaluationId,
            TaskInfo task,
            List<Ranking> rankings,
            Map<String, Integer> scoreDistribution,
            Map<String, CriterionStats> criteriaBreakdown,
            Summary summary
    ) {
    }

    public record TaskInfo(
            String taskId,
            String name,
            String category
    ) {
    }

    public record Ranking(
            int rank,
            String agent,
            int score,
            String medal,
            Map<String, Integer> breakdown,
            String feedback,
            OffsetDateTime completedAt
    ) {
    }

    public record CriterionStats(
            double average,
            int max,
            int min,
            List<Integer> scores
    ) {
    }

    public record Summary(
            double averageScore,
            int highestScore,
            int lowestScore,
            int scoreRange,
            int totalAgents
    ) {
    }

    public record ResultsSummary(
            long totalEvaluations,
            long completedEvaluations,
            long activeEvaluations,
            long failedEvaluations,
            long recentEvaluations,
            Map<String, AgentPerformance> agentPerformance,
            Map<String, Long> taskCategories
    ) {
    }

    public record AgentPerformance(
            double averageScore,
            long totalEvaluations,
            int bestScore
    ) {
    }

    public record LeaderboardEntry(
            int rank,
            String agent,
            String medal,
            double averageScore,
            long totalEvaluations,
            int bestScore,
            int worstScore,
            double consistency
    ) {
    }

    public record Trends(
            DateRange dateRange,
            Map<String, List<TrendPoint>> agentTrends,
            Map<String, Double> dailyAverages,
            int totalEvaluations
    ) {
    }

    public record DateRange(
            LocalDate start,
            LocalDate end
    ) {
    }

    public record TrendPoint(
            LocalDate date,
            int score
    ) {
    }
}
