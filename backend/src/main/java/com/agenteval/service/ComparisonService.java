package com.agenteval.service;

import com.agenteval.dto.ComparisonResponses;
import com.agenteval.model.AgentResult;
import com.agenteval.model.AgentStatus;
import com.agenteval.model.Evaluation;
import com.agenteval.model.EvaluationStatus;
import com.agenteval.repository.AgentResultRepository;
import com.agenteval.repository.AgentScoreSummaryRow;
import com.agenteval.repository.CategoryCountRow;
import com.agenteval.repository.EvaluationRepository;
import com.agenteval.repository.TaskRepository;
import com.agenteval.web.EvaluationRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read side: per-evaluation comparison view, the cross-evaluation summary, the agent leaderboard and
 * daily score trends.
 */
@Service
@RequiredArgsConstructor
public class ComparisonService {

    static final int RECENT_WINDOW_DAYS = 7;
    static final int DEFAULT_LEADERBOARD_LIMIT = 10;
    static final int MAX_LEADERBOARD_LIMIT = 100;
    static final int DEFAULT_TREND_DAYS = 30;
    static final int MAX_TREND_DAYS = 365;

    private final EvaluationRepository evaluationRepository;
    private final AgentResultRepository agentResultRepository;
    private final TaskRepository taskRepository;

    @Transactional(readOnly = true)
    public ComparisonResponses.Comparison getComparison(String evaluationId) {
        Evaluation evaluation = evaluationRepository.findById(evaluationId)
                .orElseThrow(() -> EvaluationRequestException.evaluationNotFound(evaluationId));

        ComparisonResponses.TaskInfo taskInfo = taskRepository.findById(evaluation.getTaskId())
                .map(task -> new ComparisonResponses.TaskInfo(task.getTaskId(), task.getName(), task.getCategory()))
                .orElse(null);

        List<AgentResult> completedResults = agentResultRepository
                .findByEvaluationIdOrderByCreatedAtAsc(evaluationId)
                .stream()
                .filter(result -> result.getStatus() == AgentStatus.COMPLETED)
                .toList();
        Map<String, AgentResult> resultsByAgent = new LinkedHashMap<>();
        completedResults.forEach(result -> resultsByAgent.put(result.getAgentName(), result));

        List<RankedResult> ranked = ResultRanking.rank(evaluation.getAgents(), completedResults);

        List<ComparisonResponses.Ranking> rankings = new ArrayList<>();
        Map<String, Integer> distribution = new TreeMap<>();
        Map<String, List<Integer>> criterionScores = new LinkedHashMap<>();
        int totalScore = 0;

        for (RankedResult result : ranked) {
            AgentResult source = resultsByAgent.get(result.agentName());
            rankings.add(new ComparisonResponses.Ranking(
                    result.rank(),
                    result.agentName(),
                    result.score(),
                    result.medal(),
                    result.breakdown(),
                    result.feedback(),
                    source == null ? null : source.getCompletedAt()
            ));
            distribution.merge(scoreBucket(result.score()), 1, Integer::sum);
            result.breakdown().forEach((criterion, score) -> {
                if (score != null) {
                    criterionScores.computeIfAbsent(criterion, ignored -> new ArrayList<>()).add(score);
                }
            });
            totalScore += result.score();
        }

        Map<String, ComparisonResponses.CriterionStats> criteriaBreakdown = new LinkedHashMap<>();
        criterionScores.forEach((criterion, scores) -> criteriaBreakdown.put(
                criterion,
                new ComparisonResponses.CriterionStats(
                        roundOneDecimal(scores.stream().mapToInt(Integer::intValue).average().orElse(0.0)),
                        Collections.max(scores),
                        Collections.min(scores),
                        List.copyOf(scores)
                )
        ));

        ComparisonResponses.Summary summary = null;
        if (!ranked.isEmpty()) {
            int highest = ranked.get(0).score();
            int lowest = ranked.get(ranked.size() - 1).score();
            summary = new ComparisonResponses.Summary(
                    roundOneDecimal((double) totalScore / ranked.size()),
                    highest,
                    lowest,
                    highest - lowest,
                    ranked.size()
            );
        }

        return new ComparisonResponses.Comparison(
                evaluationId,
                taskInfo,
                rankings,
                distribution,
                criteriaBreakdown,
                summary
        );
    }

    @Transactional(readOnly = true)
    public ComparisonResponses.ResultsSummary getResultsSummary() {
        Map<String, ComparisonResponses.AgentPerformance> agentPerformance = new LinkedHashMap<>();
        for (AgentScoreSummaryRow row : agentResultRepository.summarizeCompletedScoresByAgent()) {
            agentPerformance.put(row.getAgentName(), new ComparisonResponses.AgentPerformance(
                    row.getAverageScore() == null ? 0.0 : roundOneDecimal(row.getAverageScore()),
                    row.getEvaluationCount() == null ? 0L : row.getEvaluationCount(),
                    row.getBestScore() == null ? 0 : row.getBestScore()
            ));
        }

        Map<String, Long> taskCategories = new LinkedHashMap<>();
        for (CategoryCountRow row : evaluationRepository.countEvaluationsByTaskCategory()) {
            String category = row.getCategory() == null ? "uncategorized" : row.getCategory();
            taskCategories.merge(category, row.getEvaluationCount() == null ? 0L : row.getEvaluationCount(), Long::sum);
        }

        return new ComparisonResponses.ResultsSummary(
                evaluationRepository.count(),
                evaluationRepository.countByStatus(EvaluationStatus.COMPLETED),
                evaluationRepository.countByStatus(EvaluationStatus.ACTIVE),
                evaluationRepository.countByStatus(EvaluationStatus.FAILED),
                evaluationRepository.countByCreatedAtAfter(OffsetDateTime.now().minusDays(RECENT_WINDOW_DAYS)),
                agentPerformance,
                taskCategories
        );
    }

    @Transactional(readOnly = true)
    public List<ComparisonResponses.LeaderboardEntry> getLeaderboard(Integer limit, String category) {
        int resolvedLimit = limit == null
                ? DEFAULT_LEADERBOARD_LIMIT
                : Math.max(1, Math.min(MAX_LEADERBOARD_LIMIT, limit));
        List<AgentScoreSummaryRow> rows = category == null || category.isBlank()
                ? agentResultRepository.findLeaderboard(resolvedLimit)
                : agentResultRepository.findLeaderboardForCategory(category.trim(), resolvedLimit);

        List<ComparisonResponses.LeaderboardEntry> leaderboard = new ArrayList<>();
        for (AgentScoreSummaryRow row : rows) {
            int rank = leaderboard.size() + 1;
            double average = row.getAverageScore() == null ? 0.0 : row.getAverageScore();
            int best = row.getBestScore() == null ? 0 : row.getBestScore();
            leaderboard.add(new ComparisonResponses.LeaderboardEntry(
                    rank,
                    row.getAgentName(),
                    ResultRanking.medalFor(rank),
                    roundOneDecimal(average),
                    row.getEvaluationCount() == null ? 0L : row.getEvaluationCount(),
                    best,
                    row.getWorstScore() == null ? 0 : row.getWorstScore(),
                    best > 0 ? roundOneDecimal(average / best * 100) : 0.0
            ));
        }
        return leaderboard;
    }

    /**
     * Completed scores per agent and per UTC day over the trailing {@code days} window.
     */
    @Transactional(readOnly = true)
    public ComparisonResponses.Trends getTrends(Integer days, String agent) {
        int window = days == null ? DEFAULT_TREND_DAYS : Math.max(1, Math.min(MAX_TREND_DAYS, days));
        OffsetDateTime end = OffsetDateTime.now(ZoneOffset.UTC);
        OffsetDateTime start = end.minusDays(window);

        List<AgentResult> results = agent == null || agent.isBlank()
                ? agentResultRepository.findByStatusAndCompletedAtGreaterThanEqualOrderByCompletedAtAsc(
                        AgentStatus.COMPLETED,
                        start
                )
                : agentResultRepository.findByAgentNameAndStatusAndCompletedAtGreaterThanEqualOrderByCompletedAtAsc(
                        agent.trim(),
                        AgentStatus.COMPLETED,
                        start
                );

        Map<String, List<ComparisonResponses.TrendPoint>> agentTrends = new LinkedHashMap<>();
        Map<LocalDate, List<Integer>> scoresByDay = new TreeMap<>();
        for (AgentResult result : results) {
            LocalDate day = result.getCompletedAt().withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
            agentTrends.computeIfAbsent(result.getAgentName(), ignored -> new ArrayList<>())
                    .add(new ComparisonResponses.TrendPoint(day, result.getScore()));
            scoresByDay.computeIfAbsent(day, ignored -> new ArrayList<>()).add(result.getScore());
        }

        Map<String, Double> dailyAverages = new LinkedHashMap<>();
        scoresByDay.forEach((day, scores) -> dailyAverages.put(
                day.toString(),
                roundOneDecimal(scores.stream().mapToInt(Integer::intValue).average().orElse(0.0))
        ));

        return new ComparisonResponses.Trends(
                new ComparisonResponses.DateRange(start.toLocalDate(), end.toLocalDate()),
                agentTrends,
                dailyAverages,
                results.size()
        );
    }

    static String scoreBucket(int score) {
        int lower = (score / 10) * 10;
        return lower + "-" + (lower + 9);
    }

    private static double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
