package com.agenteval.scoring;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized output shared by every scorer.
 *
 * @param kind         scorer tag ({@code rule_based_css}, {@code ai_judge}, {@code hybrid})
 * @param totalScore   overall score, clamped to [0, 100]
 * @param breakdown    criterion name to sub-score, in rubric order
 * @param model        judge model used, when a judge was involved
 * @param error        failure detail when the scorer recovered from an error, otherwise {@code null}
 * @param details      full scorer output persisted alongside the result
 */
public record ScoreResult(
        String kind,
        int totalScore,
        Map<String, Integer> breakdown,
        String feedback,
        List<String> strengths,
        List<String> improvements,
        String model,
        String error,
        ObjectNode details
) {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public ScoreResult {
        totalScore = clamp(totalScore);
        breakdown = breakdown == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
        details = details == null ? JsonNodeFactory.instance.objectNode() : details;
    }

    public static ScoreResult judgeFailure(String model, String reason) {
        String message = reason == null || reason.isBlank() ? "unknown error" : reason;
        ObjectNode details = JsonNodeFactory.instance.objectNode();
        details.putObject("scores");
        details.put("total_score", 0);
        details.put("feedback", "Evaluation failed: " + message);
        details.putArray("strengths");
        details.putArray("improvements");
        details.put("model_used", model);
        details.put("evaluation_type", JudgeScorer.KIND);
        details.put("error", message);
        return new ScoreResult(
                JudgeScorer.KIND,
                0,
                Map.of(),
                "Evaluation failed: " + message,
                List.of(),
                List.of(),
                model,
                message,
                details
        );
    }

    public boolean failed() {
        return error != null;
    }

    public static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
