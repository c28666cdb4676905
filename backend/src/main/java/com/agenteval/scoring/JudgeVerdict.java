package com.agenteval.scoring;

import java.util.List;
import java.util.Map;

/**
 * Judge response after defaults are applied. Scores keep the judge's raw numeric values; when the judge
 * omitted {@code total_score}, {@code totalReported} is false and {@code totalScore} is the raw sum.
 */
public record JudgeVerdict(
        Map<String, Double> scores,
        double totalScore,
        boolean totalReported,
        String feedback,
        List<String> strengths,
        List<String> improvements
) {
    public JudgeVerdict {
        scores = scores == null ? Map.of() : scores;
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
    }
}
