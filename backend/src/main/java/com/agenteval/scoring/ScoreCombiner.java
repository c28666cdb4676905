package com.agenteval.scoring;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed 70/30 blend of a rule-based and a judge result.
 */
public final class ScoreCombiner {

    public static final String KIND = "hybrid";

    static final double RULE_WEIGHT = 0.7;
    static final double JUDGE_WEIGHT = 0.3;

    static final String RULE_BASED_SCORE = "rule_based_score";
    static final String AI_JUDGE_SCORE = "ai_judge_score";
    static final String COMBINED_SCORE = "combined_score";

    private ScoreCombiner() {
    }

    public static ScoreResult combine(ScoreResult ruleResult, ScoreResult judgeResult) {
        int ruleScore = ruleResult.totalScore();
        int judgeScore = judgeResult.totalScore();
        int combined = (int) Math.round(ruleScore * RULE_WEIGHT + judgeScore * JUDGE_WEIGHT);

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put(RULE_BASED_SCORE, ruleScore);
        breakdown.put(AI_JUDGE_SCORE, judgeScore);
        breakdown.put(COMBINED_SCORE, combined);

        String feedback = "Rule-based: " + ruleScore + "/100, AI Judge: " + judgeScore + "/100";

        List<String> improvements = new ArrayList<>(ruleResult.improvements());
        improvements.addAll(judgeResult.improvements());

        ObjectNode details = JsonNodeFactory.instance.objectNode();
        details.put("total_score", combined);
        ObjectNode scores = details.putObject("scores");
        scores.set("rule_based", ruleResult.details().path("scores").deepCopy());
        scores.set("ai_judge", judgeResult.details().path("scores").deepCopy());
        ObjectNode breakdownNode = details.putObject("breakdown");
        breakdown.forEach(breakdownNode::put);
        details.put("feedback", feedback);
        ArrayNode strengthsNode = details.putArray("strengths");
        judgeResult.strengths().forEach(strengthsNode::add);
        ArrayNode improvementsNode = details.putArray("improvements");
        improvements.forEach(improvementsNode::add);
        details.put("evaluation_type", KIND);
        ObjectNode nested = details.putObject("details");
        nested.set("rule_based", ruleResult.details().deepCopy());
        nested.set("ai_judge", judgeResult.details().deepCopy());

        return new ScoreResult(
                KIND,
                combined,
                breakdown,
                feedback,
                judgeResult.strengths(),
                improvements,
                judgeResult.model(),
                judgeResult.error(),
                details
        );
    }
}
