package com.agenteval.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule-based style consolidation scorer. Compares baseline and solution analyses over a fixed rubric:
 * pattern consolidation (40), IE hack removal (20), font tag modernization (15), style block cleanup (15)
 * and smart retention (10).
 */
@Component
@RequiredArgsConstructor
public class StructuralScorer implements Scorer {

    public static final String KIND = "rule_based_css";

    static final String PATTERN_CONSOLIDATION = "pattern_consolidation";
    static final String IE_HACK_REMOVAL = "ie_hack_removal";
    static final String FONT_TAG_MODERNIZATION = "font_tag_modernization";
    static final String STYLE_BLOCK_CLEANUP = "style_block_cleanup";
    static final String SMART_RETENTION = "smart_retention";

    private static final int PATTERN_CONSOLIDATION_POINTS = 40;
    private static final int IE_HACK_POINTS = 20;
    private static final int FONT_TAG_POINTS = 15;
    private static final int STYLE_BLOCK_POINTS = 15;
    private static final int SMART_RETENTION_POINTS = 10;

    private final ObjectMapper objectMapper;

    @Override
    public ScoreResult score(
            Map<String, String> baselineFiles,
            Map<String, String> solutionFiles,
            ScoringContext context
    ) {
        StyleAnalysis baseline = new PatternCatalog().analyze(baselineFiles);
        StyleAnalysis solution = new PatternCatalog().analyze(solutionFiles);

        Map<String, Integer> breakdown = breakdown(baseline, solution);
        int total = Math.min(ScoreResult.MAX_SCORE, breakdown.values().stream().mapToInt(Integer::intValue).sum());
        List<String> improvements = improvements(baseline, solution);

        ObjectNode details = objectMapper.createObjectNode();
        details.set("scores", objectMapper.valueToTree(breakdown));
        details.put("total_score", total);
        details.set("baseline", objectMapper.valueToTree(baseline));
        details.set("solution", objectMapper.valueToTree(solution));
        details.set("improvements", objectMapper.valueToTree(improvements));
        details.put("evaluation_type", KIND);

        return new ScoreResult(KIND, total, breakdown, null, List.of(), improvements, null, null, details);
    }

    static Map<String, Integer> breakdown(StyleAnalysis baseline, StyleAnalysis solution) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();

        if (baseline.repetitive() > 0) {
            double consolidationRate = Math.max(
                    0.0,
                    (double) (baseline.repetitive() - solution.repetitive()) / baseline.repetitive()
            );
            breakdown.put(PATTERN_CONSOLIDATION, (int) Math.round(consolidationRate * PATTERN_CONSOLIDATION_POINTS));
        } else {
            breakdown.put(PATTERN_CONSOLIDATION, PATTERN_CONSOLIDATION_POINTS);
        }

        breakdown.put(IE_HACK_REMOVAL, removalPoints(baseline.ieHacks(), solution.ieHacks(), IE_HACK_POINTS));
        breakdown.put(FONT_TAG_MODERNIZATION, removalPoints(baseline.fontTags(), solution.fontTags(), FONT_TAG_POINTS));
        breakdown.put(STYLE_BLOCK_CLEANUP, removalPoints(baseline.styleBlocks(), solution.styleBlocks(), STYLE_BLOCK_POINTS));

        int remaining = solution.totalInlineStyles();
        if (remaining > 0) {
            double legitimateRatio = (double) (solution.dataDriven() + solution.positioning()) / remaining;
            breakdown.put(SMART_RETENTION, (int) Math.round(legitimateRatio * SMART_RETENTION_POINTS));
        } else {
            breakdown.put(SMART_RETENTION, SMART_RETENTION_POINTS);
        }
        return breakdown;
    }

    private static int removalPoints(int baselineCount, int solutionCount, int points) {
        if (baselineCount == 0 || solutionCount == 0) {
            return points;
        }
        return 0;
    }

    static List<String> improvements(StyleAnalysis baseline, StyleAnalysis solution) {
        List<String> improvements = new ArrayList<>();

        if (solution.repetitive() > baseline.repetitive() * 0.2) {
            improvements.add("Consider consolidating " + solution.repetitive() + " remaining repetitive styles");
        }
        if (solution.ieHacks() > 0) {
            improvements.add("Remove " + solution.ieHacks() + " remaining IE-specific hacks");
        }
        if (solution.fontTags() > 0) {
            improvements.add("Modernize " + solution.fontTags() + " remaining <font> tags");
        }
        if (solution.styleBlocks() > 0) {
            improvements.add("Move " + solution.styleBlocks() + " <style> blocks to external CSS");
        }

        if (solution.repetitive() < baseline.repetitive() * 0.8) {
            improvements.add("Good job consolidating repetitive patterns!");
        }
        if (solution.dataDriven() >= baseline.dataDriven() * 0.8) {
            improvements.add("Excellent retention of data-driven styles!");
        }
        return improvements;
    }
}
