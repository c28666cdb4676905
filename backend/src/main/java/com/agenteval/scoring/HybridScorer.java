package com.agenteval.scoring;

import java.util.Map;

public class HybridScorer implements Scorer {

    private final Scorer ruleScorer;
    private final Scorer judgeScorer;

    public HybridScorer(Scorer ruleScorer, Scorer judgeScorer) {
        this.ruleScorer = ruleScorer;
        this.judgeScorer = judgeScorer;
    }

    @Override
    public ScoreResult score(
            Map<String, String> baselineFiles,
            Map<String, String> solutionFiles,
            ScoringContext context
    ) {
        ScoreResult ruleResult = ruleScorer.score(baselineFiles, solutionFiles, context);
        ScoreResult judgeResult = judgeScorer.score(baselineFiles, solutionFiles, context);
        return ScoreCombiner.combine(ruleResult, judgeResult);
    }
}
