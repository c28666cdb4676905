package com.agenteval.scoring;

import java.util.Map;

/**
 * Scores one agent's solution file set against the task baseline.
 */
public interface Scorer {

    ScoreResult score(Map<String, String> baselineFiles, Map<String, String> solutionFiles, ScoringContext context);
}
