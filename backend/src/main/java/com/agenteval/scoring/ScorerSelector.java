package com.agenteval.scoring;

import com.agenteval.model.EvaluationStrategy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a task's evaluation strategy to a scorer. Judge strategies fall back to rule-based scoring when no
 * judge is available for the call.
 */
@Component
@RequiredArgsConstructor
public class ScorerSelector {

    private static final Logger log = LoggerFactory.getLogger(ScorerSelector.class);

    private final StructuralScorer structuralScorer;

    public Scorer select(EvaluationStrategy strategy, Optional<JudgeScorer> judgeScorer) {
        EvaluationStrategy effective = strategy == null ? EvaluationStrategy.RULE_BASED : strategy;
        if (effective.usesJudge() && judgeScorer.isEmpty()) {
            log.info("No judge available for {} strategy, using rule-based scoring", effective.configValue());
            return structuralScorer;
        }
        return switch (effective) {
            case RULE_BASED -> structuralScorer;
            case AI_JUDGE -> judgeScorer.get();
            case HYBRID -> new HybridScorer(structuralScorer, judgeScorer.get());
        };
    }
}
