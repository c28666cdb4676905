package com.agenteval.scoring;

import com.agenteval.model.RubricCriterion;
import com.agenteval.provider.Judge;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores a solution by asking an external judge. Never throws: timeouts, transport errors and unparseable
 * responses become a zero-score result with {@link ScoreResult#error()} set.
 */
public class JudgeScorer implements Scorer {

    private static final Logger log = LoggerFactory.getLogger(JudgeScorer.class);

    public static final String KIND = "ai_judge";

    private final Judge judge;
    private final Executor judgeExecutor;
    private final Duration timeout;
    private final String defaultModel;
    private final int maxFileChars;
    private final ObjectMapper objectMapper;

    public JudgeScorer(
            Judge judge,
            Executor judgeExecutor,
            Duration timeout,
            String defaultModel,
            int maxFileChars,
            ObjectMapper objectMapper
    ) {
        this.judge = Objects.requireNonNull(judge, "judge is required");
        this.judgeExecutor = Objects.requireNonNull(judgeExecutor, "judgeExecutor is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.defaultModel = defaultModel;
        this.maxFileChars = maxFileChars;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public ScoreResult score(
            Map<String, String> baselineFiles,
            Map<String, String> solutionFiles,
            ScoringContext context
    ) {
        String model = context.task().hasJudgeModel() ? context.task().judgeModel() : defaultModel;
        String prompt = JudgePromptBuilder.build(
                context.task(),
                context.agentName(),
                baselineFiles,
                solutionFiles,
                maxFileChars
        );

        // FutureTask.cancel(true) interrupts the judge-call thread.
        FutureTask<String> call = new FutureTask<>(() -> judge.ask(prompt, model));
        String content;
        try {
            judgeExecutor.execute(call);
            content = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            call.cancel(true);
            log.warn(
                    "Judge call timed out for task {} agent {} after {}s",
                    context.task().taskId(),
                    context.agentName(),
                    timeout.toSeconds()
            );
            return ScoreResult.judgeFailure(model, "judge call timed out after " + timeout.toSeconds() + " seconds");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return ScoreResult.judgeFailure(model, "judge call interrupted");
        } catch (RejectedExecutionException ex) {
            log.warn("Judge call rejected for task {} agent {}", context.task().taskId(), context.agentName());
            return ScoreResult.judgeFailure(model, "judge call rejected: " + ex.getMessage());
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn(
                    "Judge call failed for task {} agent {}: {}",
                    context.task().taskId(),
                    context.agentName(),
                    cause.getMessage()
            );
            return ScoreResult.judgeFailure(model, cause.getMessage());
        }

        JudgeVerdict verdict;
        try {
            verdict = JudgeResponseCodec.parse(content, objectMapper);
        } catch (IllegalArgumentException ex) {
            log.warn(
                    "Judge response rejected for task {} agent {}: {}",
                    context.task().taskId(),
                    context.agentName(),
                    ex.getMessage()
            );
            return ScoreResult.judgeFailure(model, ex.getMessage());
        }
        return toResult(verdict, model, context);
    }

    private ScoreResult toResult(JudgeVerdict verdict, String model, ScoringContext context) {
        Map<String, Integer> weights = new LinkedHashMap<>();
        for (RubricCriterion criterion : context.task().rubric()) {
            weights.put(criterion.name(), criterion.weight());
        }

        Map<String, Integer> breakdown = new LinkedHashMap<>();
        verdict.scores().forEach((criterion, value) -> breakdown.put(
                criterion,
                boundedScore(value, weights.getOrDefault(criterion, ScoreResult.MAX_SCORE))
        ));
        int total = verdict.totalReported()
                ? boundedScore(verdict.totalScore(), ScoreResult.MAX_SCORE)
                : ScoreResult.clamp(breakdown.values().stream().mapToInt(Integer::intValue).sum());

        ObjectNode details = objectMapper.createObjectNode();
        details.set("scores", objectMapper.valueToTree(breakdown));
        details.set("raw_scores", objectMapper.valueToTree(verdict.scores()));
        details.put("total_score", total);
        details.put("feedback", verdict.feedback());
        details.set("strengths", objectMapper.valueToTree(verdict.strengths()));
        details.set("improvements", objectMapper.valueToTree(verdict.improvements()));
        details.put("model_used", model);
        details.put("evaluation_type", KIND);

        return new ScoreResult(
                KIND,
                total,
                breakdown,
                verdict.feedback(),
                verdict.strengths(),
                verdict.improvements(),
                model,
                null,
                details
        );
    }

    /**
     * Rounds a judge value into {@code [0, max]}. Bounds are applied before narrowing.
     */
    static int boundedScore(double value, int max) {
        if (Double.isNaN(value)) {
            return ScoreResult.MIN_SCORE;
        }
        double bounded = Math.max(ScoreResult.MIN_SCORE, Math.min(max, value));
        return (int) Math.round(bounded);
    }
}
