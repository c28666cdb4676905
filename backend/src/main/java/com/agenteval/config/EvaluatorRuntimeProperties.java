package com.agenteval.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Evaluator runtime settings: workspace locations and background worker defaults.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "evaluator")
public class EvaluatorRuntimeProperties {

    private Workspace workspace = new Workspace();
    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Workspace {

        /**
         * Root holding one directory per task: {@code <id>/config.yaml} and {@code <id>/baseline/}.
         */
        private String tasksDir = "tasks";

        /**
         * Root holding submitted solutions as {@code <evaluationId>/<agent>/}.
         */
        private String solutionsDir = "solutions";

        /**
         * Comparison reports are written to {@code <resultsDir>/<evaluationId>/}.
         */
        private String resultsDir = "results";

        /**
         * Import task configuration documents from {@link #tasksDir} on startup.
         */
        private boolean bootstrapTasks = true;
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
        private int poolSize = 4;
        private String queueMode = "in_memory";
        private String redisQueueKey = "evaluator:evaluation:queue";
        private long redisPopTimeoutSeconds = 1;

        /**
         * Lifetime of the Redis marker that claims an evaluation agent while it is queued or being scored.
         */
        private long redisPendingTtlSeconds = 3600;
    }
}
