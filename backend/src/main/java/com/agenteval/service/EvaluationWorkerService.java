package com.agenteval.service;

import com.agenteval.config.EvaluatorRuntimeProperties;
import com.agenteval.web.EvaluationRequestException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Consumes the evaluation queue on a fixed pool of {@code evaluator.worker.pool-size} threads.
 */
@Service
@ConditionalOnProperty(
        prefix = "evaluator.worker",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class EvaluationWorkerService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationWorkerService.class);

    private final EvaluationQueue evaluationQueue;
    private final EvaluationOrchestrator evaluationOrchestrator;
    private final ExecutorService workerPool;

    public EvaluationWorkerService(
            EvaluationQueue evaluationQueue,
            EvaluationOrchestrator evaluationOrchestrator,
            EvaluatorRuntimeProperties runtimeProperties
    ) {
        this.evaluationQueue = evaluationQueue;
        this.evaluationOrchestrator = evaluationOrchestrator;
        this.workerPool = Executors.newFixedThreadPool(
                Math.max(1, runtimeProperties.getWorker().getPoolSize()),
                new CustomizableThreadFactory("evaluation-worker-")
        );
    }

    @PostConstruct
    void registerQueueConsumer() {
        evaluationQueue.setConsumer(message -> workerPool.execute(() -> runWorker(message)));
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        workerPool.shutdown();
        if (!workerPool.awaitTermination(10, TimeUnit.SECONDS)) {
            workerPool.shutdownNow();
        }
    }

    void runWorker(EvaluationQueueMessage message) {
        try {
            process(message);
        } catch (RuntimeException ex) {
            log.error(
                    "Could not record outcome for agent {} of evaluation {}",
                    message.agentName(),
                    message.evaluationId(),
                    ex
            );
        } finally {
            evaluationQueue.release(message);
        }
    }

    void process(EvaluationQueueMessage message) {
        try {
            evaluationOrchestrator.evaluate(message.evaluationId(), message.agentName(), message.credentials());
        } catch (EvaluationRequestException ex) {
            log.warn(
                    "Rejected queued evaluation of agent {} for evaluation {}: {}",
                    message.agentName(),
                    message.evaluationId(),
                    ex.getMessage()
            );
            evaluationOrchestrator.markFailed(message.evaluationId(), message.agentName(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error(
                    "Evaluation of agent {} for evaluation {} failed",
                    message.agentName(),
                    message.evaluationId(),
                    ex
            );
            // Store failures propagate to runWorker.
            evaluationOrchestrator.markFailed(message.evaluationId(), message.agentName(), describe(ex));
        }
    }

    private static String describe(RuntimeException ex) {
        String detail = ex.getMessage();
        return detail == null || detail.isBlank() ? ex.getClass().getSimpleName() : detail;
    }
}
