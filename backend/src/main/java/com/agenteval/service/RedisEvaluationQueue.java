package com.agenteval.service;

import com.agenteval.config.EvaluatorRuntimeProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Redis list backed queue shared by every evaluator instance. Each evaluation agent is claimed with a
 * {@code SET NX} marker next to the list, so a repeated request is coalesced across instances until the
 * worker releases it.
 * <p>
 * Requests carrying a judge key, and every request while Redis is unreachable, go to the in-memory queue.
 * Redis is retried after a short backoff.
 */
@Service
@RequiredArgsConstructor
@Primary
@ConditionalOnProperty(
        prefix = "evaluator.worker",
        name = "queue-mode",
        havingValue = "redis"
)
public class RedisEvaluationQueue implements EvaluationQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisEvaluationQueue.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);
    private static final String CLAIM_VALUE = "queued";

    private final StringRedisTemplate stringRedisTemplate;
    private final EvaluatorRuntimeProperties runtimeProperties;
    private final InMemoryEvaluationQueue fallbackQueue;
    private final Object consumerMonitor = new Object();

    private volatile boolean running = true;
    private volatile EvaluationQueueConsumer consumer;
    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;
    private Thread dispatcherThread;

    @PostConstruct
    void startDispatcher() {
        dispatcherThread = new Thread(this::dispatchLoop, "evaluation-redis-queue-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stopDispatcher() {
        running = false;
        synchronized (consumerMonitor) {
            consumerMonitor.notifyAll();
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    @Override
    public boolean enqueue(EvaluationQueueMessage message) {
        if (!running) {
            throw new IllegalStateException("Evaluation queue is not running");
        }
        EvaluationQueueMessage requiredMessage = Objects.requireNonNull(message, "message is required");
        if (requiredMessage.credentials().hasApiKey()) {
            // Request-scoped keys never leave the process.
            return fallbackQueue.enqueue(requiredMessage);
        }
        if (!shouldAttemptRedis()) {
            return fallbackQueue.enqueue(requiredMessage);
        }

        try {
            Boolean claimed = stringRedisTemplate.opsForValue().setIfAbsent(
                    claimKey(requiredMessage),
                    CLAIM_VALUE,
                    claimTtl()
            );
            if (claimed == null) {
                log.warn("Redis claim returned null, routing message to in-memory fallback queue");
                markRedisFailure(null);
                return fallbackQueue.enqueue(requiredMessage);
            }
            if (!claimed) {
                markRedisHealthy();
                return false;
            }
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
            return fallbackQueue.enqueue(requiredMessage);
        }

        try {
            Long queueDepth = stringRedisTemplate.opsForList().rightPush(
                    resolveRedisQueueKey(),
                    serialize(requiredMessage)
            );
            if (queueDepth != null) {
                markRedisHealthy();
                return true;
            }
            log.warn("Redis queue push returned null, routing message to in-memory fallback queue");
            markRedisFailure(null);
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
        dropClaim(requiredMessage);
        return fallbackQueue.enqueue(requiredMessage);
    }

    @Override
    public void setConsumer(EvaluationQueueConsumer consumer) {
        EvaluationQueueConsumer requiredConsumer = Objects.requireNonNull(consumer, "consumer is required");
        synchronized (consumerMonitor) {
            this.consumer = requiredConsumer;
            consumerMonitor.notifyAll();
        }
        fallbackQueue.setConsumer(requiredConsumer);
    }

    @Override
    public void release(EvaluationQueueMessage message) {
        fallbackQueue.release(message);
        if (!message.credentials().hasApiKey() && shouldAttemptRedis()) {
            dropClaim(message);
        }
    }

    boolean pollOnce() throws InterruptedException {
        if (!shouldAttemptRedis()) {
            TimeUnit.MILLISECONDS.sleep(200L);
            return false;
        }

        String payload = stringRedisTemplate.opsForList().leftPop(
                resolveRedisQueueKey(),
                resolveRedisPopTimeoutSeconds(),
                TimeUnit.SECONDS
        );
        markRedisHealthy();
        if (payload == null) {
            return false;
        }

        EvaluationQueueMessage message;
        try {
            message = deserialize(payload);
        } catch (IllegalStateException ex) {
            log.error("Dropping unreadable evaluation queue payload {}", payload, ex);
            return false;
        }
        EvaluationQueueConsumer queueConsumer = awaitConsumer();
        if (queueConsumer == null) {
            return false;
        }
        try {
            queueConsumer.accept(message);
        } catch (RuntimeException ex) {
            release(message);
            log.error(
                    "Evaluation queue consumer rejected agent {} of evaluation {}",
                    message.agentName(),
                    message.evaluationId(),
                    ex
            );
        }
        return true;
    }

    boolean isFallbackMode() {
        return fallbackMode;
    }

    private void dispatchLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
    }

    private EvaluationQueueConsumer awaitConsumer() throws InterruptedException {
        synchronized (consumerMonitor) {
            while (running && consumer == null) {
                consumerMonitor.wait();
            }
            return consumer;
        }
    }

    private void dropClaim(EvaluationQueueMessage message) {
        try {
            stringRedisTemplate.delete(claimKey(message));
        } catch (RuntimeException ex) {
            log.warn(
                    "Could not drop Redis claim for agent {} of evaluation {}; it expires after {}s",
                    message.agentName(),
                    message.evaluationId(),
                    claimTtl().toSeconds(),
                    ex
            );
        }
    }

    String claimKey(EvaluationQueueMessage message) {
        return resolveRedisQueueKey() + ":claim:" + message.evaluationId() + ":" + message.agentName();
    }

    private Duration claimTtl() {
        return Duration.ofSeconds(Math.max(1, runtimeProperties.getWorker().getRedisPendingTtlSeconds()));
    }

    private String resolveRedisQueueKey() {
        String queueKey = runtimeProperties.getWorker().getRedisQueueKey();
        if (queueKey == null || queueKey.isBlank()) {
            throw new IllegalStateException("evaluator.worker.redis-queue-key must not be blank");
        }
        return queueKey.trim();
    }

    private long resolveRedisPopTimeoutSeconds() {
        long timeoutSeconds = runtimeProperties.getWorker().getRedisPopTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("evaluator.worker.redis-pop-timeout-seconds must be greater than zero");
        }
        return timeoutSeconds;
    }

    static String serialize(EvaluationQueueMessage message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize evaluation queue message payload", ex);
        }
    }

    static EvaluationQueueMessage deserialize(String payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, EvaluationQueueMessage.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize evaluation queue payload", ex);
        }
    }

    private boolean shouldAttemptRedis() {
        return System.nanoTime() >= redisRetryNotBeforeNanos;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            if (ex == null) {
                log.warn("Redis queue is unavailable; switching to in-memory fallback mode");
            } else {
                log.warn(
                        "Redis queue is unavailable ({}); switching to in-memory fallback mode",
                        resolveSafeMessage(ex)
                );
            }
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis queue connection restored; leaving in-memory fallback mode");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private static String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
