package com.agenteval.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Process-local queue keyed by evaluation agent. Waiting requests keep arrival order; a repeated request for a
 * waiting agent takes over its slot only when it brings a judge key. Also serves as the fallback of
 * {@link RedisEvaluationQueue}.
 */
@Service
public class InMemoryEvaluationQueue implements EvaluationQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEvaluationQueue.class);

    private final Object monitor = new Object();
    private final Map<AgentKey, EvaluationQueueMessage> waiting = new LinkedHashMap<>();
    private final Set<AgentKey> delivered = new HashSet<>();

    // Guarded by monitor.
    private boolean running = true;
    private EvaluationQueueConsumer consumer;
    private Thread dispatcherThread;

    @PostConstruct
    void startDispatcher() {
        dispatcherThread = new Thread(this::dispatchLoop, "evaluation-queue-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stopDispatcher() {
        synchronized (monitor) {
            running = false;
            monitor.notifyAll();
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    @Override
    public boolean enqueue(EvaluationQueueMessage message) {
        EvaluationQueueMessage requiredMessage = Objects.requireNonNull(message, "message is required");
        AgentKey key = AgentKey.of(requiredMessage);
        synchronized (monitor) {
            if (!running) {
                throw new IllegalStateException("Evaluation queue is not running");
            }
            if (waiting.containsKey(key)) {
                if (requiredMessage.credentials().hasApiKey()) {
                    waiting.put(key, requiredMessage);
                }
                return false;
            }
            if (delivered.contains(key)) {
                return false;
            }
            waiting.put(key, requiredMessage);
            monitor.notifyAll();
            return true;
        }
    }

    @Override
    public void setConsumer(EvaluationQueueConsumer consumer) {
        EvaluationQueueConsumer requiredConsumer = Objects.requireNonNull(consumer, "consumer is required");
        synchronized (monitor) {
            this.consumer = requiredConsumer;
            monitor.notifyAll();
        }
    }

    @Override
    public void release(EvaluationQueueMessage message) {
        synchronized (monitor) {
            delivered.remove(AgentKey.of(message));
        }
    }

    int waitingCount() {
        synchronized (monitor) {
            return waiting.size();
        }
    }

    boolean isClaimed(String evaluationId, String agentName) {
        AgentKey key = new AgentKey(evaluationId, agentName);
        synchronized (monitor) {
            return waiting.containsKey(key) || delivered.contains(key);
        }
    }

    private void dispatchLoop() {
        while (true) {
            EvaluationQueueMessage next;
            EvaluationQueueConsumer target;
            synchronized (monitor) {
                try {
                    while (running && (consumer == null || waiting.isEmpty())) {
                        monitor.wait();
                    }
                } catch (InterruptedException ex) {
                    if (!running) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    continue;
                }
                if (!running) {
                    return;
                }
                Iterator<Map.Entry<AgentKey, EvaluationQueueMessage>> head = waiting.entrySet().iterator();
                Map.Entry<AgentKey, EvaluationQueueMessage> entry = head.next();
                head.remove();
                delivered.add(entry.getKey());
                next = entry.getValue();
                target = consumer;
            }
            try {
                target.accept(next);
            } catch (RuntimeException ex) {
                release(next);
                log.error(
                        "Evaluation queue consumer rejected agent {} of evaluation {}",
                        next.agentName(),
                        next.evaluationId(),
                        ex
                );
            }
        }
    }

    private record AgentKey(String evaluationId, String agentName) {

        static AgentKey of(EvaluationQueueMessage message) {
            return new AgentKey(message.evaluationId(), message.agentName());
        }
    }
}
