package com.agenteval.service;

import com.agenteval.provider.JudgeCredentials;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Submits agent scoring work. Inside a transaction the message is enqueued after commit.
 */
@Service
@RequiredArgsConstructor
public class EvaluationQueuePublisher {

    private static final Logger log = LoggerFactory.getLogger(EvaluationQueuePublisher.class);

    private final EvaluationQueue evaluationQueue;

    public void submit(String evaluationId, String agentName, JudgeCredentials credentials) {
        EvaluationQueueMessage message = new EvaluationQueueMessage(evaluationId, agentName, credentials);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    enqueue(message);
                }
            });
            return;
        }
        enqueue(message);
    }

    private void enqueue(EvaluationQueueMessage message) {
        if (!evaluationQueue.enqueue(message)) {
            log.info(
                    "Agent {} of evaluation {} is already queued or being scored; request coalesced",
                    message.agentName(),
                    message.evaluationId()
            );
        }
    }
}
