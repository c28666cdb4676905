package com.agenteval.service;

/**
 * Agent scoring work queue. An evaluation agent is claimed from enqueue until {@link #release} and a request
 * for an agent that is already claimed is coalesced into the outstanding one.
 */
public interface EvaluationQueue {

    /**
     * @return {@code false} when the request was coalesced into one already queued or being scored
     */
    boolean enqueue(EvaluationQueueMessage message);

    void setConsumer(EvaluationQueueConsumer consumer);

    /**
     * Drops the claim taken by {@link #enqueue}. Called once scoring of a delivered message has finished,
     * whatever the outcome.
     */
    void release(EvaluationQueueMessage message);
}
