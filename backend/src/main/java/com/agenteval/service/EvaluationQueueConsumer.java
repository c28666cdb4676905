package com.agenteval.service;

@FunctionalInterface
public interface EvaluationQueueConsumer {

    void accept(EvaluationQueueMessage message);
}
