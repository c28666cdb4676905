package com.agenteval.model;

public enum AgentStatus {
    PENDING,
    READY,
    EVALUATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
