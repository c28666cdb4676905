package com.agenteval.model;

public enum EvaluationStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isOpen() {
        return this == PENDING || this == ACTIVE;
    }
}
