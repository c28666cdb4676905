package com.agenteval.repository;

public interface CategoryCountRow {
    String getCategory();

    Long getEvaluationCount();
}
