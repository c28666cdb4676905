package com.agenteval.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternCategory {
    DATA_DRIVEN("data_driven"),
    POSITIONING("positioning"),
    REPETITIVE("repetitive"),
    UNIQUE("unique");

    private final String jsonName;

    PatternCategory(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }
}
