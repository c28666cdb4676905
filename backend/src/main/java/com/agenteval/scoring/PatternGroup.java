package com.agenteval.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PatternGroup(
        @JsonProperty("pattern") String signature,
        int count,
        String example
) {
}
