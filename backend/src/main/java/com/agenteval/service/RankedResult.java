package com.agenteval.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RankedResult(
        int rank,
        String agentName,
        int score,
        String medal,
        String feedback,
        Map<String, Integer> breakdown
) {
    public RankedResult {
        medal = medal == null ? "" : medal;
        breakdown = breakdown == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
