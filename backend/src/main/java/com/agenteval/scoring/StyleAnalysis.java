package com.agenteval.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Aggregated analysis of one file set. Category counts are occurrence counts; {@code patterns} is keyed by
 * {@link PatternCategory#jsonName()}.
 */
public record StyleAnalysis(
        @JsonProperty("total_inline_styles") int totalInlineStyles,
        int repetitive,
        @JsonProperty("data_driven") int dataDriven,
        int positioning,
        int unique,
        @JsonProperty("ie_hacks") int ieHacks,
        @JsonProperty("font_tags") int fontTags,
        @JsonProperty("style_blocks") int styleBlocks,
        Map<String, List<PatternGroup>> patterns,
        @JsonProperty("file_results") Map<String, FileAnalysis> fileResults
) {
    public StyleAnalysis {
        patterns = patterns == null ? Map.of() : patterns;
        fileResults = fileResults == null ? Map.of() : fileResults;
    }

    public List<PatternGroup> patternsFor(PatternCategory category) {
        return patterns.getOrDefault(category.jsonName(), List.of());
    }
}
