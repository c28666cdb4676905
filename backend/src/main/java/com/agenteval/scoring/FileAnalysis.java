package com.agenteval.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FileAnalysis(
        @JsonProperty("total_inline_styles") int totalInlineStyles,
        @JsonProperty("ie_hacks") int ieHacks,
        @JsonProperty("font_tags") int fontTags,
        @JsonProperty("style_blocks") int styleBlocks
) {
}
