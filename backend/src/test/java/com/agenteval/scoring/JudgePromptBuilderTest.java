package com.agenteval.scoring;

import com.agenteval.model.EvaluationStrategy;
import com.agenteval.model.RubricCriterion;
import com.agenteval.model.TaskDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JudgePromptBuilderTest {

    private static TaskDefinition task(String promptTemplate) {
        return new TaskDefinition(
                "css-consolidation",
                "CSS Consolidation Challenge",
                "Consolidate inline styles",
                "refactoring",
                EvaluationStrategy.AI_JUDGE,
                List.of(
                        new RubricCriterion("pattern_consolidation", 40, "How well patterns are consolidated"),
                        new RubricCriterion("smart_retention", 10, "")
                ),
                null,
                promptTemplate,
                Map.of()
        );
    }

    @Test
    void promptCarriesTaskAgentCriteriaAndFiles() {
        String prompt = JudgePromptBuilder.build(
                task(null),
                "claude",
                Map.of("index.html", "<div style=\"color: red\">x</div>"),
                Map.of("index.html", "<div class=\"a\">x</div>"),
                3000
        );

        assertTrue(prompt.startsWith("# Task Evaluation: CSS Consolidation Challenge\n\n"));
        assertTrue(prompt.contains("## Agent Being Evaluated\nclaude"));
        assertTrue(prompt.contains("- **pattern_consolidation** (40 points): How well patterns are consolidated"));
        assertTrue(prompt.contains("- **smart_retention** (10 points): No description"));
        assertTrue(prompt.contains("BASELINE:\n\n### index.html\n```\n<div style=\"color: red\">x</div>\n```"));
        assertTrue(prompt.contains("SOLUTION:\n\n### index.html\n```\n<div class=\"a\">x</div>\n```"));
        assertFalse(prompt.contains("## Additional Evaluation Guidelines"));
    }

    @Test
    void promptAppendsTemplateGuidelines() {
        String prompt = JudgePromptBuilder.build(task("Focus on colors."), "cursor", Map.of(), Map.of(), 3000);

        assertTrue(prompt.endsWith("## Additional Evaluation Guidelines\nFocus on colors."));
        assertTrue(prompt.contains("BASELINE: No files provided"));
    }

    @Test
    void longFilesAreTruncated() {
        String formatted = JudgePromptBuilder.formatFiles(Map.of("big.html", "abcdefghij"), "SOLUTION", 4);

        assertEquals("SOLUTION:\n\n### big.html\n```\nabcd" + JudgePromptBuilder.TRUNCATION_MARKER + "\n```", formatted);
    }

    @Test
    void emptyRubricIsDescribed() {
        TaskDefinition bare = new TaskDefinition(
                "t", null, null, null, null, List.of(), null, null, Map.of()
        );

        assertEquals("No specific criteria defined.", JudgePromptBuilder.formatCriteria(bare));
    }
}
