package com.agenteval.scoring;

import com.agenteval.model.RubricCriterion;
import com.agenteval.model.TaskDefinition;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Renders the judge prompt for one agent's solution. Output depends only on its inputs.
 */
public final class JudgePromptBuilder {

    static final String TRUNCATION_MARKER = "\n... (truncated)";

    private JudgePromptBuilder() {
    }

    public static String build(
            TaskDefinition task,
            String agentName,
            Map<String, String> baselineFiles,
            Map<String, String> solutionFiles,
            int maxFileChars
    ) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("# Task Evaluation: ").append(task.name()).append("\n\n");

        prompt.append("## Task Description\n")
                .append(StringUtils.hasText(task.description()) ? task.description() : "No description provided")
                .append("\n\n");

        prompt.append("## Agent Being Evaluated\n").append(agentName).append("\n\n");

        prompt.append("## Scoring Criteria\n").append(formatCriteria(task)).append("\n\n");

        prompt.append("## Baseline Files (Original)\n")
                .append(formatFiles(baselineFiles, "BASELINE", maxFileChars))
                .append("\n\n");

        prompt.append("## Solution Files (Agent Output)\n")
                .append(formatFiles(solutionFiles, "SOLUTION", maxFileChars))
                .append("\n\n");

        prompt.append("""
                ## Instructions
                Please evaluate this solution based on the scoring criteria above. Consider:

                1. **Task Completion**: Does the solution accomplish the stated goals?
                2. **Code Quality**: Is the code well-structured, readable, and maintainable?
                3. **Best Practices**: Does the solution follow established coding conventions?
                4. **Performance**: Are there any obvious performance issues or improvements?
                5. **Edge Cases**: Does the solution handle edge cases appropriately?
                6. **Innovation**: Are there any clever or innovative approaches used?

                Provide your evaluation as JSON with this exact structure:
                ```json
                {
                  "scores": {
                    "criterion_name": score_out_of_max_weight,
                    ...
                  },
                  "total_score": sum_of_all_scores,
                  "feedback": "Overall evaluation summary (2-3 sentences)",
                  "strengths": ["strength1", "strength2", "strength3"],
                  "improvements": ["improvement1", "improvement2", "improvement3"]
                }
                ```

                Be objective and constructive in your evaluation.""");

        if (StringUtils.hasText(task.judgePromptTemplate())) {
            prompt.append("\n\n## Additional Evaluation Guidelines\n").append(task.judgePromptTemplate());
        }
        return prompt.toString();
    }

    static String formatCriteria(TaskDefinition task) {
        if (task.rubric().isEmpty()) {
            return "No specific criteria defined.";
        }
        StringBuilder formatted = new StringBuilder();
        for (RubricCriterion criterion : task.rubric()) {
            if (formatted.length() > 0) {
                formatted.append('\n');
            }
            formatted.append("- **")
                    .append(criterion.name())
                    .append("** (")
                    .append(criterion.weight())
                    .append(" points): ")
                    .append(StringUtils.hasText(criterion.description()) ? criterion.description() : "No description");
        }
        return formatted.toString();
    }

    static String formatFiles(Map<String, String> files, String label, int maxFileChars) {
        if (files == null || files.isEmpty()) {
            return label + ": No files provided";
        }
        StringBuilder formatted = new StringBuilder(label).append(':');
        for (Map.Entry<String, String> file : files.entrySet()) {
            String content = file.getValue() == null ? "" : file.getValue();
            if (content.length() > maxFileChars) {
                content = content.substring(0, maxFileChars) + TRUNCATION_MARKER;
            }
            formatted.append("\n\n### ").append(file.getKey());
            formatted.append("\n```\n").append(content).append("\n```");
        }
        return formatted.toString();
    }
}
