package com.agenteval.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses and validates task configuration documents ({@code task}, {@code evaluation},
 * {@code ai_judge} and {@code agents} sections).
 */
public final class TaskConfigCodec {

    private static final String SECTION_TASK = "task";
    private static final String SECTION_EVALUATION = "evaluation";
    private static final String SECTION_AI_JUDGE = "ai_judge";
    private static final String SECTION_AGENTS = "agents";

    private TaskConfigCodec() {
    }

    public static TaskDefinition fromJson(JsonNode config, String fallbackTaskId) {
        if (config == null || config.isNull() || !config.isObject()) {
            throw new IllegalArgumentException("Task configuration must be an object");
        }

        JsonNode task = optionalObject(config, SECTION_TASK);
        String taskId = textOrDefault(task, "id", fallbackTaskId);
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task configuration missing 'task.id'");
        }

        JsonNode evaluation = optionalObject(config, SECTION_EVALUATION);
        EvaluationStrategy strategy = EvaluationStrategy.fromConfigValue(textOrDefault(evaluation, "type", null));
        List<RubricCriterion> rubric = parseRubric(evaluation.path("scoring"));

        JsonNode aiJudge = optionalObject(config, SECTION_AI_JUDGE);

        return new TaskDefinition(
                taskId,
                textOrDefault(task, "name", null),
                textOrDefault(task, "description", ""),
                textOrDefault(task, "category", null),
                strategy,
                rubric,
                textOrDefault(aiJudge, "model", null),
                textOrDefault(aiJudge, "prompt_template", null),
                parseAgentPrompts(optionalObject(config, SECTION_AGENTS))
        );
    }

    private static List<RubricCriterion> parseRubric(JsonNode scoring) {
        if (scoring.isMissingNode() || scoring.isNull()) {
            return List.of();
        }
        if (!scoring.isObject()) {
            throw new IllegalArgumentException("Task configuration field 'evaluation.scoring' must be an object");
        }
        List<RubricCriterion> rubric = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = scoring.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode criterion = field.getValue();
            JsonNode weight = criterion.get("weight");
            if (weight == null || !weight.isIntegralNumber()) {
                throw new IllegalArgumentException(
                        "Task configuration missing integer field 'evaluation.scoring." + field.getKey() + ".weight'"
                );
            }
            rubric.add(new RubricCriterion(
                    field.getKey(),
                    weight.intValue(),
                    textOrDefault(criterion, "description", "")
            ));
        }
        return rubric;
    }

    private static Map<String, String> parseAgentPrompts(JsonNode agents) {
        Map<String, String> prompts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = agents.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                prompts.put(field.getKey(), field.getValue().textValue().trim());
            }
        }
        return prompts;
    }

    private static JsonNode optionalObject(JsonNode root, String fieldName) {
        JsonNode node = root.path(fieldName);
        if (node.isMissingNode() || node.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Task configuration field '" + fieldName + "' must be an object");
        }
        return node;
    }

    private static String textOrDefault(JsonNode node, String fieldName, String defaultValue) {
        JsonNode value = node.get(fieldName);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException("Task configuration field '" + fieldName + "' must be a scalar");
        }
        return value.asText();
    }
}
