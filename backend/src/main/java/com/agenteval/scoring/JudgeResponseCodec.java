package com.agenteval.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses judge text into a {@link JudgeVerdict}. Accepts a bare JSON object or one wrapped in a
 * {@code ```json} fence; any other text becomes the feedback of a zero-score verdict.
 */
public final class JudgeResponseCodec {

    static final String DEFAULT_FEEDBACK = "No feedback provided";

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(\\{.*?\\})\\s*```", Pattern.DOTALL);

    private static final String FIELD_SCORES = "scores";
    private static final String FIELD_TOTAL_SCORE = "total_score";
    private static final String FIELD_FEEDBACK = "feedback";
    private static final String FIELD_STRENGTHS = "strengths";
    private static final String FIELD_IMPROVEMENTS = "improvements";

    private JudgeResponseCodec() {
    }

    public static JudgeVerdict parse(String content, ObjectMapper objectMapper) {
        String text = content == null ? "" : content;
        JsonNode root = readObject(text, objectMapper);
        if (root == null) {
            Matcher matcher = FENCED_JSON.matcher(text);
            if (matcher.find()) {
                root = readObject(matcher.group(1), objectMapper);
                if (root == null) {
                    throw new IllegalArgumentException("Judge response contains a malformed ```json block");
                }
            }
        }
        if (root == null) {
            return new JudgeVerdict(Map.of(), 0.0, true, text, List.of(), List.of());
        }
        return fromJson(root);
    }

    static JudgeVerdict fromJson(JsonNode root) {
        Map<String, Double> scores = parseScores(root.get(FIELD_SCORES));

        double total;
        JsonNode totalNode = root.get(FIELD_TOTAL_SCORE);
        if (totalNode == null || totalNode.isNull()) {
            total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        } else if (totalNode.isNumber()) {
            total = totalNode.doubleValue();
        } else {
            throw new IllegalArgumentException("Judge response field 'total_score' must be numeric");
        }

        JsonNode feedbackNode = root.get(FIELD_FEEDBACK);
        String feedback = feedbackNode == null || feedbackNode.isNull() ? DEFAULT_FEEDBACK : feedbackNode.asText();

        return new JudgeVerdict(
                scores,
                total,
                totalNode != null && !totalNode.isNull(),
                feedback,
                parseTextList(root.get(FIELD_STRENGTHS), FIELD_STRENGTHS),
                parseTextList(root.get(FIELD_IMPROVEMENTS), FIELD_IMPROVEMENTS)
        );
    }

    private static JsonNode readObject(String text, ObjectMapper objectMapper) {
        try {
            JsonNode node = objectMapper.readTree(text.trim());
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private static Map<String, Double> parseScores(JsonNode scoresNode) {
        if (scoresNode == null || scoresNode.isNull()) {
            return Map.of();
        }
        if (!scoresNode.isObject()) {
            throw new IllegalArgumentException("Judge response field 'scores' must be an object");
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = scoresNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new IllegalArgumentException(
                        "Judge response score '" + field.getKey() + "' must be numeric"
                );
            }
            scores.put(field.getKey(), field.getValue().doubleValue());
        }
        return Collections.unmodifiableMap(scores);
    }

    private static List<String> parseTextList(JsonNode node, String fieldName) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Judge response field '" + fieldName + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }
}
