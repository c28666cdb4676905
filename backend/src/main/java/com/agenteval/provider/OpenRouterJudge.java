package com.agenteval.provider;

import com.agenteval.config.JudgeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenRouter chat-completion judge. One instance per API key.
 */
public class OpenRouterJudge implements Judge {

    static final String SYSTEM_PROMPT =
            "You are an expert code reviewer evaluating AI agent solutions. Always respond with valid JSON.";

    private final RestClient restClient;
    private final JudgeProperties judgeProperties;
    private final String apiKey;

    public OpenRouterJudge(RestClient restClient, JudgeProperties judgeProperties, String apiKey) {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException("OpenRouter API key is required");
        }
        this.restClient = restClient;
        this.judgeProperties = judgeProperties;
        this.apiKey = apiKey.trim();
    }

    @Override
    public String ask(String prompt, String model) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt)
        ));
        body.put("temperature", judgeProperties.getTemperature());
        body.put("max_tokens", judgeProperties.getMaxTokens());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .headers(headers -> {
                        if (StringUtils.hasText(judgeProperties.getReferer())) {
                            headers.set("HTTP-Referer", judgeProperties.getReferer());
                        }
                        if (StringUtils.hasText(judgeProperties.getTitle())) {
                            headers.set("X-Title", judgeProperties.getTitle());
                        }
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new JudgeException("OpenRouter API error: " + ex.getMessage(), ex);
        }

        JsonNode content = response == null
                ? null
                : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new JudgeException("OpenRouter response missing choices[0].message.content");
        }
        return content.textValue();
    }
}
