package com.agenteval.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * AI judge settings. The api key here is only the deployment default; a request may carry its own.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "evaluator.judge")
public class JudgeProperties {

    private JudgeMode mode = JudgeMode.DISABLED;
    private String apiKey;
    private String baseUrl = "https://openrouter.ai/api/v1";
    private String defaultModel = "anthropic/claude-3-sonnet";
    private String referer = "http://localhost:8080";
    private String title = "AI Agent Evaluator";
    private int timeoutSeconds = 120;
    private int maxFileChars = 3000;
    private int maxConcurrentCalls = 4;
    private double temperature = 0.1;
    private int maxTokens = 2000;
}
