package com.agenteval.provider;

import org.springframework.util.StringUtils;

/**
 * Request-scoped judge credentials. Never cached beyond the scorer built for one evaluation call.
 */
public record JudgeCredentials(String apiKey) {

    private static final JudgeCredentials NONE = new JudgeCredentials(null);

    public JudgeCredentials {
        apiKey = StringUtils.hasText(apiKey) ? apiKey.trim() : null;
    }

    public static JudgeCredentials none() {
        return NONE;
    }

    public static JudgeCredentials of(String apiKey) {
        return StringUtils.hasText(apiKey) ? new JudgeCredentials(apiKey) : NONE;
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    @Override
    public String toString() {
        return hasApiKey() ? "JudgeCredentials[apiKey=***]" : "JudgeCredentials[none]";
    }
}
