package com.agenteval.provider;

import com.agenteval.config.JudgeMode;
import com.agenteval.config.JudgeProperties;
import com.agenteval.scoring.JudgeScorer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Builds a {@link JudgeScorer} per evaluation call from the configured judge mode and the caller's
 * credentials. Returns empty when no judge is available.
 */
@Component
public class JudgeScorerFactory {

    private final JudgeProperties judgeProperties;
    private final RestClient judgeRestClient;
    private final ExecutorService judgeCallExecutor;
    private final ObjectMapper objectMapper;

    public JudgeScorerFactory(
            JudgeProperties judgeProperties,
            @Qualifier("judgeRestClient") RestClient judgeRestClient,
            @Qualifier("judgeCallExecutor") ExecutorService judgeCallExecutor,
            ObjectMapper objectMapper
    ) {
        this.judgeProperties = judgeProperties;
        this.judgeRestClient = judgeRestClient;
        this.judgeCallExecutor = judgeCallExecutor;
        this.objectMapper = objectMapper;
    }

    public Optional<JudgeScorer> create(JudgeCredentials credentials) {
        Optional<Judge> judge = resolveJudge(credentials == null ? JudgeCredentials.none() : credentials);
        return judge.map(resolved -> new JudgeScorer(
                resolved,
                judgeCallExecutor,
                Duration.ofSeconds(Math.max(1, judgeProperties.getTimeoutSeconds())),
                judgeProperties.getDefaultModel(),
                judgeProperties.getMaxFileChars(),
                objectMapper
        ));
    }

    private Optional<Judge> resolveJudge(JudgeCredentials credentials) {
        JudgeMode mode = judgeProperties.getMode() == null ? JudgeMode.DISABLED : judgeProperties.getMode();
        return switch (mode) {
            case DISABLED -> Optional.empty();
            case MOCK -> Optional.of(new MockJudge(objectMapper));
            case LIVE -> {
                JudgeCredentials effective = credentials.hasApiKey()
                        ? credentials
                        : JudgeCredentials.of(judgeProperties.getApiKey());
                if (!effective.hasApiKey()) {
                    yield Optional.empty();
                }
                yield Optional.of(new OpenRouterJudge(judgeRestClient, judgeProperties, effective.apiKey()));
            }
        };
    }
}
