package com.agenteval.provider;

import com.agenteval.config.JudgeMode;
import com.agenteval.config.JudgeProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JudgeScorerFactoryTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private JudgeProperties judgeProperties;
    private JudgeScorerFactory factory;

    @BeforeEach
    void setUp() {
        judgeProperties = new JudgeProperties();
        factory = new JudgeScorerFactory(judgeProperties, RestClient.create(), executor, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void disabledModeProvidesNoJudge() {
        judgeProperties.setMode(JudgeMode.DISABLED);

        assertFalse(factory.create(JudgeCredentials.of("sk-request")).isPresent());
    }

    @Test
    void mockModeProvidesJudgeWithoutCredentials() {
        judgeProperties.setMode(JudgeMode.MOCK);

        assertTrue(factory.create(JudgeCredentials.none()).isPresent());
        assertTrue(factory.create(null).isPresent());
    }

    @Test
    void liveModeNeedsRequestOrConfiguredKey() {
        judgeProperties.setMode(JudgeMode.LIVE);

        assertFalse(factory.create(JudgeCredentials.none()).isPresent());
        assertTrue(factory.create(JudgeCredentials.of("sk-request")).isPresent());

        judgeProperties.setApiKey("sk-configured");
        assertTrue(factory.create(JudgeCredentials.none()).isPresent());
    }

    @Test
    void credentialsNeverPrintTheKey() {
        assertFalse(JudgeCredentials.of("sk-secret").toString().contains("sk-secret"));
        assertFalse(JudgeCredentials.of("   ").hasApiKey());
    }
}
