package com.agenteval.provider;

import com.agenteval.config.JudgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenRouterJudgeTest {

    private static final String BASE_URL = "https://openrouter.test/api/v1";

    private MockRestServiceServer server;
    private OpenRouterJudge judge;

    @BeforeEach
    void setUp() {
        JudgeProperties judgeProperties = new JudgeProperties();
        judgeProperties.setTitle("Evaluator Test");
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        judge = new OpenRouterJudge(builder.build(), judgeProperties, "sk-test");
    }

    @Test
    void postsChatCompletionAndReturnsMessageContent() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(header("X-Title", "Evaluator Test"))
                .andExpect(jsonPath("$.model").value("anthropic/claude-3-sonnet"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[0].content").value(OpenRouterJudge.SYSTEM_PROMPT))
                .andExpect(jsonPath("$.messages[1].content").value("evaluate this"))
                .andExpect(jsonPath("$.max_tokens").value(2000))
                .andRespond(withSuccess("""
                        {"choices": [{"message": {"role": "assistant", "content": "{\\"total_score\\": 77}"}}]}
                        """, MediaType.APPLICATION_JSON));

        String content = judge.ask("evaluate this", "anthropic/claude-3-sonnet");

        assertEquals("{\"total_score\": 77}", content);
        server.verify();
    }

    @Test
    void providerErrorBecomesJudgeException() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withServerError());

        JudgeException ex = assertThrows(JudgeException.class, () -> judge.ask("prompt", "model"));

        assertTrue(ex.getMessage().startsWith("OpenRouter API error"));
    }

    @Test
    void responseWithoutContentIsRejected() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

        JudgeException ex = assertThrows(JudgeException.class, () -> judge.ask("prompt", "model"));

        assertEquals("OpenRouter response missing choices[0].message.content", ex.getMessage());
    }

    @Test
    void blankApiKeyIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new OpenRouterJudge(RestClient.create(), new JudgeProperties(), " ")
        );
    }
}
