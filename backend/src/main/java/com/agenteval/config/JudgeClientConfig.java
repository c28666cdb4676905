package com.agenteval.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class JudgeClientConfig {

    @Bean
    public RestClient judgeRestClient(JudgeProperties judgeProperties) {
        Duration timeout = Duration.ofSeconds(Math.max(1, judgeProperties.getTimeoutSeconds()));
        // Requests through the JDK client unblock when the judge-call thread is interrupted.
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(
                HttpClient.newBuilder().connectTimeout(timeout).build()
        );
        requestFactory.setReadTimeout(timeout);
        return RestClient.builder()
                .baseUrl(judgeProperties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService judgeCallExecutor(JudgeProperties judgeProperties) {
        return Executors.newFixedThreadPool(
                Math.max(1, judgeProperties.getMaxConcurrentCalls()),
                new CustomizableThreadFactory("judge-call-")
        );
    }
}
