package com.agenteval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EvaluatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(EvaluatorApplication.class, args);
    }
}
