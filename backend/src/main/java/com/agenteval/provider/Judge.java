package com.agenteval.provider;

/**
 * Chat-completion capability used for judge scoring.
 */
public interface Judge {

    /**
     * Sends one prompt to the given model and returns the raw text response.
     *
     * @throws JudgeException when the provider call fails or returns an unusable response
     */
    String ask(String prompt, String model);
}
