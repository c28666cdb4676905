package com.agenteval.service;

/**
 * The stored document of an evaluation's task can no longer be parsed. Scoring cannot proceed for any agent.
 */
public class TaskConfigurationException extends RuntimeException {

    public TaskConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
