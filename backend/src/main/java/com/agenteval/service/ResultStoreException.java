package com.agenteval.service;

/**
 * Persistence failure while reading or writing evaluation state. Callers may retry the whole operation.
 */
public class ResultStoreException extends RuntimeException {

    public ResultStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
