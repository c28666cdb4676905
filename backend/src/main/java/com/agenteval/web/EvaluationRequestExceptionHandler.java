package com.agenteval.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class EvaluationRequestExceptionHandler {

    @ExceptionHandler(EvaluationRequestException.class)
    public ResponseEntity<EvaluationErrorResponse> handle(EvaluationRequestException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new EvaluationErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record EvaluationErrorResponse(
            String code,
            String message
    ) {
    }
}
