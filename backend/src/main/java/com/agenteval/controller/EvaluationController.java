package com.agenteval.controller;

import com.agenteval.dto.EvaluationRequests;
import com.agenteval.dto.EvaluationResponses;
import com.agenteval.model.EvaluationStatus;
import com.agenteval.provider.JudgeCredentials;
import com.agenteval.service.EvaluationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/evaluations")
public class EvaluationController {

    static final String JUDGE_API_KEY_HEADER = "X-Judge-Api-Key";

    private final EvaluationService evaluationService;

    public EvaluationController(EvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @PostMapping
    public ResponseEntity<EvaluationResponses.EvaluationDetail> createEvaluation(
            @Valid @RequestBody EvaluationRequests.CreateEvaluationRequest request
    ) {
        EvaluationResponses.EvaluationDetail evaluation = evaluationService.createEvaluation(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(evaluation);
    }

    @GetMapping
    public ResponseEntity<List<EvaluationResponses.EvaluationSummary>> listEvaluations(
            @RequestParam(required = false) EvaluationStatus status,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(evaluationService.listEvaluations(status, limit));
    }

    @GetMapping("/{evaluationId}")
    public ResponseEntity<EvaluationResponses.EvaluationDetail> getEvaluation(@PathVariable String evaluationId) {
        return ResponseEntity.ok(evaluationService.getEvaluation(evaluationId));
    }

    @PostMapping("/{evaluationId}/agents/{agentName}/complete")
    public ResponseEntity<EvaluationResponses.AgentSubmission> completeAgent(
            @PathVariable String evaluationId,
            @PathVariable String agentName,
            @RequestHeader(name = JUDGE_API_KEY_HEADER, required = false) String judgeApiKey
    ) {
        EvaluationResponses.AgentSubmission submission = evaluationService.markAgentReady(
                evaluationId,
                agentName,
                JudgeCredentials.of(judgeApiKey)
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submission);
    }

    @PostMapping("/{evaluationId}/reset")
    public ResponseEntity<EvaluationResponses.EvaluationDetail> resetEvaluation(@PathVariable String evaluationId) {
        return ResponseEntity.ok(evaluationService.resetEvaluation(evaluationId));
    }
}
