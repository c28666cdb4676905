package com.agenteval.controller;

import com.agenteval.dto.ComparisonResponses;
import com.agenteval.service.ComparisonService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/results")
public class ResultsController {

    private final ComparisonService comparisonService;

    public ResultsController(ComparisonService comparisonService) {
        this.comparisonService = comparisonService;
    }

    @GetMapping("/comparison/{evaluationId}")
    public ResponseEntity<ComparisonResponses.Comparison> getComparison(@PathVariable String evaluationId) {
        return ResponseEntity.ok(comparisonService.getComparison(evaluationId));
    }

    @GetMapping("/summary")
    public ResponseEntity<ComparisonResponses.ResultsSummary> getSummary() {
        return ResponseEntity.ok(comparisonService.getResultsSummary());
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<ComparisonResponses.LeaderboardEntry>> getLeaderboard(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String category
    ) {
        return ResponseEntity.ok(comparisonService.getLeaderboard(limit, category));
    }

    @GetMapping("/trends")
    public ResponseEntity<ComparisonResponses.Trends> getTrends(
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) String agent
    ) {
        return ResponseEntity.ok(comparisonService.getTrends(days, agent));
    }
}
