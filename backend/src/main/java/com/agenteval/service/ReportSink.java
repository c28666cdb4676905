package com.agenteval.service;

import java.util.List;

/**
 * Receives the final ranking of an evaluation once it completes.
 */
public interface ReportSink {

    void publish(String evaluationId, List<RankedResult> rankedResults);
}
