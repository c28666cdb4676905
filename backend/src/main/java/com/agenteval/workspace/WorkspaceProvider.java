package com.agenteval.workspace;

import java.util.Map;

/**
 * Source of task baselines and agent solutions as relative path to text content.
 */
public interface WorkspaceProvider {

    Map<String, String> loadBaseline(String taskId);

    Map<String, String> loadSolution(String evaluationId, String agentName);
}
