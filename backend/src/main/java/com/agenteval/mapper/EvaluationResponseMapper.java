package com.agenteval.mapper;

import com.agenteval.dto.EvaluationResponses;
import com.agenteval.dto.TaskResponses;
import com.agenteval.model.AgentResult;
import com.agenteval.model.AgentStatus;
import com.agenteval.model.Evaluation;
import com.agenteval.model.Task;
import com.agenteval.model.TaskDefinition;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class EvaluationResponseMapper {

    public EvaluationResponses.EvaluationSummary toEvaluationSummaryResponse(Evaluation evaluation) {
        return new EvaluationResponses.EvaluationSummary(
                evaluation.getEvaluationId(),
                evaluation.getTaskId(),
                List.copyOf(evaluation.getAgents()),
                evaluation.getStatus(),
                orderedAgentStatus(evaluation),
                evaluation.getCreatedAt(),
                evaluation.getUpdatedAt(),
                evaluation.getCompletedAt()
        );
    }

    public List<EvaluationResponses.EvaluationSummary> toEvaluationSummaryResponses(
            Collection<Evaluation> evaluations
    ) {
        return evaluations.stream()
                .map(this::toEvaluationSummaryResponse)
                .toList();
    }

    public EvaluationResponses.EvaluationDetail toEvaluationDetailResponse(
            Evaluation evaluation,
            Collection<AgentResult> results
    ) {
        Map<String, EvaluationResponses.AgentResultView> resultsByAgent = new LinkedHashMap<>();
        for (AgentResult result : results) {
            resultsByAgent.put(result.getAgentName(), toAgentResultView(result));
        }
        return new EvaluationResponses.EvaluationDetail(
                evaluation.getEvaluationId(),
                evaluation.getTaskId(),
                List.copyOf(evaluation.getAgents()),
                evaluation.getStatus(),
                orderedAgentStatus(evaluation),
                evaluation.getMetadata(),
                evaluation.getFailureReason(),
                resultsByAgent,
                evaluation.getCreatedAt(),
                evaluation.getUpdatedAt(),
                evaluation.getCompletedAt()
        );
    }

    public EvaluationResponses.AgentResultView toAgentResultView(AgentResult result) {
        return new EvaluationResponses.AgentResultView(
                result.getAgentName(),
                result.getScore(),
                result.getBreakdown(),
                result.getFeedback(),
                result.getStrengths(),
                result.getImprovements(),
                result.getStatus(),
                result.getStartedAt(),
                result.getCompletedAt()
        );
    }

    public TaskResponses.TaskSummary toTaskSummaryResponse(Task task) {
        return new TaskResponses.TaskSummary(
                task.getTaskId(),
                task.getName(),
                task.getDescription(),
                task.getCategory(),
                task.getEvaluationStrategy(),
                Boolean.TRUE.equals(task.getActive()),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }

    public TaskResponses.TaskDetail toTaskDetailResponse(Task task, TaskDefinition definition) {
        return new TaskResponses.TaskDetail(
                task.getTaskId(),
                task.getName(),
                task.getDescription(),
                task.getCategory(),
                task.getEvaluationStrategy(),
                task.getJudgeModel(),
                definition.rubric(),
                definition.agentPrompts(),
                Boolean.TRUE.equals(task.getActive()),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }

    private static Map<String, AgentStatus> orderedAgentStatus(Evaluation evaluation) {
        Map<String, AgentStatus> ordered = new LinkedHashMap<>();
        for (String agent : evaluation.getAgents()) {
            ordered.put(agent, evaluation.agentStatusOf(agent));
        }
        return ordered;
    }
}
