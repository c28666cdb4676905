package com.agenteval.service;

import com.agenteval.dto.EvaluationRequests;
import com.agenteval.dto.EvaluationResponses;
import com.agenteval.mapper.EvaluationResponseMapper;
import com.agenteval.model.AgentStatus;
import com.agenteval.model.Evaluation;
import com.agenteval.model.EvaluationStatus;
import com.agenteval.model.Task;
import com.agenteval.provider.JudgeCredentials;
import com.agenteval.repository.AgentResultRepository;
import com.agenteval.repository.EvaluationRepository;
import com.agenteval.web.EvaluationRequestException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 200;
    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final EvaluationRepository evaluationRepository;
    private final AgentResultRepository agentResultRepository;
    private final TaskCatalogService taskCatalogService;
    private final EvaluationQueuePublisher evaluationQueuePublisher;
    private final EvaluationResponseMapper evaluationResponseMapper;

    @Transactional
    public EvaluationResponses.EvaluationDetail createEvaluation(
            EvaluationRequests.CreateEvaluationRequest request
    ) {
        Task task = taskCatalogService.requireActiveTask(request.taskId().trim());
        List<String> agents = requireUniqueAgents(request.agents());
        OffsetDateTime now = OffsetDateTime.now();

        Map<String, AgentStatus> agentStatus = new LinkedHashMap<>();
        agents.forEach(agent -> agentStatus.put(agent, AgentStatus.PENDING));

        Evaluation evaluation = new Evaluation();
        evaluation.setEvaluationId(generateEvaluationId(now));
        evaluation.setTaskId(task.getTaskId());
        evaluation.setAgents(new ArrayList<>(agents));
        evaluation.setStatus(EvaluationStatus.PENDING);
        evaluation.setAgentStatus(agentStatus);
        evaluation.setMetadata(buildMetadata(request.metadata(), agents.size()));
        evaluation.setCreatedAt(now);
        evaluation.setUpdatedAt(now);

        Evaluation saved = evaluationRepository.save(evaluation);
        log.info(
                "Created evaluation {} for task {} with agents {}",
                saved.getEvaluationId(),
                saved.getTaskId(),
                agents
        );
        return evaluationResponseMapper.toEvaluationDetailResponse(saved, List.of());
    }

    @Transactional(readOnly = true)
    public List<EvaluationResponses.EvaluationSummary> listEvaluations(EvaluationStatus status, Integer limit) {
        PageRequest page = PageRequest.of(0, resolveLimit(limit));
        List<Evaluation> evaluations = status == null
                ? evaluationRepository.findAllByOrderByCreatedAtDesc(page)
                : evaluationRepository.findByStatusOrderByCreatedAtDesc(status, page);
        return evaluationResponseMapper.toEvaluationSummaryResponses(evaluations);
    }

    @Transactional(readOnly = true)
    public EvaluationResponses.EvaluationDetail getEvaluation(String evaluationId) {
        Evaluation evaluation = evaluationRepository.findById(evaluationId)
                .orElseThrow(() -> EvaluationRequestException.evaluationNotFound(evaluationId));
        return evaluationResponseMapper.toEvaluationDetailResponse(
                evaluation,
                agentResultRepository.findByEvaluationIdOrderByCreatedAtAsc(evaluationId)
        );
    }

    /**
     * Marks the agent's solution as ready and queues it for scoring once this transaction commits.
     */
    @Transactional
    public EvaluationResponses.AgentSubmission markAgentReady(
            String evaluationId,
            String agentName,
            JudgeCredentials credentials
    ) {
        Evaluation evaluation = evaluationRepository.findByEvaluationIdForUpdate(evaluationId)
                .orElseThrow(() -> EvaluationRequestException.evaluationNotFound(evaluationId));
        if (!evaluation.hasAgent(agentName)) {
            throw EvaluationRequestException.invalidAgent(evaluationId, agentName);
        }
        if (evaluation.getStatus() == EvaluationStatus.FAILED) {
            throw EvaluationRequestException.evaluationFailed(evaluationId);
        }

        if (evaluation.getStatus() != EvaluationStatus.COMPLETED) {
            evaluation.updateAgentStatus(agentName, AgentStatus.READY);
            evaluation.setUpdatedAt(OffsetDateTime.now());
            evaluationRepository.save(evaluation);
        }
        evaluationQueuePublisher.submit(evaluationId, agentName, credentials);
        log.info("Queued agent {} of evaluation {} for scoring", agentName, evaluationId);

        return new EvaluationResponses.AgentSubmission(
                evaluationId,
                agentName,
                evaluation.agentStatusOf(agentName),
                "Started evaluation for " + agentName
        );
    }

    /**
     * Returns every agent and the evaluation to PENDING. Stored results are kept and overwritten on the next
     * scoring run.
     */
    @Transactional
    public EvaluationResponses.EvaluationDetail resetEvaluation(String evaluationId) {
        Evaluation evaluation = evaluationRepository.findByEvaluationIdForUpdate(evaluationId)
                .orElseThrow(() -> EvaluationRequestException.evaluationNotFound(evaluationId));

        Map<String, AgentStatus> agentStatus = new LinkedHashMap<>();
        evaluation.getAgents().forEach(agent -> agentStatus.put(agent, AgentStatus.PENDING));
        evaluation.setAgentStatus(agentStatus);
        evaluation.setStatus(EvaluationStatus.PENDING);
        evaluation.setCompletedAt(null);
        evaluation.setFailureReason(null);
        evaluation.setUpdatedAt(OffsetDateTime.now());
        Evaluation saved = evaluationRepository.save(evaluation);
        log.info("Reset evaluation {}", evaluationId);

        return evaluationResponseMapper.toEvaluationDetailResponse(
                saved,
                agentResultRepository.findByEvaluationIdOrderByCreatedAtAsc(evaluationId)
        );
    }

    static String generateEvaluationId(OffsetDateTime now) {
        return "eval-" + now.format(ID_TIMESTAMP) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static List<String> requireUniqueAgents(List<String> agents) {
        Set<String> unique = new LinkedHashSet<>();
        for (String agent : agents) {
            String trimmed = agent.trim();
            if (!unique.add(trimmed)) {
                throw EvaluationRequestException.duplicateAgent(trimmed);
            }
        }
        return List.copyOf(unique);
    }

    private static ObjectNode buildMetadata(JsonNode requestMetadata, int agentCount) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        if (requestMetadata != null && requestMetadata.isObject()) {
            metadata.setAll((ObjectNode) requestMetadata.deepCopy());
        }
        metadata.put("created_by", "api");
        metadata.put("agent_count", agentCount);
        return metadata;
    }

    private static int resolveLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIST_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
    }
}
