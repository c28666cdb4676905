package com.agenteval.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "evaluations")
public class Evaluation {

    @Id
    @Column(name = "evaluation_id", nullable = false, updatable = false, length = 64)
    private String evaluationId;

    @Column(name = "task_id", nullable = false, updatable = false, length = 128)
    private String taskId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "agents", nullable = false, columnDefinition = "jsonb")
    private List<String> agents = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private EvaluationStatus status = EvaluationStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "agent_status", nullable = false, columnDefinition = "jsonb")
    private Map<String, AgentStatus> agentStatus = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private JsonNode metadata;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean hasAgent(String agentName) {
        return agents != null && agents.contains(agentName);
    }

    public AgentStatus agentStatusOf(String agentName) {
        if (agentStatus == null) {
            return AgentStatus.PENDING;
        }
        return agentStatus.getOrDefault(agentName, AgentStatus.PENDING);
    }

    public void updateAgentStatus(String agentName, AgentStatus status) {
        // Reassign so dirty checking sees a new value for the json column.
        Map<String, AgentStatus> updated = agentStatus == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(agentStatus);
        updated.put(agentName, status);
        agentStatus = updated;
    }

    public boolean allAgentsCompleted() {
        if (agents == null || agents.isEmpty()) {
            return false;
        }
        for (String agent : agents) {
            if (agentStatusOf(agent) != AgentStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }
}
