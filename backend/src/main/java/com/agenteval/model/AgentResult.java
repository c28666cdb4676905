package com.agenteval.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(
        name = "agent_results",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_agent_results_evaluation_agent",
                columnNames = {"evaluation_id", "agent_name"}
        )
)
public class AgentResult {

    @Id
    @Column(name = "result_id", nullable = false, updatable = false)
    private UUID resultId;

    @Column(name = "evaluation_id", nullable = false, updatable = false, length = 64)
    private String evaluationId;

    @Column(name = "agent_name", nullable = false, updatable = false, length = 128)
    private String agentName;

    @Column(name = "score", nullable = false)
    private Integer score = 0;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "breakdown", nullable = false, columnDefinition = "jsonb")
    private Map<String, Integer> breakdown = new LinkedHashMap<>();

    @Column(name = "feedback", columnDefinition = "TEXT")
    private String feedback;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "strengths", nullable = false, columnDefinition = "jsonb")
    private List<String> strengths = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "improvements", nullable = false, columnDefinition = "jsonb")
    private List<String> improvements = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "outputs", columnDefinition = "jsonb")
    private JsonNode outputs;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private AgentStatus status = AgentStatus.COMPLETED;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
