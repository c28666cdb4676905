package com.agenteval.repository;

import com.agenteval.model.AgentResult;
import com.agenteval.model.AgentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AgentResultRepository extends JpaRepository<AgentResult, UUID> {
    Optional<AgentResult> findByEvaluationIdAndAgentName(String evaluationId, String agentName);

    List<AgentResult> findByEvaluationIdOrderByCreatedAtAsc(String evaluationId);

    List<AgentResult> findByStatusAndCompletedAtGreaterThanEqualOrderByCompletedAtAsc(
            AgentStatus status,
            OffsetDateTime completedAt
    );

    List<AgentResult> findByAgentNameAndStatusAndCompletedAtGreaterThanEqualOrderByCompletedAtAsc(
            String agentName,
            AgentStatus status,
            OffsetDateTime completedAt
    );

    @Query(
            value = """
                    SELECT result.agent_name AS agentName,
                           COUNT(*) AS evaluationCount,
                           AVG(result.score) AS averageScore,
                           MAX(result.score) AS bestScore,
                           MIN(result.score) AS worstScore
                    FROM agent_results result
                    WHERE result.status = 'COMPLETED'
                    GROUP BY result.agent_name
                    ORDER BY AVG(result.score) DESC, result.agent_name ASC
                    """,
            nativeQuery = true
    )
    List<AgentScoreSummaryRow> summarizeCompletedScoresByAgent();

    @Query(
            value = """
                    SELECT result.agent_name AS agentName,
                           COUNT(*) AS evaluationCount,
                           AVG(result.score) AS averageScore,
                           MAX(result.score) AS bestScore,
                           MIN(result.score) AS worstScore
                    FROM agent_results result
                    WHERE result.status = 'COMPLETED'
                    GROUP BY result.agent_name
                    ORDER BY AVG(result.score) DESC, result.agent_name ASC
                    LIMIT :limit
                    """,
            nativeQuery = true
    )
    List<AgentScoreSummaryRow> findLeaderboard(@Param("limit") int limit);

    @Query(
            value = """
                    SELECT result.agent_name AS agentName,
                           COUNT(*) AS evaluationCount,
                           AVG(result.score) AS averageScore,
                           MAX(result.score) AS bestScore,
                           MIN(result.score) AS worstScore
                    FROM agent_results result
                    JOIN evaluations evaluation
                      ON evaluation.evaluation_id = result.evaluation_id
                    JOIN tasks task
                      ON task.task_id = evaluation.task_id
                    WHERE result.status = 'COMPLETED'
                      AND task.category = :category
                    GROUP BY result.agent_name
                    ORDER BY AVG(result.score) DESC, result.agent_name ASC
                    LIMIT :limit
                    """,
            nativeQuery = true
    )
    List<AgentScoreSummaryRow> findLeaderboardForCategory(
            @Param("category") String category,
            @Param("limit") int limit
    );
}
