package com.agenteval.repository;

import com.agenteval.model.Evaluation;
import com.agenteval.model.EvaluationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface EvaluationRepository extends JpaRepository<Evaluation, String> {
    List<Evaluation> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<Evaluation> findByStatusOrderByCreatedAtDesc(EvaluationStatus status, Pageable pageable);

    long countByStatus(EvaluationStatus status);

    long countByCreatedAtAfter(OffsetDateTime createdAt);

    @Query(
            value = """
                    SELECT task.category AS category,
                           COUNT(evaluation.evaluation_id) AS evaluationCount
                    FROM evaluations evaluation
                    JOIN tasks task
                      ON task.task_id = evaluation.task_id
                    GROUP BY task.category
                    ORDER BY task.category ASC NULLS LAST
                    """,
            nativeQuery = true
    )
    List<CategoryCountRow> countEvaluationsByTaskCategory();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Evaluation e where e.evaluationId = :evaluationId")
    Optional<Evaluation> findByEvaluationIdForUpdate(@Param("evaluationId") String evaluationId);
}
