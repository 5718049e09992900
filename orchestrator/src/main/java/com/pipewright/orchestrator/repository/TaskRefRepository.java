package com.pipewright.orchestrator.repository;

import com.pipewright.orchestrator.model.TaskRef;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TaskRefRepository extends JpaRepository<TaskRef, Long> {

    List<TaskRef> findByTaskIdOrderByIdAsc(String taskId);

    boolean existsByTaskIdAndCommitHash(String taskId, String commitHash);

    /**
     * Refs of every task in one process, first recorded first.
     * Callers pass {@code PageRequest.of(0, 1)} to get only the earliest.
     */
    @Query("""
            SELECT r FROM TaskRef r, TaskLog t
            WHERE r.taskId = t.taskId
              AND t.processId = :processId
            ORDER BY r.id ASC
            """)
    List<TaskRef> findEarliestForProcess(@Param("processId") String processId, Pageable page);
}
