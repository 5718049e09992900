package com.pipewright.orchestrator.repository;

import com.pipewright.orchestrator.model.TaskResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TaskResultRepository extends JpaRepository<TaskResult, String> {

    /**
     * Results written by tasks of the given name within one process, newest first.
     * Callers pass {@code PageRequest.of(0, 1)} to get only the latest.
     */
    @Query("""
            SELECT r FROM TaskResult r, TaskLog t
            WHERE r.taskId = t.taskId
              AND t.processId = :processId
              AND t.taskName = :taskName
            ORDER BY r.createdAt DESC
            """)
    List<TaskResult> findLatestByTaskName(@Param("processId") String processId,
                                          @Param("taskName") String taskName,
                                          Pageable page);
}
