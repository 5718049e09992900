package com.pipewright.orchestrator.repository;

import com.pipewright.orchestrator.model.TaskLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TaskLogRepository extends JpaRepository<TaskLog, String> {

    /** Worker rows of a process, in creation order. */
    List<TaskLog> findByProcessIdAndOrchestratorFalseOrderByCreatedAtAsc(String processId);

    List<TaskLog> findByProcessIdOrderByCreatedAtAsc(String processId);

    Optional<TaskLog> findFirstBySessionIdOrderByCreatedAtDesc(String sessionId);

    Optional<TaskLog> findFirstByBranchOrderByCreatedAtDesc(String branch);
}
