package com.pipewright.orchestrator.repository;

import com.pipewright.orchestrator.model.DecisionLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DecisionLogRepository extends JpaRepository<DecisionLog, Long> {

    List<DecisionLog> findByProcessIdOrderByIdAsc(String processId);

    /** Most recent decision recorded by one supervisor invocation. */
    Optional<DecisionLog> findFirstByTaskIdOrderByIdDesc(String taskId);
}
