package com.pipewright.orchestrator.repository;

import com.pipewright.orchestrator.model.Artifact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ArtifactRepository extends JpaRepository<Artifact, String> {

    List<Artifact> findByTaskIdOrderByCreatedAtAsc(String taskId);

    @Query("""
            SELECT a FROM Artifact a, TaskLog t
            WHERE a.taskId = t.taskId
              AND t.processId = :processId
            ORDER BY a.createdAt ASC
            """)
    List<Artifact> findByProcessId(@Param("processId") String processId);
}
