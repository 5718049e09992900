package com.pipewright.orchestrator.repository;

import com.pipewright.orchestrator.model.Knowledge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface KnowledgeRepository extends JpaRepository<Knowledge, Long> {

    Optional<Knowledge> findFirstByKnowledgeKeyOrderByVersionDesc(String key);

    Optional<Knowledge> findByKnowledgeKeyAndVersion(String key, int version);

    List<Knowledge> findByKnowledgeKeyOrderByVersionAsc(String key);
}
