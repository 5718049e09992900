package com.pipewright.orchestrator.repository;

import com.pipewright.orchestrator.model.ProcessRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProcessRecordRepository extends JpaRepository<ProcessRecord, String> {

    List<ProcessRecord> findByParentProcessIdOrderByCreatedAtAsc(String parentProcessId);
}
