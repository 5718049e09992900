package com.pipewright.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A commit the execution service reported for a worker step. The first ref
 * of a step is the HEAD it started from, followed by the commits it made.
 *
 * DB table: task_ref  (created by V4)
 */
@Entity
@Table(name = "task_ref")
public class TaskRef {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Column(name = "commit_hash", nullable = false, updatable = false)
    private String commitHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected TaskRef() {}   // required by JPA

    public TaskRef(String taskId, String commitHash) {
        this.taskId     = taskId;
        this.commitHash = commitHash;
    }

    public Long    getId()         { return id; }
    public String  getTaskId()     { return taskId; }
    public String  getCommitHash() { return commitHash; }
    public Instant getCreatedAt()  { return createdAt; }
}
