package com.pipewright.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Result text a task wrote through the {@code write_result} tool.
 * Post-step reviews land here too. One row per task; a later write replaces it.
 *
 * DB table: task_result  (created by V1, summary_text added by V4)
 */
@Entity
@Table(name = "task_result")
public class TaskResult {

    @Id
    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Column(name = "result_text", nullable = false)
    private String resultText;

    // Short form for read_result_summary; null when the task gave none.
    @Column(name = "summary_text")
    private String summaryText;

    // JSON arrays of strings.
    @Column(name = "key_files")
    private String keyFiles;

    @Column(name = "tags")
    private String tags;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    protected TaskResult() {}   // required by JPA

    public TaskResult(String taskId, String resultText, String summaryText, String keyFiles, String tags) {
        this.taskId      = taskId;
        this.resultText  = resultText;
        this.summaryText = summaryText;
        this.keyFiles    = keyFiles;
        this.tags        = tags;
    }

    public String  getTaskId()      { return taskId; }
    public String  getResultText()  { return resultText; }
    public String  getSummaryText() { return summaryText; }
    public String  getKeyFiles()    { return keyFiles; }
    public String  getTags()        { return tags; }
    public Instant getCreatedAt()   { return createdAt; }
}
