package com.pipewright.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A structured document (PRD, ADR, release notes...) a task produced through
 * {@code write_artifact}. Artifacts are never updated; a revision is a new row.
 *
 * DB table: artifact  (created by V4)
 */
@Entity
@Table(name = "artifact")
public class Artifact {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Column(name = "title", nullable = false, updatable = false)
    private String title;

    @Column(name = "content", nullable = false, updatable = false)
    private String content;

    // json | markdown | xml | text
    @Column(name = "format", nullable = false, updatable = false)
    private String format;

    @Column(name = "template_name", updatable = false)
    private String templateName;

    // JSON array of strings.
    @Column(name = "tags", updatable = false)
    private String tags;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Artifact() {}   // required by JPA

    public Artifact(String id, String taskId, String title, String content, String format,
                    String templateName, String tags) {
        this.id           = id;
        this.taskId       = taskId;
        this.title        = title;
        this.content      = content;
        this.format       = format;
        this.templateName = templateName;
        this.tags         = tags;
    }

    public String  getId()           { return id; }
    public String  getTaskId()       { return taskId; }
    public String  getTitle()        { return title; }
    public String  getContent()      { return content; }
    public String  getFormat()       { return format; }
    public String  getTemplateName() { return templateName; }
    public String  getTags()         { return tags; }
    public Instant getCreatedAt()    { return createdAt; }
}
