package com.pipewright.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One version of a knowledge entry. Knowledge is not tied to a process:
 * it carries what later runs should know, and every write appends a version.
 *
 * DB table: knowledge  (created by V4)
 */
@Entity
@Table(name = "knowledge")
public class Knowledge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "knowledge_key", nullable = false, updatable = false)
    private String knowledgeKey;

    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    @Column(name = "content", nullable = false, updatable = false)
    private String content;

    @Column(name = "reason", nullable = false, updatable = false)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Knowledge() {}   // required by JPA

    public Knowledge(String key, int version, String content, String reason) {
        this.knowledgeKey = key;
        this.version      = version;
        this.content      = content;
        this.reason       = reason;
    }

    public Long    getId()           { return id; }
    public String  getKnowledgeKey() { return knowledgeKey; }
    public int     getVersion()      { return version; }
    public String  getContent()      { return content; }
    public String  getReason()       { return reason; }
    public Instant getCreatedAt()    { return createdAt; }
}
