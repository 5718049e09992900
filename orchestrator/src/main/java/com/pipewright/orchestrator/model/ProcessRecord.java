package com.pipewright.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Durable snapshot of a {@link ProcessRun}: the plan, the live step list,
 * the current index and the run state. Rewritten by the state machine at
 * every transition so that an interrupted run can be rebuilt.
 *
 * DB table: process_run  (created by V3)
 */
@Entity
@Table(name = "process_run")
public class ProcessRecord {

    @Id
    @Column(name = "process_id", nullable = false, updatable = false)
    private String processId;

    @Column(name = "process_name", nullable = false)
    private String processName;

    // The ProcessSpec as originally defined.
    @Column(name = "spec_json", nullable = false)
    private String specJson;

    // The live queue, injected steps included, in execution order.
    @Column(name = "steps_json", nullable = false)
    private String stepsJson;

    @Column(name = "current_index", nullable = false)
    private int currentIndex;

    // plain VARCHAR, not a native enum type, so V3 stays portable
    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(name = "state", nullable = false)
    private RunState state = RunState.RUNNING;

    @Column(name = "workspace_ref")
    private String workspaceRef;

    @Column(name = "branch")
    private String branch;

    @Column(name = "worktree_path")
    private String worktreePath;

    @Column(name = "parent_process_id", updatable = false)
    private String parentProcessId;

    @Column(name = "abort_reason")
    private String abortReason;

    // JSON object: origin step index -> accepted injections.
    @Column(name = "injection_counts")
    private String injectionCounts;

    @Column(name = "prompt")
    private String prompt;

    @Column(name = "engine")
    private String engine;

    @Column(name = "model")
    private String model;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected ProcessRecord() {}   // required by JPA

    public ProcessRecord(String processId, String processName, String specJson, String parentProcessId) {
        this.processId       = processId;
        this.processName     = processName;
        this.specJson        = specJson;
        this.parentProcessId = parentProcessId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String   getProcessId()       { return processId; }
    public String   getProcessName()     { return processName; }
    public String   getSpecJson()        { return specJson; }
    public String   getStepsJson()       { return stepsJson; }
    public int      getCurrentIndex()    { return currentIndex; }
    public RunState getState()           { return state; }
    public String   getWorkspaceRef()    { return workspaceRef; }
    public String   getBranch()          { return branch; }
    public String   getWorktreePath()    { return worktreePath; }
    public String   getParentProcessId() { return parentProcessId; }
    public String   getAbortReason()     { return abortReason; }
    public String   getInjectionCounts() { return injectionCounts; }
    public String   getPrompt()          { return prompt; }
    public String   getEngine()          { return engine; }
    public String   getModel()           { return model; }
    public Instant  getCreatedAt()       { return createdAt; }
    public Instant  getUpdatedAt()       { return updatedAt; }

    public void setStepsJson(String stepsJson)             { this.stepsJson = stepsJson; }
    public void setCurrentIndex(int currentIndex)          { this.currentIndex = currentIndex; }
    public void setState(RunState state)                   { this.state = state; }
    public void setAbortReason(String abortReason)         { this.abortReason = abortReason; }
    public void setInjectionCounts(String injectionCounts) { this.injectionCounts = injectionCounts; }
    public void setPrompt(String prompt)                   { this.prompt = prompt; }
    public void setEngine(String engine)                   { this.engine = engine; }
    public void setModel(String model)                     { this.model = model; }

    public void setWorktree(WorktreeRef worktree) {
        this.workspaceRef = worktree != null ? worktree.workspaceRef() : null;
        this.branch       = worktree != null ? worktree.branch() : null;
        this.worktreePath = worktree != null ? worktree.path() : null;
    }

    public WorktreeRef worktree() {
        if (workspaceRef == null && branch == null && worktreePath == null) return null;
        return new WorktreeRef(workspaceRef, branch, worktreePath);
    }
}
