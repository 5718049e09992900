package com.pipewright.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One worker step or supervisor phase invocation.
 *
 * Written before the executor is called, completed once it returns. Besides
 * the audit trail this row is the identity record the tool scope gate
 * consults: {@code is_orchestrator} decides which tools the caller may use,
 * so it is mapped non-updatable.
 *
 * DB table: task_log  (V1, is_orchestrator added by V2, step_index/phase by V3)
 */
@Entity
@Table(name = "task_log")
public class TaskLog {

    @Id
    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Column(name = "process_id", nullable = false, updatable = false)
    private String processId;

    @Column(name = "task_name")
    private String taskName;

    @Column(name = "is_orchestrator", nullable = false, updatable = false)
    private boolean orchestrator;

    // Null for worker rows.
    @Column(name = "phase")
    private String phase;

    // Index in the live step list; for finalize this is the step count.
    @Column(name = "step_index")
    private Integer stepIndex;

    @Column(name = "engine")
    private String engine;

    @Column(name = "model")
    private String model;

    @Column(name = "branch")
    private String branch;

    @Column(name = "workspace_ref")
    private String workspaceRef;

    // Engine session reported by the executor, used for session_id resumption.
    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "prompt")
    private String prompt;

    @Column(name = "prompt_hash")
    private String promptHash;

    // Previous worker step of the same run.
    @Column(name = "parent_id")
    private String parentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "success")
    private Boolean success;

    @Column(name = "exit_code")
    private Integer exitCode;

    @Column(name = "error_message")
    private String errorMessage;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected TaskLog() {}   // required by JPA

    public TaskLog(String taskId, String processId, String taskName, boolean orchestrator) {
        this.taskId       = taskId;
        this.processId    = processId;
        this.taskName     = taskName;
        this.orchestrator = orchestrator;
    }

    /** Fill in the completion fields once the executor returned. */
    public void complete(boolean success, int exitCode, String sessionId,
                         long durationMs, String errorMessage) {
        this.success      = success;
        this.exitCode     = exitCode;
        this.sessionId    = sessionId != null ? sessionId : this.sessionId;
        this.durationMs   = durationMs;
        this.errorMessage = errorMessage;
        this.finishedAt   = Instant.now();
    }

    public boolean isFinished() {
        return finishedAt != null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String  getTaskId()       { return taskId; }
    public String  getProcessId()    { return processId; }
    public String  getTaskName()     { return taskName; }
    public boolean isOrchestrator()  { return orchestrator; }
    public String  getPhase()        { return phase; }
    public Integer getStepIndex()    { return stepIndex; }
    public String  getEngine()       { return engine; }
    public String  getModel()        { return model; }
    public String  getBranch()       { return branch; }
    public String  getWorkspaceRef() { return workspaceRef; }
    public String  getSessionId()    { return sessionId; }
    public String  getPrompt()       { return prompt; }
    public String  getPromptHash()   { return promptHash; }
    public String  getParentId()     { return parentId; }
    public Instant getCreatedAt()    { return createdAt; }
    public Instant getFinishedAt()   { return finishedAt; }
    public Long    getDurationMs()   { return durationMs; }
    public Boolean getSuccess()      { return success; }
    public Integer getExitCode()     { return exitCode; }
    public String  getErrorMessage() { return errorMessage; }

    public void setPhase(String phase)               { this.phase = phase; }
    public void setStepIndex(Integer stepIndex)      { this.stepIndex = stepIndex; }
    public void setEngine(String engine)             { this.engine = engine; }
    public void setModel(String model)               { this.model = model; }
    public void setBranch(String branch)             { this.branch = branch; }
    public void setWorkspaceRef(String workspaceRef) { this.workspaceRef = workspaceRef; }
    public void setSessionId(String sessionId)       { this.sessionId = sessionId; }
    public void setParentId(String parentId)         { this.parentId = parentId; }

    public void setPrompt(String prompt) {
        this.prompt     = prompt;
        this.promptHash = HexIds.promptHash(prompt);
    }
}
