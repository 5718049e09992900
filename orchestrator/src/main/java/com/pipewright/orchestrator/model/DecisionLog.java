package com.pipewright.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Persisted form of an {@link OrchestratorDecision}. Append-only.
 *
 * Phase and decision are stored as their wire names; injected steps as a
 * JSON array of step objects.
 *
 * DB table: orchestrator_decision  (created by V2)
 */
@Entity
@Table(name = "orchestrator_decision")
public class DecisionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "process_id", nullable = false, updatable = false)
    private String processId;

    @Column(name = "task_id", nullable = false, updatable = false)
    private String taskId;

    @Column(name = "phase", nullable = false, updatable = false)
    private String phase;

    @Column(name = "step_index", nullable = false, updatable = false)
    private int stepIndex;

    @Column(name = "decision", nullable = false, updatable = false)
    private String decision;

    @Column(name = "reasoning", nullable = false, updatable = false)
    private String reasoning;

    @Column(name = "injected_steps", updatable = false)
    private String injectedSteps;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected DecisionLog() {}   // required by JPA

    public DecisionLog(String processId, String taskId, String phase, int stepIndex,
                       String decision, String reasoning, String injectedSteps, Instant createdAt) {
        this.processId     = processId;
        this.taskId        = taskId;
        this.phase         = phase;
        this.stepIndex     = stepIndex;
        this.decision      = decision;
        this.reasoning     = reasoning;
        this.injectedSteps = injectedSteps;
        this.createdAt     = createdAt;
    }

    public Long    getId()            { return id; }
    public String  getProcessId()     { return processId; }
    public String  getTaskId()        { return taskId; }
    public String  getPhase()         { return phase; }
    public int     getStepIndex()     { return stepIndex; }
    public String  getDecision()      { return decision; }
    public String  getReasoning()     { return reasoning; }
    public String  getInjectedSteps() { return injectedSteps; }
    public Instant getCreatedAt()     { return createdAt; }
}
