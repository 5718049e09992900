package com.pipewright.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime state of one process execution.
 *
 * Separates the mutable live queue ({@link #getSteps()}) from the immutable
 * plan ({@link #getSpec()}). While a run is executing, the state machine that
 * owns it is its only writer; nothing else may call the mutators.
 *
 * Between steps of a live run {@code results.size() == currentIndex}; an
 * aborted run may also hold the failed result of the step that stopped it.
 * The live queue can grow, but never shrinks and never reorders entries that
 * have already executed.
 */
public class ProcessRun {

    private final String processId;
    private final ProcessSpec spec;
    private final List<ProcessStep> steps;
    private final List<StepResult> results;
    private final List<OrchestratorDecision> decisions;
    private final Map<Integer, Integer> injectionCounts;
    private final WorktreeRef worktree;
    private final String parentProcessId;

    // Run-wide overrides given at start; step-level overrides win over these.
    private final String prompt;
    private final String engine;
    private final String model;

    private int currentIndex;
    private RunState state = RunState.RUNNING;
    private String abortReason;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public ProcessRun(String processId, ProcessSpec spec, WorktreeRef worktree,
                      String parentProcessId, String prompt, String engine, String model) {
        this(processId, spec, anchored(spec.steps()), List.of(), 0, worktree, List.of(), Map.of(),
                parentProcessId, prompt, engine, model);
    }

    private static List<ProcessStep> anchored(List<ProcessStep> definition) {
        List<ProcessStep> live = new ArrayList<>(definition.size());
        for (int i = 0; i < definition.size(); i++) {
            live.add(definition.get(i).anchoredAt(i));
        }
        return live;
    }

    private ProcessRun(String processId, ProcessSpec spec, List<ProcessStep> steps,
                       List<StepResult> results, int currentIndex, WorktreeRef worktree,
                       List<OrchestratorDecision> decisions, Map<Integer, Integer> injectionCounts,
                       String parentProcessId, String prompt, String engine, String model) {
        this.processId       = processId;
        this.spec            = spec;
        this.steps           = new ArrayList<>(steps);
        this.results         = new ArrayList<>(results);
        this.currentIndex    = currentIndex;
        this.worktree        = worktree;
        this.decisions       = new ArrayList<>(decisions);
        this.injectionCounts = new HashMap<>(injectionCounts);
        this.parentProcessId = parentProcessId;
        this.prompt          = prompt;
        this.engine          = engine;
        this.model           = model;
    }

    /**
     * Rebuild a run from persisted state. {@code currentIndex} must equal the
     * number of results, i.e. point at the first unexecuted step.
     */
    public static ProcessRun restore(String processId, ProcessSpec spec, List<ProcessStep> liveSteps,
                                     List<StepResult> results, WorktreeRef worktree,
                                     List<OrchestratorDecision> decisions,
                                     Map<Integer, Integer> injectionCounts,
                                     String parentProcessId, String prompt, String engine, String model) {
        if (results.size() > liveSteps.size()) {
            throw new IllegalArgumentException("Process " + processId + " has " + results.size()
                    + " results but only " + liveSteps.size() + " steps");
        }
        return new ProcessRun(processId, spec, liveSteps, results, results.size(), worktree,
                decisions, injectionCounts, parentProcessId, prompt, engine, model);
    }

    // ------------------------------------------------------------------
    // Mutators (state machine only)
    // ------------------------------------------------------------------

    /**
     * Insert steps immediately before the current index. Insertion anywhere
     * else would rewrite history, so it is refused.
     */
    public void insertSteps(int at, List<ProcessStep> newSteps) {
        if (at != currentIndex) {
            throw new IllegalStateException("Steps can only be inserted at the current index "
                    + currentIndex + ", not at " + at);
        }
        steps.addAll(at, newSteps);
    }

    public void recordResult(StepResult result) {
        results.add(result);
    }

    public void advance() {
        currentIndex++;
    }

    public void recordDecision(OrchestratorDecision decision) {
        decisions.add(decision);
    }

    public void transition(RunState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Process " + processId + " is already " + state);
        }
        this.state = next;
    }

    public void abort(String reason) {
        transition(RunState.ABORTED);
        this.abortReason = reason;
    }

    /**
     * Injection-budget key of the current step. Rows written before anchors
     * existed fall back to their position.
     */
    public int currentAnchor() {
        Integer anchor = currentStep().anchorIndex();
        return anchor != null ? anchor : currentIndex;
    }

    /** Mutable view handed to the injection guard of this run, keyed by anchor. */
    public Map<Integer, Integer> injectionCounts() {
        return injectionCounts;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String      getProcessId()       { return processId; }
    public ProcessSpec getSpec()            { return spec; }
    public int         getCurrentIndex()    { return currentIndex; }
    public WorktreeRef getWorktree()        { return worktree; }
    public String      getParentProcessId() { return parentProcessId; }
    public String      getPrompt()          { return prompt; }
    public String      getEngine()          { return engine; }
    public String      getModel()           { return model; }
    public RunState    getState()           { return state; }
    public String      getAbortReason()     { return abortReason; }

    public List<ProcessStep>          getSteps()     { return Collections.unmodifiableList(steps); }
    public List<StepResult>           getResults()   { return Collections.unmodifiableList(results); }
    public List<OrchestratorDecision> getDecisions() { return Collections.unmodifiableList(decisions); }

    public boolean hasNextStep()        { return currentIndex < steps.size(); }
    public ProcessStep currentStep()    { return steps.get(currentIndex); }

    public StepResult lastResult() {
        return results.isEmpty() ? null : results.get(results.size() - 1);
    }
}
