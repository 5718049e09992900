package com.pipewright.orchestrator.service;

import com.pipewright.orchestrator.engine.ProcessRunStateMachineFactory;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.ProcessStateView;
import com.pipewright.orchestrator.history.RecordNotFoundException;
import com.pipewright.orchestrator.history.ValidationException;
import com.pipewright.orchestrator.model.*;
import com.pipewright.orchestrator.task.ProcessCatalog;
import com.pipewright.orchestrator.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for starting, resuming and continuing runs.
 *
 * Runs are persisted before they are queued, then driven on the
 * {@code processWorkers} pool, one thread per run. Parallel instances of a
 * process are fully independent runs; the only thing they share is the
 * history store.
 */
@Service
public class ProcessService {

    private static final Logger log = LoggerFactory.getLogger(ProcessService.class);

    private final ProcessCatalog                catalog;
    private final TaskRegistry                  tasks;
    private final HistoryStore                  history;
    private final ResumptionResolver            resolver;
    private final ProcessRunStateMachineFactory machines;
    private final ExecutorService               workers;

    // Process ids currently queued or executing on this node.
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public ProcessService(ProcessCatalog catalog,
                          TaskRegistry tasks,
                          HistoryStore history,
                          ResumptionResolver resolver,
                          ProcessRunStateMachineFactory machines,
                          @Qualifier("processWorkers") ExecutorService workers) {
        this.catalog  = catalog;
        this.tasks    = tasks;
        this.history  = history;
        this.resolver = resolver;
        this.machines = machines;
        this.workers  = workers;
    }

    // ------------------------------------------------------------------
    // Start / resume / continue
    // ------------------------------------------------------------------

    /**
     * Start {@code parallel} independent runs of a named process.
     *
     * With a base worktree and more than one instance, instance k gets
     * workspace ref and branch {@code <base>-<k>}.
     *
     * @throws RecordNotFoundException if no process has this name
     * @throws com.pipewright.orchestrator.task.TaskNotFoundException
     *         if a step names an unknown task; nothing is started
     */
    public List<ProcessRun> start(String processName, String prompt, String engine, String model,
                                  int parallel, WorktreeRef baseWorktree) {
        ProcessSpec spec = catalog.find(processName)
                .orElseThrow(() -> new RecordNotFoundException("Process definition", processName));
        spec.steps().forEach(step -> tasks.require(step.task()));
        if (spec.steps().isEmpty()) {
            throw new ValidationException("Process '" + processName + "' has no steps");
        }

        int count = Math.max(1, parallel);
        List<ProcessRun> runs = new ArrayList<>(count);
        for (int k = 1; k <= count; k++) {
            WorktreeRef worktree = instanceWorktree(baseWorktree, k, count);
            ProcessRun run = new ProcessRun(HexIds.newId(), spec, worktree, null, prompt, engine, model);
            history.saveRun(run);
            runs.add(run);
        }
        runs.forEach(this::claimAndSubmit);
        log.info("Started {} run(s) of process '{}': {}", count, processName,
                runs.stream().map(ProcessRun::getProcessId).toList());
        return runs;
    }

    /**
     * Resume the run the key points at, from its first unexecuted step.
     *
     * The process id is claimed before anything is written, so of two
     * concurrent resumes of the same run exactly one gets to drive it.
     *
     * @throws ValidationException if that run is already executing here or has completed
     */
    public ProcessRun resume(String key, ResumeKeyKind kind) {
        ProcessRun run = resolver.resolve(key, kind);
        if (!active.add(run.getProcessId())) {
            throw new ValidationException("Process " + run.getProcessId() + " is already running");
        }
        try {
            history.saveRun(run);
            submit(run);
        } catch (RuntimeException e) {
            active.remove(run.getProcessId());
            throw e;
        }
        return run;
    }

    public ProcessRun continueFrom(String parentTaskId, String prompt) {
        ProcessRun run = resolver.continueFrom(parentTaskId, prompt);
        history.saveRun(run);
        claimAndSubmit(run);
        return run;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public ProcessRecord find(String processId) {
        return history.requireProcess(processId);
    }

    public ProcessStateView readState(String processId) {
        return history.readProcessState(processId);
    }

    public List<OrchestratorDecision> readDecisions(String processId) {
        history.requireProcess(processId);
        return history.readDecisions(processId);
    }

    /** Worker and supervisor execution records of one run, oldest first. */
    public List<TaskLog> readTaskLogs(String processId) {
        history.requireProcess(processId);
        return history.readTaskLogs(processId);
    }

    public List<String> readRefs(String taskId) {
        return history.readRefs(taskId);
    }

    public List<ProcessRecord> readChildren(String processId) {
        history.requireProcess(processId);
        return history.readChildren(processId);
    }

    public List<String> processNames() {
        return catalog.names();
    }

    public List<String> taskNames() {
        return tasks.names();
    }

    public boolean isActive(String processId) {
        return active.contains(processId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void claimAndSubmit(ProcessRun run) {
        active.add(run.getProcessId());
        try {
            submit(run);
        } catch (RuntimeException e) {
            active.remove(run.getProcessId());
            throw e;
        }
    }

    /** The caller must already hold the claim on the run's process id. */
    private void submit(ProcessRun run) {
        workers.submit(() -> {
            try {
                machines.create(run).execute();
            } catch (Exception e) {
                log.error("Unhandled error in process {}: {}", run.getProcessId(), e.getMessage(), e);
                if (!run.getState().isTerminal()) {
                    run.abort("Unhandled exception: " + e.getMessage());
                    history.saveRun(run);
                }
            } finally {
                active.remove(run.getProcessId());
            }
        });
    }

    private static WorktreeRef instanceWorktree(WorktreeRef base, int k, int count) {
        if (base == null || count == 1) return base;
        return new WorktreeRef(
                base.workspaceRef() == null ? null : base.workspaceRef() + "-" + k,
                base.branch() == null ? null : base.branch() + "-" + k,
                null);
    }
}
