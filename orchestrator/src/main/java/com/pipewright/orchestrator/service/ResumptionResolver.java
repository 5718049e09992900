package com.pipewright.orchestrator.service;

import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.RecordNotFoundException;
import com.pipewright.orchestrator.history.RunSnapshot;
import com.pipewright.orchestrator.history.ValidationException;
import com.pipewright.orchestrator.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rebuilds runs from history.
 *
 * {@link #resolve} finds the run an execution record belongs to and restores
 * it at its first unexecuted step: the live step list (injected steps
 * included), the results so far, the decision trail, the spent injection
 * budget and the worktree. {@link #continueFrom} starts a new run that is an
 * explicit child of an earlier one.
 */
@Component
public class ResumptionResolver {

    private static final Logger log = LoggerFactory.getLogger(ResumptionResolver.class);

    private final HistoryStore history;

    public ResumptionResolver(HistoryStore history) {
        this.history = history;
    }

    /**
     * @throws RecordNotFoundException if nothing matches the key
     * @throws ValidationException     if the matched run already completed
     */
    public ProcessRun resolve(String key, ResumeKeyKind kind) {
        TaskLog anchor = findAnchor(key, kind)
                .orElseThrow(() -> new RecordNotFoundException("Task log for " + kind.wireName(), key));
        RunSnapshot snapshot = history.loadSnapshot(anchor.getProcessId());
        ProcessRecord record = snapshot.record();
        if (record.getState() == RunState.COMPLETED) {
            throw new ValidationException("Process " + record.getProcessId() + " already completed; nothing to resume");
        }

        ProcessRun run = ProcessRun.restore(record.getProcessId(), snapshot.spec(), snapshot.steps(),
                snapshot.results(), record.worktree(), snapshot.decisions(), snapshot.injectionCounts(),
                record.getParentProcessId(), record.getPrompt(), record.getEngine(), record.getModel());
        log.info("Resolved {} '{}' to process {}: {} of {} step(s) done, resuming at {}",
                kind.wireName(), key, run.getProcessId(), run.getResults().size(),
                run.getSteps().size(), run.getCurrentIndex());
        return run;
    }

    /**
     * New run of the parent's process, on the parent's worktree, linked
     * through {@code parent_process_id}. The step list starts fresh from the
     * process definition.
     *
     * @throws RecordNotFoundException if the parent task or its process is unknown
     */
    public ProcessRun continueFrom(String parentTaskId, String prompt) {
        TaskLog parentTask = history.requireTaskLog(parentTaskId);
        RunSnapshot parent = history.loadSnapshot(parentTask.getProcessId());
        ProcessRecord record = parent.record();

        ProcessRun child = new ProcessRun(HexIds.newId(), parent.spec(), record.worktree(),
                record.getProcessId(), prompt, record.getEngine(), record.getModel());
        log.info("Continuing process {} (task {}) as new process {}",
                record.getProcessId(), parentTaskId, child.getProcessId());
        return child;
    }

    private Optional<TaskLog> findAnchor(String key, ResumeKeyKind kind) {
        return switch (kind) {
            case TASK_ID    -> history.findTaskLog(key);
            case BRANCH     -> history.findLatestByBranch(key);
            case SESSION_ID -> history.findLatestBySession(key);
        };
    }
}
