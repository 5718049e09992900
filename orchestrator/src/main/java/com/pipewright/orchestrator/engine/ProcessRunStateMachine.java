package com.pipewright.orchestrator.engine;

import com.pipewright.orchestrator.config.OrchestratorConfig;
import com.pipewright.orchestrator.config.PipewrightProperties;
import com.pipewright.orchestrator.executor.ExecutionOutcome;
import com.pipewright.orchestrator.executor.ExecutionRequest;
import com.pipewright.orchestrator.executor.ExecutorException;
import com.pipewright.orchestrator.executor.StepExecutor;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.*;
import com.pipewright.orchestrator.task.TaskDefinition;
import com.pipewright.orchestrator.task.TaskRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Optional;

/**
 * Drives one {@link ProcessRun} from its current index to a terminal state.
 *
 * <pre>
 *   RUNNING
 *     └─ per step i:  PRE_DECISION → EXECUTING → POST_REVIEW
 *   FINALIZING → COMPLETED
 *   (any point) → ABORTED
 * </pre>
 *
 * <p>Per step, unless the step skips supervision or the supervisor is
 * disabled for this run:
 * <ol>
 *   <li>{@code pre_step(i)}. {@code abort} ends the run. {@code inject} goes
 *       through the {@link InjectionGuard}; accepted steps are inserted at
 *       {@code i} and {@code pre_step} runs again at the same index, now for
 *       the first injected step. A rejected injection is forced to proceed.</li>
 *   <li>The step runs on the execution service. Any failure aborts the run.</li>
 *   <li>The result is appended and the index advances.</li>
 *   <li>{@code post_step(i)}, review only; its outcome is ignored.</li>
 * </ol>
 * After the last step, {@code finalize} runs once. A non-proceed finalize
 * verdict is logged, never applied.
 *
 * <p>Supervisor failures are recovered (default proceed), worker failures are
 * fatal. The run is snapshotted to history after every state change so it
 * can be resumed.
 *
 * <p>Not thread-safe: one instance per run, driven by a single thread.
 */
public class ProcessRunStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunStateMachine.class);

    private final ProcessRun                 run;
    private final OrchestratorConfig         config;
    private final InjectionGuard             guard;
    private final OrchestratorSupervisor     supervisor;
    private final StepExecutor               executor;
    private final HistoryStore               history;
    private final TaskRegistry               tasks;
    private final OrchestratorContextBuilder contextBuilder;
    private final PipewrightProperties       properties;
    private final MeterRegistry              meterRegistry;

    public ProcessRunStateMachine(ProcessRun run,
                                  OrchestratorConfig config,
                                  OrchestratorSupervisor supervisor,
                                  StepExecutor executor,
                                  HistoryStore history,
                                  TaskRegistry tasks,
                                  OrchestratorContextBuilder contextBuilder,
                                  PipewrightProperties properties,
                                  MeterRegistry meterRegistry) {
        this.run            = run;
        this.config         = config;
        this.guard          = new InjectionGuard(run.injectionCounts());
        this.supervisor     = supervisor;
        this.executor       = executor;
        this.history        = history;
        this.tasks          = tasks;
        this.contextBuilder = contextBuilder;
        this.properties     = properties;
        this.meterRegistry  = meterRegistry;
    }

    public ProcessRun getRun() { return run; }

    /**
     * Execute until the run completes or aborts.
     *
     * @return the same run, now in a terminal state
     * @throws IllegalStateException if the run is already terminal
     */
    public ProcessRun execute() {
        if (run.getState().isTerminal()) {
            throw new IllegalStateException("Process " + run.getProcessId() + " is already " + run.getState());
        }
        MDC.put("processId", run.getProcessId());
        try {
            log.info("Process '{}' ({}) running from step {} of {} (supervisor {})",
                    run.getSpec().name(), run.getProcessId(), run.getCurrentIndex(),
                    run.getSteps().size(), config.enabled() ? "enabled" : "disabled");
            runSteps();
            if (!run.getState().isTerminal()) {
                runFinalize();
            }
            return run;
        } finally {
            MDC.remove("processId");
        }
    }

    // ------------------------------------------------------------------
    // Step loop
    // ------------------------------------------------------------------

    private void runSteps() {
        while (run.hasNextStep()) {
            int index = run.getCurrentIndex();
            ProcessStep step = run.currentStep();
            boolean supervised = config.enabled() && !step.skipOrchestrator();

            if (supervised) {
                transition(RunState.PRE_DECISION);
                OrchestratorDecision decision = invokeSupervisor(Phase.PRE_STEP, index);
                run.recordDecision(decision);

                if (decision.decision() == DecisionType.ABORT) {
                    abort("Aborted by supervisor at pre_step for step " + index + ": " + decision.reasoning());
                    return;
                }
                if (decision.decision() == DecisionType.INJECT && applyInjection(index, decision)) {
                    // Same index again: pre_step now sees the first injected step.
                    continue;
                }
            }

            transition(RunState.EXECUTING);
            Optional<StepResult> result = executeStep(index, step);
            if (result.isEmpty()) {
                return;
            }
            run.recordResult(result.get());
            if (!result.get().success()) {
                abort("Step " + index + " (" + step.task() + ") failed with exit code "
                        + result.get().exitCode());
                return;
            }
            run.advance();
            history.saveRun(run);

            if (supervised) {
                transition(RunState.POST_REVIEW);
                invokeSupervisor(Phase.POST_STEP, index);
            }
        }
    }

    /**
     * @return true if the steps were inserted; false when the guard refused
     *         them and the decision was forced to proceed
     */
    private boolean applyInjection(int index, OrchestratorDecision decision) {
        int anchor = run.currentAnchor();
        if (guard.admit(anchor, config)) {
            List<ProcessStep> tagged = decision.injectedSteps().stream()
                    .map(s -> s.injectedAt(index, anchor))
                    .toList();
            run.insertSteps(index, tagged);
            history.saveRun(run);
            meterRegistry.counter("pipewright.injections", "outcome", "accepted").increment();
            log.info("Injected {} step(s) {} at index {} for original step {} ({} of {} allowed)",
                    tagged.size(), tagged.stream().map(ProcessStep::task).toList(), index, anchor,
                    guard.count(anchor), config.maxInjections());
            return true;
        }
        meterRegistry.counter("pipewright.injections", "outcome", "rejected").increment();
        log.warn("Injection limit of {} reached at step {} (original step {}); ignoring inject of {} and proceeding",
                config.maxInjections(), index, anchor,
                decision.injectedSteps().stream().map(ProcessStep::task).toList());
        run.recordDecision(OrchestratorDecision.proceed(Phase.PRE_STEP, index,
                "Injection limit of " + config.maxInjections() + " reached at step " + index
                        + "; inject forced to proceed", decision.taskId()));
        return false;
    }

    /**
     * Run one worker step. Empty when the step could not even be started
     * (unknown task); the run is aborted in that case.
     */
    private Optional<StepResult> executeStep(int index, ProcessStep step) {
        Optional<TaskDefinition> found = tasks.getByName(step.task());
        if (found.isEmpty()) {
            log.error("Step {} names unknown task '{}'", index, step.task());
            abort("Step " + index + " names unknown task '" + step.task() + "'");
            return Optional.empty();
        }
        TaskDefinition definition = found.get();

        String engine = firstNonBlank(step.engine(), run.getEngine(), properties.getDefaultEngine());
        String model  = firstNonBlank(step.model(), run.getModel(), definition.model());
        String prompt = contextBuilder.workerPrompt(run, step, definition.prompt());
        String taskId = HexIds.newId();

        TaskLog identity = new TaskLog(taskId, run.getProcessId(), step.task(), false);
        identity.setStepIndex(index);
        identity.setEngine(engine);
        identity.setModel(model);
        identity.setPrompt(prompt);
        StepResult previous = run.lastResult();
        if (previous != null) identity.setParentId(previous.taskId());
        if (run.getWorktree() != null) {
            identity.setBranch(run.getWorktree().branch());
            identity.setWorkspaceRef(run.getWorktree().workspaceRef());
        }
        history.appendTaskLog(identity);

        MDC.put("taskId", taskId);
        MDC.put("stepIndex", String.valueOf(index));
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.currentTimeMillis();
        try {
            log.info("Step {}/{}: {}", index + 1, run.getSteps().size(), step.task());
            ExecutionOutcome outcome;
            try {
                outcome = executor.run(new ExecutionRequest(taskId, run.getProcessId(), definition,
                        engine, model, null, run.getWorktree(), prompt, false));
            } catch (ExecutorException e) {
                log.error("Step {} ({}) could not be executed: {}", index, step.task(), e.getMessage(), e);
                outcome = ExecutionOutcome.failed(e.getMessage());
            }
            long duration = System.currentTimeMillis() - start;
            String error = outcome.succeeded() ? null
                    : (outcome.error() != null ? outcome.error() : "Exit code: " + outcome.exitCode());
            history.completeTaskLog(taskId, outcome.succeeded(), outcome.exitCode(),
                    outcome.sessionId(), duration, error);
            history.addRefs(taskId, outcome.refs());

            if (outcome.succeeded()) {
                log.info("Step {}/{} completed: {} in {} ms", index + 1, run.getSteps().size(), step.task(), duration);
            } else {
                log.error("Step {}/{} failed: {} ({})", index + 1, run.getSteps().size(), step.task(), error);
            }
            // A failed step always carries a non-zero exit code in its result.
            int exitCode = outcome.succeeded() ? 0 : (outcome.exitCode() == 0 ? -1 : outcome.exitCode());
            return Optional.of(new StepResult(index, step.task(), taskId, outcome.succeeded(), exitCode, duration));
        } finally {
            sample.stop(meterRegistry.timer("pipewright.step.duration", "task", step.task()));
            MDC.remove("taskId");
            MDC.remove("stepIndex");
        }
    }

    // ------------------------------------------------------------------
    // Finalize
    // ------------------------------------------------------------------

    private void runFinalize() {
        if (config.enabled()) {
            transition(RunState.FINALIZING);
            OrchestratorDecision decision = invokeSupervisor(Phase.FINALIZE, run.getSteps().size());
            run.recordDecision(decision);
            if (decision.decision() != DecisionType.PROCEED) {
                log.warn("Finalize decided '{}' for process {}; steps already succeeded, completing anyway: {}",
                        decision.decision().wireName(), run.getProcessId(), decision.reasoning());
            }
        }
        transition(RunState.COMPLETED);
        log.info("Process '{}' ({}) completed: {} step(s)",
                run.getSpec().name(), run.getProcessId(), run.getResults().size());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** Supervisor call with the recovery path for anything it throws. */
    private OrchestratorDecision invokeSupervisor(Phase phase, int index) {
        try {
            return supervisor.invoke(phase, index, run, config);
        } catch (RuntimeException e) {
            log.warn("Supervisor {} for step {} failed: {}; defaulting to proceed",
                    phase.wireName(), index, e.getMessage(), e);
            return OrchestratorDecision.proceed(phase, index,
                    "Supervisor " + phase.wireName() + " failed (" + e.getMessage() + "); defaulting to proceed",
                    null);
        }
    }

    private void transition(RunState next) {
        run.transition(next);
        history.saveRun(run);
    }

    private void abort(String reason) {
        run.abort(reason);
        history.saveRun(run);
        log.error("Process {} aborted: {}", run.getProcessId(), reason);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
