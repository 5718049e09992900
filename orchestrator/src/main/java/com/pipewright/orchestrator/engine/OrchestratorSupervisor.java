package com.pipewright.orchestrator.engine;

import com.pipewright.orchestrator.config.OrchestratorConfig;
import com.pipewright.orchestrator.config.PipewrightProperties;
import com.pipewright.orchestrator.executor.ExecutionOutcome;
import com.pipewright.orchestrator.executor.ExecutionRequest;
import com.pipewright.orchestrator.executor.StepExecutor;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.*;
import com.pipewright.orchestrator.task.TaskDefinition;
import com.pipewright.orchestrator.task.TaskRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Runs the supervisory agent for one phase and reads back what it decided.
 *
 * The agent runs inside the execution service like any worker, but under an
 * identity flagged {@code is_orchestrator}, which unlocks the decision tools.
 * It records its verdict through {@code set_process_decision} or
 * {@code inject_steps}; once its run has exited, this class looks the verdict
 * up by the invocation's own task id.
 *
 * <p>Supervisor trouble never blocks a run. A missing phase task, a crashed or
 * failed invocation, or a run that recorded nothing all yield a default
 * {@code proceed} and a WARN log line. For {@code post_step} the result is
 * informational only; the caller ignores it.
 *
 * <pre>
 *   pipewright.phase.invocations{phase, outcome="decided|defaulted|failed|reviewed"}
 * </pre>
 */
@Component
public class OrchestratorSupervisor {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorSupervisor.class);

    private final TaskRegistry               tasks;
    private final StepExecutor               executor;
    private final HistoryStore               history;
    private final OrchestratorContextBuilder contextBuilder;
    private final PipewrightProperties       properties;
    private final MeterRegistry              meterRegistry;

    public OrchestratorSupervisor(TaskRegistry tasks,
                                  StepExecutor executor,
                                  HistoryStore history,
                                  OrchestratorContextBuilder contextBuilder,
                                  PipewrightProperties properties,
                                  MeterRegistry meterRegistry) {
        this.tasks          = tasks;
        this.executor       = executor;
        this.history        = history;
        this.contextBuilder = contextBuilder;
        this.properties     = properties;
        this.meterRegistry  = meterRegistry;
    }

    /**
     * Invoke the supervisor for {@code phase} at {@code stepIndex}.
     *
     * @return the recorded decision, or a default {@code proceed} whose
     *         reasoning says why it was defaulted
     */
    public OrchestratorDecision invoke(Phase phase, int stepIndex, ProcessRun run, OrchestratorConfig config) {
        Optional<TaskDefinition> definition = tasks.getByName(phase.taskName());
        if (definition.isEmpty()) {
            log.warn("No task '{}' defined for {} of process {}",
                    phase.taskName(), phase.wireName(), run.getProcessId());
            count(phase, "defaulted");
            return defaulted(phase, stepIndex, null, "task '" + phase.taskName() + "' is not defined");
        }

        String taskId = HexIds.newId();
        MDC.put("taskId", taskId);
        MDC.put("phase", phase.wireName());
        MDC.put("stepIndex", String.valueOf(stepIndex));
        try {
            return runPhase(phase, stepIndex, run, config, definition.get(), taskId);
        } finally {
            MDC.remove("taskId");
            MDC.remove("phase");
            MDC.remove("stepIndex");
        }
    }

    private OrchestratorDecision runPhase(Phase phase, int stepIndex, ProcessRun run,
                                          OrchestratorConfig config, TaskDefinition definition,
                                          String taskId) {
        String engine = firstNonBlank(config.engine(), run.getEngine(), properties.getDefaultEngine());
        String model  = firstNonBlank(config.model(), definition.model());
        String prompt = definition.prompt() + "\n\n" + contextBuilder.supervisorContext(phase, stepIndex, run);

        // The identity row must exist before the agent's first tool call.
        TaskLog identity = new TaskLog(taskId, run.getProcessId(), definition.name(), true);
        identity.setPhase(phase.wireName());
        identity.setStepIndex(stepIndex);
        identity.setEngine(engine);
        identity.setModel(model);
        identity.setPrompt(prompt);
        if (run.getWorktree() != null) {
            identity.setBranch(run.getWorktree().branch());
            identity.setWorkspaceRef(run.getWorktree().workspaceRef());
        }
        history.appendTaskLog(identity);

        log.info("Invoking supervisor {} for step {} of process {}",
                phase.wireName(), stepIndex, run.getProcessId());
        long start = System.currentTimeMillis();
        ExecutionOutcome outcome;
        try {
            outcome = executor.run(new ExecutionRequest(taskId, run.getProcessId(), definition,
                    engine, model, config.image(), run.getWorktree(), prompt, true));
        } catch (RuntimeException e) {
            history.completeTaskLog(taskId, false, -1, null,
                    System.currentTimeMillis() - start, e.getMessage());
            log.warn("Supervisor {} invocation {} crashed: {}", phase.wireName(), taskId, e.getMessage());
            count(phase, "failed");
            return defaulted(phase, stepIndex, taskId, "invocation crashed: " + e.getMessage());
        }
        history.completeTaskLog(taskId, outcome.succeeded(), outcome.exitCode(), outcome.sessionId(),
                System.currentTimeMillis() - start, outcome.succeeded() ? null : failureText(outcome));

        if (!outcome.succeeded()) {
            log.warn("Supervisor {} invocation {} failed: {}", phase.wireName(), taskId, failureText(outcome));
            count(phase, "failed");
            return defaulted(phase, stepIndex, taskId, "invocation failed (" + failureText(outcome) + ")");
        }

        if (phase == Phase.POST_STEP) {
            if (history.loadResult(taskId).isEmpty()) {
                log.warn("Supervisor post_step {} for step {} wrote no review", taskId, stepIndex);
            }
            count(phase, "reviewed");
            return OrchestratorDecision.proceed(phase, stepIndex, "post-step review", taskId);
        }

        Optional<OrchestratorDecision> recorded = history.latestDecisionForTask(taskId)
                .filter(d -> d.phase() == phase && d.stepIndex() == stepIndex);
        if (recorded.isEmpty()) {
            log.warn("Supervisor {} invocation {} recorded no decision for step {}",
                    phase.wireName(), taskId, stepIndex);
            count(phase, "defaulted");
            return defaulted(phase, stepIndex, taskId, "no decision recorded");
        }
        count(phase, "decided");
        log.info("Supervisor {} for step {} decided {}: {}", phase.wireName(), stepIndex,
                recorded.get().decision().wireName(), recorded.get().reasoning());
        return recorded.get();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private OrchestratorDecision defaulted(Phase phase, int stepIndex, String taskId, String why) {
        return OrchestratorDecision.proceed(phase, stepIndex,
                "Supervisor " + phase.wireName() + " " + why + "; defaulting to proceed"
                        + (taskId == null ? "" : " (task " + taskId + ")"),
                taskId);
    }

    private void count(Phase phase, String outcome) {
        meterRegistry.counter("pipewright.phase.invocations",
                "phase", phase.wireName(), "outcome", outcome).increment();
    }

    private static String failureText(ExecutionOutcome outcome) {
        return outcome.error() != null && !outcome.error().isBlank()
                ? outcome.error()
                : "exit code " + outcome.exitCode();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
