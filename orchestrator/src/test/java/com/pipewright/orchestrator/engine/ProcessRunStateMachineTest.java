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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives the state machine against scripted supervisor verdicts and executor
 * outcomes, and checks the exact order of phases and steps.
 *
 * Events are recorded as "pre1", "post1", "finalize" for supervisor phases
 * and "step1:analyze" for worker steps.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ProcessRunStateMachineTest {

    @Mock OrchestratorSupervisor     supervisor;
    @Mock StepExecutor               executor;
    @Mock HistoryStore               history;
    @Mock TaskRegistry               tasks;
    @Mock OrchestratorContextBuilder contextBuilder;

    SimpleMeterRegistry  meterRegistry;
    PipewrightProperties properties;

    final List<String> events = new ArrayList<>();
    final Map<String, Deque<OrchestratorDecision>> scripted = new HashMap<>();
    final Map<String, RuntimeException> supervisorCrashes = new HashMap<>();
    final Set<Integer> failingSteps = new HashSet<>();

    ProcessRun run;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties    = new PipewrightProperties();

        when(tasks.getByName(anyString())).thenAnswer(inv -> Optional.of(
                new TaskDefinition(inv.getArgument(0), "", null, List.of(), "prompt")));
        when(contextBuilder.workerPrompt(any(), any(), any())).thenReturn("worker prompt");

        when(supervisor.invoke(any(), anyInt(), any(), any())).thenAnswer(inv -> {
            Phase phase = inv.getArgument(0);
            int index = inv.getArgument(1);
            String key = label(phase, index);
            events.add(key);
            if (supervisorCrashes.containsKey(key)) {
                throw supervisorCrashes.remove(key);
            }
            Deque<OrchestratorDecision> queue = scripted.get(key);
            if (queue != null && !queue.isEmpty()) {
                return queue.poll();
            }
            return OrchestratorDecision.proceed(phase, index, "ok", "sup-" + key);
        });

        when(executor.run(any())).thenAnswer(inv -> {
            ExecutionRequest req = inv.getArgument(0);
            int index = run.getCurrentIndex();
            events.add("step" + index + ":" + req.task().name());
            return failingSteps.contains(index)
                    ? new ExecutionOutcome(2, "sess-" + index, "boom")
                    : new ExecutionOutcome(0, "sess-" + index, null);
        });
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void threeSteps_allProceed_invokesPhasesInOrderAndCompletes() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"), ProcessStep.of("review"));

        machine(enabled(3)).execute();

        assertThat(events).containsExactly(
                "pre0", "step0:analyze", "post0",
                "pre1", "step1:implement", "post1",
                "pre2", "step2:review", "post2",
                "finalize");
        assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
        assertThat(run.getResults()).hasSize(3);
        assertThat(run.getCurrentIndex()).isEqualTo(3);
        // pre0, pre1, pre2, finalize; post-step results are not decisions
        assertThat(run.getDecisions()).extracting(OrchestratorDecision::phase)
                .containsExactly(Phase.PRE_STEP, Phase.PRE_STEP, Phase.PRE_STEP, Phase.FINALIZE);
    }

    @Test
    void workerTaskLogs_areCreatedBeforeExecutionAndChainedByParent() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"));

        machine(enabled(3)).execute();

        InOrder order = inOrder(history, executor);
        order.verify(history).appendTaskLog(argThat(t -> "analyze".equals(t.getTaskName())));
        order.verify(executor).run(any());
        verify(history, times(2)).completeTaskLog(anyString(), eq(true), eq(0), anyString(), anyLong(), isNull());
        verify(history).appendTaskLog(argThat(t -> "implement".equals(t.getTaskName())
                && run.getResults().get(0).taskId().equals(t.getParentId())
                && !t.isOrchestrator()
                && t.getStepIndex() == 1));
    }

    @Test
    void commitRefsReportedByTheExecutor_areRecordedForTheStep() {
        run = newRun(ProcessStep.of("analyze"));
        doReturn(new ExecutionOutcome(0, "sess-0", null, List.of("a1b2c3", "d4e5f6")))
                .when(executor).run(any());

        machine(enabled(3)).execute();

        verify(history).addRefs(run.getResults().get(0).taskId(), List.of("a1b2c3", "d4e5f6"));
    }

    // ------------------------------------------------------------------
    // Injection
    // ------------------------------------------------------------------

    @Test
    void preStepInject_insertsBeforeCurrentStepAndReevaluatesSameIndex() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"), ProcessStep.of("review"));
        script("pre1", OrchestratorDecision.inject(Phase.PRE_STEP, 1, "typo flagged in review",
                List.of(ProcessStep.of("fix-typo", "fix README typo")), "sup-a"));

        machine(enabled(3)).execute();

        assertThat(events).containsExactly(
                "pre0", "step0:analyze", "post0",
                "pre1",                                   // inject
                "pre1", "step1:fix-typo", "post1",        // injected step, own phases
                "pre2", "step2:implement", "post2",
                "pre3", "step3:review", "post3",
                "finalize");
        ProcessStep injected = run.getSteps().get(1);
        assertThat(injected.task()).isEqualTo("fix-typo");
        assertThat(injected.originStepIndex()).isEqualTo(1);
        assertThat(injected.skipOrchestrator()).isFalse();
        assertThat(run.getSteps()).extracting(ProcessStep::task)
                .containsExactly("analyze", "fix-typo", "implement", "review");
        assertThat(run.injectionCounts()).containsEntry(1, 1);
        assertThat(meterRegistry.counter("pipewright.injections", "outcome", "accepted").count()).isEqualTo(1.0);
        assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
    }

    @Test
    void injectionBeyondLimit_isForcedToProceedWithoutInsertion() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"), ProcessStep.of("review"));
        OrchestratorDecision inject = OrchestratorDecision.inject(Phase.PRE_STEP, 0, "again",
                List.of(ProcessStep.of("fix-typo")), "sup-x");
        script("pre0", inject, inject);

        machine(enabled(1)).execute();

        assertThat(events).containsExactly(
                "pre0",                                   // accepted
                "pre0", "step0:fix-typo", "post0",        // rejected, runs the injected step
                "pre1", "step1:analyze", "post1",
                "pre2", "step2:implement", "post2",
                "pre3", "step3:review", "post3",
                "finalize");
        assertThat(run.getSteps()).hasSize(4);
        assertThat(run.injectionCounts()).containsEntry(0, 1);
        assertThat(run.getDecisions())
                .anySatisfy(d -> {
                    assertThat(d.decision()).isEqualTo(DecisionType.PROCEED);
                    assertThat(d.reasoning()).contains("Injection limit of 1");
                });
        assertThat(meterRegistry.counter("pipewright.injections", "outcome", "rejected").count()).isEqualTo(1.0);
    }

    @Test
    void supervisorThatAlwaysInjectsBeforeTheSameStep_getsOneInjectionPerOriginalStep() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"));
        int[] injectRequests = {0};
        doAnswer(inv -> {
            Phase phase = inv.getArgument(0);
            int index = inv.getArgument(1);
            events.add(label(phase, index));
            // bounded so a regression fails the assertions instead of looping forever
            if (phase == Phase.PRE_STEP && "implement".equals(run.currentStep().task()) && injectRequests[0] < 10) {
                injectRequests[0]++;
                return OrchestratorDecision.inject(phase, index, "implement needs another fix first",
                        List.of(ProcessStep.of("fix-typo")), "sup-" + index);
            }
            return OrchestratorDecision.proceed(phase, index, "ok", "sup-" + index);
        }).when(supervisor).invoke(any(), anyInt(), any(), any());

        machine(enabled(1)).execute();

        assertThat(events).containsExactly(
                "pre0", "step0:analyze", "post0",
                "pre1",                                   // inject before implement, accepted
                "pre1", "step1:fix-typo", "post1",
                "pre2",                                   // inject before implement again, rejected
                "step2:implement", "post2",
                "finalize");
        assertThat(run.getSteps()).extracting(ProcessStep::task)
                .containsExactly("analyze", "fix-typo", "implement");
        assertThat(run.getSteps()).extracting(ProcessStep::anchorIndex).containsExactly(0, 1, 1);
        assertThat(run.injectionCounts()).containsExactly(Map.entry(1, 1));
        assertThat(meterRegistry.counter("pipewright.injections", "outcome", "accepted").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("pipewright.injections", "outcome", "rejected").count()).isEqualTo(1.0);
        assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
    }

    @Test
    void injectedStep_keepsItsOriginTagButSharesTheAnchorOfTheStepItPrecedes() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"));
        ProcessStep requested = new ProcessStep("fix-typo", null, null, null, true, null, 7);
        script("pre1", OrchestratorDecision.inject(Phase.PRE_STEP, 1, "fix first", List.of(requested), "sup-a"));

        machine(enabled(3)).execute();

        ProcessStep injected = run.getSteps().get(1);
        assertThat(injected.originStepIndex()).isEqualTo(1);
        assertThat(injected.anchorIndex()).isEqualTo(1);
        assertThat(injected.skipOrchestrator()).isFalse();
    }

    @Test
    void maxInjectionsZero_neverInserts() {
        run = newRun(ProcessStep.of("analyze"));
        script("pre0", OrchestratorDecision.inject(Phase.PRE_STEP, 0, "try",
                List.of(ProcessStep.of("fix-typo")), "sup-x"));

        machine(enabled(0)).execute();

        assertThat(run.getSteps()).extracting(ProcessStep::task).containsExactly("analyze");
        assertThat(events).containsExactly("pre0", "step0:analyze", "post0", "finalize");
    }

    // ------------------------------------------------------------------
    // Abort and failure
    // ------------------------------------------------------------------

    @Test
    void workerFailure_abortsImmediatelyWithoutFurtherPhases() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"), ProcessStep.of("review"));
        failingSteps.add(1);

        machine(enabled(3)).execute();

        assertThat(events).containsExactly("pre0", "step0:analyze", "post0", "pre1", "step1:implement");
        assertThat(run.getState()).isEqualTo(RunState.ABORTED);
        assertThat(run.getAbortReason()).contains("Step 1").contains("implement").contains("exit code 2");
        assertThat(run.getResults()).hasSize(2);
        assertThat(run.getResults().get(1).success()).isFalse();
        assertThat(run.getCurrentIndex()).isEqualTo(1);
        verify(history, atLeastOnce()).saveRun(run);
        verify(history).completeTaskLog(anyString(), eq(false), eq(2), eq("sess-1"), anyLong(), eq("boom"));
    }

    @Test
    void executorException_isAWorkerFailure() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"));
        doAnswer(inv -> {
            events.add("step" + run.getCurrentIndex());
            throw new ExecutorException("connection refused");
        }).when(executor).run(any());

        machine(enabled(3)).execute();

        assertThat(events).containsExactly("pre0", "step0");
        assertThat(run.getState()).isEqualTo(RunState.ABORTED);
        assertThat(run.getResults().get(0).exitCode()).isNotZero();
    }

    @Test
    void preStepAbort_stopsBeforeTheStep() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"));
        script("pre1", OrchestratorDecision.abort(Phase.PRE_STEP, 1, "analysis says this is unsafe", "sup-y"));

        machine(enabled(3)).execute();

        assertThat(events).containsExactly("pre0", "step0:analyze", "post0", "pre1");
        assertThat(run.getState()).isEqualTo(RunState.ABORTED);
        assertThat(run.getAbortReason()).contains("analysis says this is unsafe");
        verify(executor, times(1)).run(any());
    }

    @Test
    void unknownTask_abortsWithoutCallingExecutor() {
        run = newRun(ProcessStep.of("analyze"));
        when(tasks.getByName("analyze")).thenReturn(Optional.empty());

        machine(enabled(3)).execute();

        assertThat(run.getState()).isEqualTo(RunState.ABORTED);
        assertThat(run.getAbortReason()).contains("unknown task 'analyze'");
        verifyNoInteractions(executor);
    }

    // ------------------------------------------------------------------
    // Supervisor failures are recovered
    // ------------------------------------------------------------------

    @Test
    void crashingPostStep_isIgnoredAndRunContinues() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"));
        supervisorCrashes.put("post0", new IllegalStateException("container crashed"));

        machine(enabled(3)).execute();

        assertThat(events).containsExactly(
                "pre0", "step0:analyze", "post0",
                "pre1", "step1:implement", "post1",
                "finalize");
        assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
    }

    @Test
    void crashingPreStep_defaultsToProceed() {
        run = newRun(ProcessStep.of("analyze"));
        supervisorCrashes.put("pre0", new IllegalStateException("db down"));

        machine(enabled(3)).execute();

        assertThat(events).containsExactly("pre0", "step0:analyze", "post0", "finalize");
        assertThat(run.getDecisions().get(0).reasoning()).contains("defaulting to proceed");
    }

    @Test
    void finalizeAbort_isOnlyAWarning() {
        run = newRun(ProcessStep.of("analyze"));
        script("finalize", OrchestratorDecision.abort(Phase.FINALIZE, 1, "not happy", "sup-f"));

        machine(enabled(3)).execute();

        assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
        assertThat(run.getAbortReason()).isNull();
        assertThat(run.getDecisions()).last()
                .extracting(OrchestratorDecision::decision).isEqualTo(DecisionType.ABORT);
    }

    // ------------------------------------------------------------------
    // Skips and disabled supervisor
    // ------------------------------------------------------------------

    @Test
    void skippedStep_runsWithoutPreOrPost() {
        run = newRun(ProcessStep.of("analyze"),
                new ProcessStep("implement", null, null, null, true, null),
                ProcessStep.of("review"));

        machine(enabled(3)).execute();

        assertThat(events).containsExactly(
                "pre0", "step0:analyze", "post0",
                "step1:implement",
                "pre2", "step2:review", "post2",
                "finalize");
    }

    @Test
    void disabledSupervisor_runsPlainSequenceWithoutFinalize() {
        run = newRun(ProcessStep.of("analyze"), ProcessStep.of("implement"));

        machine(OrchestratorConfig.disabled()).execute();

        assertThat(events).containsExactly("step0:analyze", "step1:implement");
        assertThat(run.getState()).isEqualTo(RunState.COMPLETED);
        verifyNoInteractions(supervisor);
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    @Test
    void restoredRun_continuesAtFirstUnexecutedStep() {
        List<ProcessStep> steps = List.of(ProcessStep.of("analyze"), ProcessStep.of("implement"), ProcessStep.of("review"));
        List<StepResult> done = List.of(
                new StepResult(0, "analyze", "t0", true, 0, 10),
                new StepResult(1, "implement", "t1", true, 0, 10));
        run = ProcessRun.restore("p1", ProcessSpec.of("demo", steps), steps, done,
                WorktreeRef.of("ws", "feature"), List.of(), Map.of(), null, null, null, null);

        machine(enabled(3)).execute();

        assertThat(events).containsExactly("pre2", "step2:review", "post2", "finalize");
        assertThat(run.getResults()).hasSize(3);
    }

    @Test
    void terminalRun_cannotBeExecutedAgain() {
        run = newRun(ProcessStep.of("analyze"));
        ProcessRunStateMachine machine = machine(enabled(3));
        machine.execute();

        assertThatThrownBy(machine::execute).isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ProcessRunStateMachine machine(OrchestratorConfig config) {
        return new ProcessRunStateMachine(run, config, supervisor, executor, history, tasks,
                contextBuilder, properties, meterRegistry);
    }

    private static OrchestratorConfig enabled(int maxInjections) {
        return new OrchestratorConfig(true, null, null, maxInjections, null);
    }

    private static ProcessRun newRun(ProcessStep... steps) {
        return new ProcessRun("p1", ProcessSpec.of("demo", List.of(steps)),
                WorktreeRef.of("ws", "feature"), null, null, null, null);
    }

    private void script(String key, OrchestratorDecision... decisions) {
        scripted.computeIfAbsent(key, k -> new ArrayDeque<>()).addAll(List.of(decisions));
    }

    private static String label(Phase phase, int index) {
        return switch (phase) {
            case PRE_STEP  -> "pre" + index;
            case POST_STEP -> "post" + index;
            case FINALIZE  -> "finalize";
        };
    }
}
