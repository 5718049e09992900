package com.pipewright.orchestrator.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.orchestrator.model.*;
import com.pipewright.orchestrator.repository.ArtifactRepository;
import com.pipewright.orchestrator.repository.DecisionLogRepository;
import com.pipewright.orchestrator.repository.KnowledgeRepository;
import com.pipewright.orchestrator.repository.ProcessRecordRepository;
import com.pipewright.orchestrator.repository.TaskLogRepository;
import com.pipewright.orchestrator.repository.TaskRefRepository;
import com.pipewright.orchestrator.repository.TaskResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against H2 in PostgreSQL mode with the real Flyway migrations, so the
 * entity mappings are checked against the same schema production uses.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class HistoryStoreTest {

    @Autowired TaskLogRepository          taskLogs;
    @Autowired DecisionLogRepository      decisionLogs;
    @Autowired ProcessRecordRepository    processRecords;
    @Autowired TaskResultRepository       taskResults;
    @Autowired TaskRefRepository          taskRefs;
    @Autowired ArtifactRepository         artifacts;
    @Autowired KnowledgeRepository        knowledge;
    @Autowired PlatformTransactionManager transactionManager;

    HistoryStore history;

    @BeforeEach
    void setUp() {
        history = new HistoryStore(taskLogs, decisionLogs, processRecords, taskResults,
                taskRefs, artifacts, knowledge,
                new ObjectMapper().findAndRegisterModules(), transactionManager);
    }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    @Test
    void appendDecision_invalidShape_isRejectedAndNothingIsWritten() {
        history.appendTaskLog(supervisorLog("sup1", "p1", 0));
        OrchestratorDecision injectWithoutSteps =
                OrchestratorDecision.inject(Phase.PRE_STEP, 0, "more work", List.of(), "sup1");
        OrchestratorDecision abortWithSteps = new OrchestratorDecision(Phase.PRE_STEP, 0,
                DecisionType.ABORT, "stop", List.of(ProcessStep.of("fix-typo")), "sup1", null);

        assertThatThrownBy(() -> history.appendDecision("p1", injectWithoutSteps))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> history.appendDecision("p1", abortWithSteps))
                .isInstanceOf(ValidationException.class);

        assertThat(history.readDecisions("p1")).isEmpty();
    }

    @Test
    void appendDecision_roundTripsInjectedSteps() {
        history.appendTaskLog(supervisorLog("sup1", "p1", 1));

        history.appendDecision("p1", OrchestratorDecision.inject(Phase.PRE_STEP, 1, "typo first",
                List.of(ProcessStep.of("fix-typo", "README only")), "sup1"));

        OrchestratorDecision stored = history.latestDecisionForTask("sup1").orElseThrow();
        assertThat(stored.decision()).isEqualTo(DecisionType.INJECT);
        assertThat(stored.phase()).isEqualTo(Phase.PRE_STEP);
        assertThat(stored.stepIndex()).isEqualTo(1);
        assertThat(stored.injectedSteps()).containsExactly(ProcessStep.of("fix-typo", "README only"));
        assertThat(history.readDecisions("p1")).hasSize(1);
    }

    @Test
    void latestDecisionForTask_returnsTheLastOneRecorded() {
        history.appendTaskLog(supervisorLog("sup1", "p1", 0));
        history.appendDecision("p1", OrchestratorDecision.proceed(Phase.PRE_STEP, 0, "first", "sup1"));
        history.appendDecision("p1", OrchestratorDecision.abort(Phase.PRE_STEP, 0, "changed my mind", "sup1"));

        assertThat(history.latestDecisionForTask("sup1"))
                .get()
                .extracting(OrchestratorDecision::decision)
                .isEqualTo(DecisionType.ABORT);
        assertThat(history.latestDecisionForTask("nobody")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    @Test
    void readProcessState_showsInjectedStepsAtTheirLivePosition() {
        ProcessRun run = new ProcessRun("p2", ProcessSpec.of("demo",
                List.of(ProcessStep.of("analyze"), ProcessStep.of("implement"))),
                WorktreeRef.of("ws-1", "feature/x"), null, null, null, null);
        history.saveRun(run);
        completeWorker("w0", "p2", "analyze", 0, true);
        run.recordResult(new StepResult(0, "analyze", "w0", true, 0, 5));
        run.advance();
        run.insertSteps(1, List.of(ProcessStep.of("fix-typo").injectedAt(1)));
        run.injectionCounts().put(1, 1);
        history.saveRun(run);

        ProcessStateView view = history.readProcessState("p2");

        assertThat(view.processName()).isEqualTo("demo");
        assertThat(view.totalSteps()).isEqualTo(3);
        assertThat(view.currentIndex()).isEqualTo(1);
        assertThat(view.completed()).extracting(c -> c.step().task()).containsExactly("analyze");
        assertThat(view.pending()).extracting(p -> p.step().task()).containsExactly("fix-typo", "implement");
        assertThat(view.pending().get(0).step().originStepIndex()).isEqualTo(1);
    }

    @Test
    void loadSnapshot_takesTheLatestSuccessfulWorkerRowPerIndex() {
        ProcessRun run = new ProcessRun("p3", ProcessSpec.of("demo",
                List.of(ProcessStep.of("analyze"), ProcessStep.of("implement"))),
                null, null, "prompt", "claude", null);
        completeWorker("w0-failed", "p3", "analyze", 0, false);
        completeWorker("w0", "p3", "analyze", 0, true);
        history.appendTaskLog(supervisorLog("sup0", "p3", 0));
        completeWorker("w1-failed", "p3", "implement", 1, false);
        run.recordResult(new StepResult(0, "analyze", "w0", true, 0, 5));
        run.advance();
        run.injectionCounts().put(0, 2);
        run.abort("Step 1 (implement) failed with exit code 1");
        history.saveRun(run);

        RunSnapshot snapshot = history.loadSnapshot("p3");

        assertThat(snapshot.record().getState()).isEqualTo(RunState.ABORTED);
        assertThat(snapshot.record().getEngine()).isEqualTo("claude");
        assertThat(snapshot.results()).extracting(StepResult::taskId).containsExactly("w0");
        assertThat(snapshot.steps()).hasSize(2);
        assertThat(snapshot.injectionCounts()).containsEntry(0, 2);
    }

    @Test
    void readChildren_followsParentLinks() {
        ProcessSpec spec = ProcessSpec.of("demo", List.of(ProcessStep.of("analyze")));
        history.saveRun(new ProcessRun("parent", spec, null, null, null, null, null));
        history.saveRun(new ProcessRun("child1", spec, null, "parent", "more", null, null));
        history.saveRun(new ProcessRun("other", spec, null, null, null, null, null));

        assertThat(history.readChildren("parent"))
                .extracting(ProcessRecord::getProcessId)
                .containsExactly("child1");
    }

    @Test
    void requireProcess_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> history.requireProcess("missing"))
                .isInstanceOf(RecordNotFoundException.class)
                .hasMessageContaining("missing");
    }

    // ------------------------------------------------------------------
    // Task logs and results
    // ------------------------------------------------------------------

    @Test
    void completeTaskLog_keepsTheOrchestratorFlag() {
        history.appendTaskLog(supervisorLog("sup1", "p4", 0));

        history.completeTaskLog("sup1", true, 0, "sess-9", 42, null);

        TaskLog row = history.requireTaskLog("sup1");
        assertThat(row.isOrchestrator()).isTrue();
        assertThat(row.getSuccess()).isTrue();
        assertThat(history.findLatestBySession("sess-9")).get()
                .extracting(TaskLog::getTaskId).isEqualTo("sup1");
    }

    @Test
    void findLatestByBranch_returnsMostRecentInvocation() {
        TaskLog first = new TaskLog("b1", "p5", "analyze", false);
        first.setBranch("feature/y");
        history.appendTaskLog(first);
        TaskLog second = new TaskLog("b2", "p5", "implement", false);
        second.setBranch("feature/y");
        history.appendTaskLog(second);

        assertThat(history.findLatestByBranch("feature/y")).get()
                .extracting(TaskLog::getTaskId).isEqualTo("b2");
        assertThat(history.findLatestByBranch("feature/none")).isEmpty();
    }

    @Test
    void writeResult_isReadableByTaskIdAndByTaskName() {
        completeWorker("w0", "p6", "analyze", 0, true);

        history.writeResult("w0", "Found three call sites", null, List.of("src/Main.java"), List.of("analysis"));

        assertThat(history.loadResult("w0")).get()
                .satisfies(r -> {
                    assertThat(r.result()).isEqualTo("Found three call sites");
                    assertThat(r.summary()).isNull();
                    assertThat(r.keyFiles()).containsExactly("src/Main.java");
                    assertThat(r.tags()).containsExactly("analysis");
                });
        assertThat(history.loadLatestResult("p6", "analyze")).get()
                .extracting(HistoryStore.StoredResult::taskId).isEqualTo("w0");
        assertThat(history.loadLatestResult("p6", "implement")).isEmpty();
    }

    @Test
    void writeResult_forUnknownTask_throwsNotFound() {
        assertThatThrownBy(() -> history.writeResult("ghost", "text", null, null, null))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void writeResult_again_replacesTextAndSummary() {
        completeWorker("w0", "p6", "analyze", 0, true);

        history.writeResult("w0", "first draft", null, null, null);
        history.writeResult("w0", "final text", "two call sites", null, null);

        assertThat(history.loadResult("w0")).get()
                .satisfies(r -> {
                    assertThat(r.result()).isEqualTo("final text");
                    assertThat(r.summary()).isEqualTo("two call sites");
                    assertThat(r.keyFiles()).isEmpty();
                });
    }

    // ------------------------------------------------------------------
    // Commit refs
    // ------------------------------------------------------------------

    @Test
    void addRefs_keepsOrderAndSkipsHashesAlreadyRecorded() {
        completeWorker("w0", "p7", "implement", 0, true);

        history.addRefs("w0", List.of("base01", "c0ffee"));
        history.addRefs("w0", List.of("c0ffee", " ", "beef02"));

        assertThat(history.readRefs("w0")).containsExactly("base01", "c0ffee", "beef02");
    }

    @Test
    void earliestRefForProcess_isTheFirstRefOfTheFirstStepThatReportedOne() {
        completeWorker("w0", "p8", "analyze", 0, true);
        completeWorker("w1", "p8", "implement", 1, true);
        completeWorker("x0", "other", "analyze", 0, true);
        history.addRefs("x0", List.of("unrelated"));
        history.addRefs("w0", List.of("base01"));
        history.addRefs("w1", List.of("base01-after-w0", "c0ffee"));

        assertThat(history.earliestRefForProcess("p8")).contains("base01");
        assertThat(history.earliestRefForProcess("nothing-yet")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Artifacts
    // ------------------------------------------------------------------

    @Test
    void writeArtifact_isListedPerTaskAndPerProcess() {
        completeWorker("w0", "p9", "analyze", 0, true);
        completeWorker("w1", "p9", "implement", 1, true);
        completeWorker("x0", "other", "analyze", 0, true);

        HistoryStore.StoredArtifact prd = history.writeArtifact("w0", "PRD", "# Goals", "markdown", "prd", List.of("product"));
        history.writeArtifact("w1", "ADR-1", "# Decision", "markdown", null, null);
        history.writeArtifact("x0", "Elsewhere", "{}", "json", null, null);

        assertThat(history.findArtifact(prd.id())).get()
                .satisfies(a -> {
                    assertThat(a.content()).isEqualTo("# Goals");
                    assertThat(a.templateName()).isEqualTo("prd");
                    assertThat(a.tags()).containsExactly("product");
                });
        assertThat(history.readArtifactsForTask("w1")).extracting(HistoryStore.StoredArtifact::title)
                .containsExactly("ADR-1");
        assertThat(history.readArtifactsForProcess("p9")).extracting(HistoryStore.StoredArtifact::title)
                .containsExactlyInAnyOrder("PRD", "ADR-1");
    }

    @Test
    void writeArtifact_forUnknownTask_throwsNotFound() {
        assertThatThrownBy(() -> history.writeArtifact("ghost", "t", "c", "text", null, null))
                .isInstanceOf(RecordNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Knowledge
    // ------------------------------------------------------------------

    @Test
    void writeKnowledge_appendsVersionsAndKeepsOlderOnes() {
        history.writeKnowledge("code-style", "tabs", "initial");
        Knowledge second = history.writeKnowledge("code-style", "four spaces", "team switched");
        history.writeKnowledge("other-key", "x", "unrelated");

        assertThat(second.getVersion()).isEqualTo(2);
        assertThat(history.findKnowledge("code-style", null)).get()
                .extracting(Knowledge::getContent).isEqualTo("four spaces");
        assertThat(history.findKnowledge("code-style", 1)).get()
                .extracting(Knowledge::getContent).isEqualTo("tabs");
        assertThat(history.findKnowledge("code-style", 3)).isEmpty();
        assertThat(history.readKnowledgeHistory("code-style"))
                .extracting(Knowledge::getReason)
                .containsExactly("initial", "team switched");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TaskLog supervisorLog(String taskId, String processId, int stepIndex) {
        TaskLog log = new TaskLog(taskId, processId, "orchestrator-pre", true);
        log.setPhase(Phase.PRE_STEP.wireName());
        log.setStepIndex(stepIndex);
        return log;
    }

    private void completeWorker(String taskId, String processId, String taskName, int stepIndex, boolean success) {
        TaskLog log = new TaskLog(taskId, processId, taskName, false);
        log.setStepIndex(stepIndex);
        history.appendTaskLog(log);
        history.completeTaskLog(taskId, success, success ? 0 : 1, null, 5, success ? null : "boom");
    }
}
