package com.pipewright.orchestrator.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.orchestrator.history.ProcessStateView.CompletedStep;
import com.pipewright.orchestrator.history.ProcessStateView.PendingStep;
import com.pipewright.orchestrator.model.*;
import com.pipewright.orchestrator.repository.ArtifactRepository;
import com.pipewright.orchestrator.repository.DecisionLogRepository;
import com.pipewright.orchestrator.repository.KnowledgeRepository;
import com.pipewright.orchestrator.repository.ProcessRecordRepository;
import com.pipewright.orchestrator.repository.TaskLogRepository;
import com.pipewright.orchestrator.repository.TaskRefRepository;
import com.pipewright.orchestrator.repository.TaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Durable history of runs, invocations, decisions and results.
 *
 * Everything above this class reads and writes through it; nothing else
 * touches the repositories directly.
 *
 * <p>Write ordering: many runs write concurrently, but writes for a single
 * {@code process_id} are serialised. Each write takes the lock stripe of
 * that process, then opens a transaction; the lock is released only after
 * commit, so two writers of the same run never interleave inside the
 * database. Stripes are fixed, so the lock table does not grow with the
 * number of runs; two runs that share a stripe simply wait for each other.
 *
 * <p>Decisions are validated before the transaction starts. A decision with
 * an invalid shape never reaches the table.
 */
@Service
public class HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    private static final TypeReference<List<ProcessStep>>     STEP_LIST   = new TypeReference<>() {};
    private static final TypeReference<List<String>>          STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<Integer, Integer>> COUNTS      = new TypeReference<>() {};

    static final int LOCK_STRIPES = 64;

    private final TaskLogRepository       taskLogs;
    private final DecisionLogRepository   decisionLogs;
    private final ProcessRecordRepository processRecords;
    private final TaskResultRepository    taskResults;
    private final TaskRefRepository       taskRefs;
    private final ArtifactRepository      artifacts;
    private final KnowledgeRepository     knowledge;
    private final ObjectMapper            json;
    private final TransactionTemplate     tx;

    private final ReentrantLock[] lockStripes = new ReentrantLock[LOCK_STRIPES];

    public HistoryStore(TaskLogRepository taskLogs,
                        DecisionLogRepository decisionLogs,
                        ProcessRecordRepository processRecords,
                        TaskResultRepository taskResults,
                        TaskRefRepository taskRefs,
                        ArtifactRepository artifacts,
                        KnowledgeRepository knowledge,
                        ObjectMapper objectMapper,
                        PlatformTransactionManager transactionManager) {
        this.taskLogs       = taskLogs;
        this.decisionLogs   = decisionLogs;
        this.processRecords = processRecords;
        this.taskResults    = taskResults;
        this.taskRefs       = taskRefs;
        this.artifacts      = artifacts;
        this.knowledge      = knowledge;
        this.json           = objectMapper;
        this.tx             = new TransactionTemplate(transactionManager);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            lockStripes[i] = new ReentrantLock();
        }
    }

    // ------------------------------------------------------------------
    // Task logs (identity records)
    // ------------------------------------------------------------------

    public TaskLog appendTaskLog(TaskLog taskLog) {
        return withProcessLock(taskLog.getProcessId(), () -> taskLogs.save(taskLog));
    }

    /**
     * Record how an invocation ended. The identity columns of the row are
     * left untouched.
     */
    public TaskLog completeTaskLog(String taskId, boolean success, int exitCode,
                                   String sessionId, long durationMs, String errorMessage) {
        TaskLog existing = requireTaskLog(taskId);
        return withProcessLock(existing.getProcessId(), () -> {
            TaskLog row = requireTaskLog(taskId);
            row.complete(success, exitCode, sessionId, durationMs, errorMessage);
            return taskLogs.save(row);
        });
    }

    public Optional<TaskLog> findTaskLog(String taskId) {
        if (taskId == null || taskId.isBlank()) return Optional.empty();
        return taskLogs.findById(taskId);
    }

    public TaskLog requireTaskLog(String taskId) {
        return findTaskLog(taskId).orElseThrow(() -> new RecordNotFoundException("Task", taskId));
    }

    public Optional<TaskLog> findLatestByBranch(String branch) {
        return taskLogs.findFirstByBranchOrderByCreatedAtDesc(branch);
    }

    public Optional<TaskLog> findLatestBySession(String sessionId) {
        return taskLogs.findFirstBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    public List<TaskLog> readTaskLogs(String processId) {
        return taskLogs.findByProcessIdOrderByCreatedAtAsc(processId);
    }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    /**
     * Append a decision to the audit trail of a process.
     *
     * @throws ValidationException if the decision/injected-steps combination
     *                             is not one of the valid shapes; nothing is written
     */
    public OrchestratorDecision appendDecision(String processId, OrchestratorDecision decision) {
        if (!decision.hasValidShape()) {
            throw new ValidationException("Invalid decision for process " + processId
                    + ": decision=" + (decision.decision() == null ? null : decision.decision().wireName())
                    + " with " + decision.injectedSteps().size() + " injected step(s)");
        }
        if (decision.taskId() == null) {
            throw new ValidationException("Decision for process " + processId + " has no task id");
        }
        String injected = decision.injectedSteps().isEmpty() ? null : toJson(decision.injectedSteps());
        DecisionLog row = new DecisionLog(processId, decision.taskId(),
                decision.phase().wireName(), decision.stepIndex(),
                decision.decision().wireName(), decision.reasoning(), injected, decision.createdAt());

        withProcessLock(processId, () -> decisionLogs.save(row));
        log.info("Recorded {} decision at {} step {} for process {}",
                decision.decision().wireName(), decision.phase().wireName(),
                decision.stepIndex(), processId);
        return decision;
    }

    /** Decisions of one process, in the order they were recorded. */
    public List<OrchestratorDecision> readDecisions(String processId) {
        return decisionLogs.findByProcessIdOrderByIdAsc(processId).stream()
                .map(this::toDecision)
                .toList();
    }

    /** The last decision a given supervisor invocation recorded, if any. */
    public Optional<OrchestratorDecision> latestDecisionForTask(String taskId) {
        return decisionLogs.findFirstByTaskIdOrderByIdDesc(taskId).map(this::toDecision);
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /**
     * Write the current snapshot of a run: live steps, index, state,
     * injection counts. Creates the row on first save.
     */
    public void saveRun(ProcessRun run) {
        withProcessLock(run.getProcessId(), () -> {
            ProcessRecord row = processRecords.findById(run.getProcessId())
                    .orElseGet(() -> newRecord(run));
            row.setStepsJson(toJson(run.getSteps()));
            row.setCurrentIndex(run.getCurrentIndex());
            row.setState(run.getState());
            row.setAbortReason(run.getAbortReason());
            row.setInjectionCounts(toJson(run.injectionCounts()));
            return processRecords.save(row);
        });
    }

    private ProcessRecord newRecord(ProcessRun run) {
        ProcessRecord row = new ProcessRecord(run.getProcessId(), run.getSpec().name(),
                toJson(run.getSpec()), run.getParentProcessId());
        row.setWorktree(run.getWorktree());
        row.setPrompt(run.getPrompt());
        row.setEngine(run.getEngine());
        row.setModel(run.getModel());
        return row;
    }

    public Optional<ProcessRecord> findProcess(String processId) {
        return processRecords.findById(processId);
    }

    public ProcessRecord requireProcess(String processId) {
        return findProcess(processId).orElseThrow(() -> new RecordNotFoundException("Process", processId));
    }

    /** Runs started through continue-from with this run as parent, oldest first. */
    public List<ProcessRecord> readChildren(String processId) {
        return processRecords.findByParentProcessIdOrderByCreatedAtAsc(processId);
    }

    /**
     * Decode everything needed to rebuild a run. Results are taken from the
     * worker task logs: for every index below the persisted current index,
     * the latest successful invocation at that index.
     */
    public RunSnapshot loadSnapshot(String processId) {
        ProcessRecord row = requireProcess(processId);
        List<ProcessStep> steps = readSteps(row);
        List<StepResult> results = readStepResults(processId, row.getCurrentIndex());
        Map<Integer, Integer> counts = row.getInjectionCounts() == null
                ? Map.of()
                : fromJson(row.getInjectionCounts(), COUNTS);
        return new RunSnapshot(row, fromJson(row.getSpecJson(), ProcessSpec.class), steps,
                results, readDecisions(processId), counts);
    }

    /**
     * The state-query read model. Steps are taken from the live list, so
     * injected steps appear at the position they execute.
     */
    public ProcessStateView readProcessState(String processId) {
        ProcessRecord row = requireProcess(processId);
        List<ProcessStep> steps = readSteps(row);
        int current = row.getCurrentIndex();
        List<StepResult> results = readStepResults(processId, current);

        List<CompletedStep> completed = new ArrayList<>();
        for (StepResult r : results) {
            completed.add(new CompletedStep(r.stepIndex(), steps.get(r.stepIndex()), r));
        }
        List<PendingStep> pending = new ArrayList<>();
        for (int i = current; i < steps.size(); i++) {
            pending.add(new PendingStep(i, steps.get(i)));
        }
        return new ProcessStateView(processId, row.getProcessName(), row.getState(), current,
                steps.size(), completed, pending, readDecisions(processId));
    }

    List<StepResult> readStepResults(String processId, int upTo) {
        Map<Integer, StepResult> byIndex = new TreeMap<>();
        for (TaskLog t : taskLogs.findByProcessIdAndOrchestratorFalseOrderByCreatedAtAsc(processId)) {
            Integer idx = t.getStepIndex();
            if (idx == null || idx >= upTo || !Boolean.TRUE.equals(t.getSuccess())) continue;
            // later rows win: a resumed run may have re-executed an index
            byIndex.put(idx, new StepResult(idx, t.getTaskName(), t.getTaskId(), true,
                    t.getExitCode() == null ? 0 : t.getExitCode(),
                    t.getDurationMs() == null ? 0L : t.getDurationMs()));
        }
        return new ArrayList<>(byIndex.values());
    }

    private List<ProcessStep> readSteps(ProcessRecord row) {
        if (row.getStepsJson() == null) {
            return fromJson(row.getSpecJson(), ProcessSpec.class).steps();
        }
        return fromJson(row.getStepsJson(), STEP_LIST);
    }

    // ------------------------------------------------------------------
    // Task results
    // ------------------------------------------------------------------

    /**
     * Store the result of a task, replacing any earlier one.
     *
     * @param summary short form served by {@code read_result_summary}; may be null
     */
    public void writeResult(String taskId, String text, String summary,
                            List<String> keyFiles, List<String> tags) {
        TaskLog owner = requireTaskLog(taskId);
        TaskResult row = new TaskResult(taskId, text, summary,
                keyFiles == null ? null : toJson(keyFiles),
                tags == null ? null : toJson(tags));
        withProcessLock(owner.getProcessId(), () -> taskResults.save(row));
    }

    public Optional<StoredResult> loadResult(String taskId) {
        return taskResults.findById(taskId).map(this::toStoredResult);
    }

    /** Latest result written by a task of this name within one process. */
    public Optional<StoredResult> loadLatestResult(String processId, String taskName) {
        return taskResults.findLatestByTaskName(processId, taskName, PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .map(this::toStoredResult);
    }

    /** @param summary null when the task stored no summary */
    public record StoredResult(String taskId, String result, String summary,
                               List<String> keyFiles, List<String> tags) {}

    private StoredResult toStoredResult(TaskResult r) {
        return new StoredResult(r.getTaskId(), r.getResultText(), r.getSummaryText(),
                stringList(r.getKeyFiles()), stringList(r.getTags()));
    }

    // ------------------------------------------------------------------
    // Commit refs
    // ------------------------------------------------------------------

    /** Record commits for a task, in order. Hashes it already has are skipped. */
    public void addRefs(String taskId, List<String> commitHashes) {
        if (commitHashes == null || commitHashes.isEmpty()) return;
        TaskLog owner = requireTaskLog(taskId);
        withProcessLock(owner.getProcessId(), () -> {
            for (String hash : commitHashes) {
                if (hash == null || hash.isBlank() || taskRefs.existsByTaskIdAndCommitHash(taskId, hash)) continue;
                taskRefs.save(new TaskRef(taskId, hash));
            }
            return null;
        });
    }

    public List<String> readRefs(String taskId) {
        return taskRefs.findByTaskIdOrderByIdAsc(taskId).stream()
                .map(TaskRef::getCommitHash)
                .toList();
    }

    /** First ref recorded by any task of the process: where the run started. */
    public Optional<String> earliestRefForProcess(String processId) {
        return taskRefs.findEarliestForProcess(processId, PageRequest.of(0, 1)).stream()
                .findFirst()
                .map(TaskRef::getCommitHash);
    }

    // ------------------------------------------------------------------
    // Artifacts
    // ------------------------------------------------------------------

    public StoredArtifact writeArtifact(String taskId, String title, String content, String format,
                                        String templateName, List<String> tags) {
        TaskLog owner = requireTaskLog(taskId);
        Artifact row = new Artifact(HexIds.newId(), taskId, title, content, format, templateName,
                toJson(tags == null ? List.of() : tags));
        Artifact saved = withProcessLock(owner.getProcessId(), () -> artifacts.save(row));
        log.info("Stored {} artifact '{}' ({}) for task {}", format, title, saved.getId(), taskId);
        return toStoredArtifact(saved);
    }

    public Optional<StoredArtifact> findArtifact(String artifactId) {
        return artifacts.findById(artifactId).map(this::toStoredArtifact);
    }

    public List<StoredArtifact> readArtifactsForTask(String taskId) {
        return artifacts.findByTaskIdOrderByCreatedAtAsc(taskId).stream().map(this::toStoredArtifact).toList();
    }

    public List<StoredArtifact> readArtifactsForProcess(String processId) {
        return artifacts.findByProcessId(processId).stream().map(this::toStoredArtifact).toList();
    }

    public record StoredArtifact(String id, String taskId, String title, String content, String format,
                                 String templateName, List<String> tags, Instant createdAt) {}

    private StoredArtifact toStoredArtifact(Artifact a) {
        return new StoredArtifact(a.getId(), a.getTaskId(), a.getTitle(), a.getContent(), a.getFormat(),
                a.getTemplateName(), stringList(a.getTags()), a.getCreatedAt());
    }

    // ------------------------------------------------------------------
    // Knowledge
    // ------------------------------------------------------------------

    /** Append the next version under {@code key}; the first write is version 1. */
    public Knowledge writeKnowledge(String key, String content, String reason) {
        Knowledge saved = withLock("knowledge:" + key, () -> {
            int next = knowledge.findFirstByKnowledgeKeyOrderByVersionDesc(key)
                    .map(k -> k.getVersion() + 1)
                    .orElse(1);
            return knowledge.save(new Knowledge(key, next, content, reason));
        });
        log.info("Knowledge '{}' now at version {}: {}", key, saved.getVersion(), reason);
        return saved;
    }

    /** Latest version when {@code version} is null. */
    public Optional<Knowledge> findKnowledge(String key, Integer version) {
        return version == null
                ? knowledge.findFirstByKnowledgeKeyOrderByVersionDesc(key)
                : knowledge.findByKnowledgeKeyAndVersion(key, version);
    }

    public List<Knowledge> readKnowledgeHistory(String key) {
        return knowledge.findByKnowledgeKeyOrderByVersionAsc(key);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private <T> T withProcessLock(String processId, Supplier<T> work) {
        return withLock(processId, work);
    }

    private <T> T withLock(String key, Supplier<T> work) {
        ReentrantLock lock = lockStripes[stripeOf(key)];
        lock.lock();
        try {
            return tx.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    static int stripeOf(String key) {
        return Math.floorMod(key == null ? 0 : key.hashCode(), LOCK_STRIPES);
    }

    private List<String> stringList(String value) {
        return value == null ? List.of() : fromJson(value, STRING_LIST);
    }

    private OrchestratorDecision toDecision(DecisionLog row) {
        List<ProcessStep> injected = row.getInjectedSteps() == null
                ? List.of()
                : fromJson(row.getInjectedSteps(), STEP_LIST);
        return new OrchestratorDecision(Phase.fromWire(row.getPhase()), row.getStepIndex(),
                DecisionType.fromWire(row.getDecision()), row.getReasoning(), injected,
                row.getTaskId(), row.getCreatedAt());
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    private <T> T fromJson(String value, Class<T> type) {
        try {
            return json.readValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " JSON in history", e);
        }
    }

    private <T> T fromJson(String value, TypeReference<T> type) {
        try {
            return json.readValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON in history", e);
        }
    }
}
