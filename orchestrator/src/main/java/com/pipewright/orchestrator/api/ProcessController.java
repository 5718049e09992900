package com.pipewright.orchestrator.api;

import com.pipewright.orchestrator.api.dto.ContinueRequest;
import com.pipewright.orchestrator.api.dto.DefinitionsResponse;
import com.pipewright.orchestrator.api.dto.ProcessResponse;
import com.pipewright.orchestrator.api.dto.ResumeRequest;
import com.pipewright.orchestrator.api.dto.StartProcessRequest;
import com.pipewright.orchestrator.api.dto.TaskLogResponse;
import com.pipewright.orchestrator.history.ProcessStateView;
import com.pipewright.orchestrator.model.OrchestratorDecision;
import com.pipewright.orchestrator.model.ResumeKeyKind;
import com.pipewright.orchestrator.model.WorktreeRef;
import com.pipewright.orchestrator.service.ProcessService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for process runs.
 *
 * POST /processes                 : start one or more runs of a configured process
 * GET  /processes/{id}            : run summary
 * GET  /processes/{id}/state      : completed and pending steps plus decisions
 * GET  /processes/{id}/decisions  : supervisor decision history, in order
 * GET  /processes/{id}/tasks      : execution records of the run, oldest first
 * GET  /processes/{id}/children   : runs continued from this one
 * GET  /processes/definitions     : configured process and task names
 * POST /processes/resume          : resume an interrupted run by task id, branch or session id
 * POST /processes/continue        : start a linked child run from an earlier task
 *
 * Runs execute in the background; the POST endpoints answer 202 as soon as
 * the run is persisted and queued.
 */
@RestController
@RequestMapping("/processes")
public class ProcessController {

    private final ProcessService processService;

    public ProcessController(ProcessService processService) {
        this.processService = processService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/processes \
     *     -H "Content-Type: application/json" \
     *     -d '{"process":"implement-and-review","prompt":"Add a --verbose flag","workspaceRef":"ws-1"}'
     */
    @PostMapping
    public ResponseEntity<List<ProcessResponse>> start(@RequestBody StartProcessRequest req) {
        if (req.process() == null || req.process().isBlank()) {
            throw new IllegalArgumentException("'process' is required");
        }
        WorktreeRef worktree = req.workspaceRef() == null && req.branch() == null
                ? null
                : WorktreeRef.of(req.workspaceRef(), req.branch());
        int parallel = req.parallel() == null ? 1 : req.parallel();
        List<ProcessResponse> body = processService
                .start(req.process(), req.prompt(), req.engine(), req.model(), parallel, worktree)
                .stream()
                .map(ProcessResponse::from)
                .toList();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/{id}")
    public ProcessResponse get(@PathVariable String id) {
        return ProcessResponse.from(processService.find(id));
    }

    @GetMapping("/{id}/state")
    public ProcessStateView state(@PathVariable String id) {
        return processService.readState(id);
    }

    @GetMapping("/{id}/decisions")
    public List<OrchestratorDecision> decisions(@PathVariable String id) {
        return processService.readDecisions(id);
    }

    @GetMapping("/{id}/tasks")
    public List<TaskLogResponse> tasks(@PathVariable String id) {
        return processService.readTaskLogs(id).stream()
                .map(t -> TaskLogResponse.from(t, processService.readRefs(t.getTaskId())))
                .toList();
    }

    @GetMapping("/{id}/children")
    public List<ProcessResponse> children(@PathVariable String id) {
        return processService.readChildren(id).stream()
                .map(ProcessResponse::from)
                .toList();
    }

    @GetMapping("/definitions")
    public DefinitionsResponse definitions() {
        return new DefinitionsResponse(processService.processNames(), processService.taskNames());
    }

    @PostMapping("/resume")
    public ResponseEntity<ProcessResponse> resume(@RequestBody ResumeRequest req) {
        if (req.key() == null || req.key().isBlank()) {
            throw new IllegalArgumentException("'key' is required");
        }
        ResumeKeyKind kind = req.kind() == null ? ResumeKeyKind.TASK_ID : ResumeKeyKind.fromWire(req.kind());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ProcessResponse.from(processService.resume(req.key(), kind)));
    }

    @PostMapping("/continue")
    public ResponseEntity<ProcessResponse> continueFrom(@RequestBody ContinueRequest req) {
        if (req.parentTaskId() == null || req.parentTaskId().isBlank()) {
            throw new IllegalArgumentException("'parentTaskId' is required");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ProcessResponse.from(processService.continueFrom(req.parentTaskId(), req.prompt())));
    }
}
