package com.pipewright.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipewright.orchestrator.executor.dto.CommitLogResponse;
import com.pipewright.orchestrator.executor.dto.DiffResponse;
import com.pipewright.orchestrator.executor.dto.RunTaskRequest;
import com.pipewright.orchestrator.executor.dto.RunTaskResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the task-execution service.
 *
 * The service owns containers, engines and worktrees; the orchestrator only
 * asks it to run a task to completion and to describe a worktree's git state.
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit.
 *
 * Called from the process worker pool, so blocking I/O here is fine. Task
 * runs get no request timeout: a slow run and a stalled one look the same
 * from here, and limits are the service's business.
 */
@Component
public class WorkspaceClient implements StepExecutor, RepositoryInspector {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       toolEndpoint;

    public WorkspaceClient(
            @Value("${pipewright.executor.base-url}") String baseUrl,
            @Value("${pipewright.executor.tool-endpoint:}") String toolEndpoint,
            ObjectMapper objectMapper) {
        this.baseUrl      = baseUrl;
        this.toolEndpoint = toolEndpoint;
        this.json         = objectMapper;
        this.http         = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Task runs
    // ------------------------------------------------------------------

    /**
     * Run a worker step or supervisor phase and wait for it to finish.
     *
     * @throws ExecutorException if the service returns a non-2xx status or is unreachable
     */
    @Override
    public ExecutionOutcome run(ExecutionRequest request) {
        log.info("Running task '{}' as {} (orchestrator={}, engine={})",
                request.task().name(), request.taskId(), request.orchestrator(), request.engine());
        RunTaskRequest body = new RunTaskRequest(
                request.taskId(),
                request.processId(),
                request.task().name(),
                request.engine(),
                request.model(),
                request.image(),
                request.worktree() == null ? null : request.worktree().workspaceRef(),
                request.worktree() == null ? null : request.worktree().branch(),
                request.prompt(),
                request.task().tools(),
                request.orchestrator(),
                toolEndpoint.isBlank() ? null : toolEndpoint);

        String respBody = send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/tasks/run"))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(toJson(body))),
                "run for task " + request.taskId());
        RunTaskResponse resp = fromJson(respBody, RunTaskResponse.class, "run");
        log.info("Task {} finished: exit_code={} in {}s", request.taskId(), resp.exit_code(), resp.elapsed_sec());
        return new ExecutionOutcome(resp.exit_code(), resp.session_id(), resp.error(), refsOf(resp));
    }

    private static List<String> refsOf(RunTaskResponse resp) {
        List<String> refs = new ArrayList<>();
        if (resp.base_ref() != null && !resp.base_ref().isBlank()) refs.add(resp.base_ref());
        if (resp.commits() != null) refs.addAll(resp.commits());
        return refs;
    }

    // ------------------------------------------------------------------
    // Repository inspection
    // ------------------------------------------------------------------

    @Override
    public String diff(String workspaceRef, String sinceRef) {
        String respBody = send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/workspace/" + encode(workspaceRef) + "/diff" + sinceQuery(sinceRef)))
                        .timeout(Duration.ofSeconds(60))
                        .GET(),
                "diff for workspace " + workspaceRef);
        return fromJson(respBody, DiffResponse.class, "diff").diff();
    }

    @Override
    public CommitLogResponse commitLog(String workspaceRef, String sinceRef) {
        String respBody = send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/workspace/" + encode(workspaceRef) + "/log" + sinceQuery(sinceRef)))
                        .timeout(Duration.ofSeconds(60))
                        .GET(),
                "commitLog for workspace " + workspaceRef);
        return fromJson(respBody, CommitLogResponse.class, "commitLog");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** Send and return the body; non-2xx and I/O errors become ExecutorException. */
    private String send(HttpRequest.Builder builder, String opName) {
        try {
            HttpRequest req = builder.header("Accept", "application/json").build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private static String sinceQuery(String sinceRef) {
        return sinceRef == null || sinceRef.isBlank() ? "" : "?since=" + encode(sinceRef);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }

    private <T> T fromJson(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse " + opName + " response", e);
        }
    }
}
