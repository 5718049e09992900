package com.pipewright.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.tool.ToolManifest;
import com.pipewright.orchestrator.tool.ToolScopeGate;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Tool-call protocol used by agents running inside the execution service.
 *
 * GET  /tools         : tools visible to the caller
 * POST /tools/{name}  : call a tool with a JSON object of arguments
 *
 * The caller identifies itself with the task id it was started under, in
 * the X-Pipewright-Task-Id header. A missing header is a worker identity.
 */
@RestController
@RequestMapping("/tools")
public class ToolController {

    static final String TASK_ID_HEADER = "X-Pipewright-Task-Id";

    private final ToolScopeGate gate;

    public ToolController(ToolScopeGate gate) {
        this.gate = gate;
    }

    @GetMapping
    public List<ToolManifest> list(@RequestHeader(value = TASK_ID_HEADER, required = false) String taskId) {
        return gate.listTools(taskId);
    }

    @PostMapping("/{name}")
    public Object call(@RequestHeader(value = TASK_ID_HEADER, required = false) String taskId,
                       @PathVariable String name,
                       @RequestBody(required = false) JsonNode args) {
        return gate.call(taskId, name, args);
    }
}
