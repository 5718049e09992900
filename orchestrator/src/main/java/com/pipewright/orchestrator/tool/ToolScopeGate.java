package com.pipewright.orchestrator.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.Phase;
import com.pipewright.orchestrator.model.TaskLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Capability boundary between worker and supervisor agents.
 *
 * Two independent layers, both keyed by the caller's task id:
 * <ol>
 *   <li>Listing: a worker identity only ever sees {@link ToolScope#SHARED}
 *       tools.</li>
 *   <li>Invocation: every call re-reads {@code is_orchestrator} from the
 *       execution record and refuses orchestrator tools to anyone else,
 *       whatever listing the caller may hold.</li>
 * </ol>
 * Nothing is cached between requests. An unknown or blank task id resolves
 * to a non-orchestrator identity.
 */
@Component
public class ToolScopeGate {

    private static final Logger log = LoggerFactory.getLogger(ToolScopeGate.class);

    private final ToolRegistry registry;
    private final HistoryStore history;

    public ToolScopeGate(ToolRegistry registry, HistoryStore history) {
        this.registry = registry;
        this.history  = history;
    }

    public List<ToolManifest> listTools(String taskId) {
        ToolCallContext ctx = resolve(taskId);
        return registry.manifests().stream()
                .filter(m -> ctx.orchestrator() || m.scope() == ToolScope.SHARED)
                .toList();
    }

    /**
     * @throws ToolScopeViolationException if a non-orchestrator calls an orchestrator tool
     * @throws ToolException               if the tool does not exist or fails
     */
    public Object call(String taskId, String toolName, JsonNode args) {
        Tool tool = registry.find(toolName)
                .orElseThrow(() -> new ToolException(ToolException.Kind.NOT_FOUND, "Unknown tool '" + toolName + "'"));
        ToolCallContext ctx = resolve(taskId);

        MDC.put("taskId", String.valueOf(taskId));
        try {
            if (tool.manifest().scope() == ToolScope.ORCHESTRATOR && !ctx.orchestrator()) {
                log.warn("Scope violation: task '{}' called orchestrator tool '{}'", taskId, toolName);
                throw new ToolScopeViolationException(taskId, toolName);
            }
            JsonNode safeArgs = args == null || args.isNull() ? JsonNodeFactory.instance.objectNode() : args;
            return registry.execute(tool, safeArgs, ctx);
        } finally {
            MDC.remove("taskId");
        }
    }

    ToolCallContext resolve(String taskId) {
        return history.findTaskLog(taskId)
                .map(ToolScopeGate::toContext)
                .orElseGet(() -> ToolCallContext.unresolved(taskId));
    }

    private static ToolCallContext toContext(TaskLog t) {
        Phase phase = t.getPhase() == null ? null : Phase.fromWire(t.getPhase());
        return new ToolCallContext(t.getTaskId(), t.getProcessId(), phase, t.getStepIndex(), t.isOrchestrator());
    }
}
