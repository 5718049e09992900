package com.pipewright.orchestrator.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process tool registry.
 *
 * All {@link Tool} beans are collected at startup via constructor injection.
 * The registry does no scope checking of its own; callers go through
 * {@link ToolScopeGate}.
 *
 * Every call is timed and counted:
 * <pre>
 *   pipewright.tool.calls{tool, status="success|invalid_arguments|not_found|execution_error|validation"}
 *   pipewright.tool.duration{tool}
 * </pre>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public ToolRegistry(List<Tool> allTools, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Tool tool : allTools) {
            tools.put(tool.manifest().name(), tool);
            log.info("Registered tool '{}' v{} [{}]",
                    tool.manifest().name(), tool.manifest().version(), tool.manifest().scope());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /** Manifests of all tools, sorted by name. */
    public List<ToolManifest> manifests() {
        return tools.values().stream()
                .map(Tool::manifest)
                .sorted(Comparator.comparing(ToolManifest::name))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    Object execute(Tool tool, JsonNode args, ToolCallContext ctx) {
        String name = tool.manifest().name();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return tool.call(args, ctx);
        } catch (ToolException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (ValidationException e) {
            status = "validation";
            throw e;
        } catch (RuntimeException e) {
            status = "execution_error";
            throw new ToolException(ToolException.Kind.EXECUTION_ERROR,
                    "Unexpected error in tool '" + name + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("pipewright.tool.duration", "tool", name));
            meterRegistry.counter("pipewright.tool.calls", "tool", name, "status", status).increment();
        }
    }
}
