package com.pipewright.orchestrator.config;

/**
 * Resolved supervisor settings for one run.
 *
 * @param engine empty when the supervisor should use the run's engine
 * @param model  empty when the phase task's own model applies
 * @param image  container image for supervisor runs, empty for the executor default
 */
public record OrchestratorConfig(
        boolean enabled,
        String  engine,
        String  model,
        int     maxInjections,
        String  image) {

    public static OrchestratorConfig disabled() {
        return new OrchestratorConfig(false, null, null, 0, null);
    }
}
