package com.pipewright.orchestrator.config;

import com.pipewright.orchestrator.model.OrchestratorSettings;
import org.springframework.stereotype.Component;

/**
 * Global defaults, then the process-level overlay. Only non-empty overlay
 * values win; a blank string or a missing number leaves the global value.
 *
 * Per-step {@code skip_orchestrator} is not part of this resolution. The
 * state machine checks it on each step.
 */
@Component
public class OrchestratorConfigResolver {

    private final PipewrightProperties properties;

    public OrchestratorConfigResolver(PipewrightProperties properties) {
        this.properties = properties;
    }

    public OrchestratorConfig resolve(OrchestratorSettings overlay) {
        PipewrightProperties.Orchestrator global = properties.getOrchestrator();
        boolean enabled = global.isEnabled();
        String  engine  = global.getEngine();
        String  model   = global.getModel();
        int     max     = global.getMaxInjections();
        String  image   = global.getImage();

        if (overlay != null) {
            if (overlay.enabled() != null)       enabled = overlay.enabled();
            if (hasText(overlay.engine()))       engine  = overlay.engine();
            if (hasText(overlay.model()))        model   = overlay.model();
            if (overlay.maxInjections() != null) max     = overlay.maxInjections();
            if (hasText(overlay.image()))        image   = overlay.image();
        }
        return new OrchestratorConfig(enabled, engine, model, Math.max(0, max), image);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
