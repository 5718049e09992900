package com.pipewright.orchestrator.engine;

import com.pipewright.orchestrator.config.OrchestratorConfig;

import java.util.Map;

/**
 * Caps how many injections an original step may receive within one run.
 *
 * Keys are anchors ({@link com.pipewright.orchestrator.model.ProcessStep#anchorIndex()}),
 * not live positions: every accepted injection shifts the original step to
 * the right, and a position-keyed count would hand it a fresh budget each time.
 *
 * Counts live in the run itself (and are persisted with it), so a resumed
 * run keeps the budget it had already spent.
 */
public class InjectionGuard {

    private final Map<Integer, Integer> counts;

    /** @param counts the run's own mutable anchor map */
    public InjectionGuard(Map<Integer, Integer> counts) {
        this.counts = counts;
    }

    /**
     * Admit one more injection before the original step {@code anchor}.
     *
     * @return false, with no change to the counts, when that step has already
     *         had {@code maxInjections} accepted injections
     */
    public boolean admit(int anchor, OrchestratorConfig config) {
        int current = count(anchor);
        if (current >= config.maxInjections()) {
            return false;
        }
        counts.put(anchor, current + 1);
        return true;
    }

    public int count(int anchor) {
        return counts.getOrDefault(anchor, 0);
    }
}
