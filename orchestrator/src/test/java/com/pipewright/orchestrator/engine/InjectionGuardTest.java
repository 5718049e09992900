package com.pipewright.orchestrator.engine;

import com.pipewright.orchestrator.config.OrchestratorConfig;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InjectionGuardTest {

    private static OrchestratorConfig max(int n) {
        return new OrchestratorConfig(true, null, null, n, null);
    }

    @Test
    void admitsUpToTheLimitPerOriginIndex() {
        InjectionGuard guard = new InjectionGuard(new HashMap<>());

        assertThat(guard.admit(0, max(2))).isTrue();
        assertThat(guard.admit(0, max(2))).isTrue();
        assertThat(guard.admit(0, max(2))).isFalse();
        assertThat(guard.admit(0, max(2))).isFalse();
        assertThat(guard.count(0)).isEqualTo(2);
    }

    @Test
    void rejectionDoesNotChangeTheCount() {
        Map<Integer, Integer> counts = new HashMap<>(Map.of(3, 1));
        InjectionGuard guard = new InjectionGuard(counts);

        assertThat(guard.admit(3, max(1))).isFalse();
        assertThat(counts).containsExactly(Map.entry(3, 1));
    }

    @Test
    void indicesAreCountedIndependently() {
        InjectionGuard guard = new InjectionGuard(new HashMap<>());

        assertThat(guard.admit(0, max(1))).isTrue();
        assertThat(guard.admit(1, max(1))).isTrue();
        assertThat(guard.admit(0, max(1))).isFalse();
        assertThat(guard.count(1)).isEqualTo(1);
        assertThat(guard.count(7)).isZero();
    }

    @Test
    void zeroLimitRejectsEverything() {
        InjectionGuard guard = new InjectionGuard(new HashMap<>());

        assertThat(guard.admit(0, max(0))).isFalse();
        assertThat(guard.count(0)).isZero();
    }

    @Test
    void countsArePersistedInTheBackingMap() {
        // A resumed run hands its restored counts back in; the budget carries over.
        Map<Integer, Integer> restored = new HashMap<>(Map.of(0, 2));
        InjectionGuard guard = new InjectionGuard(restored);

        assertThat(guard.admit(0, max(3))).isTrue();
        assertThat(guard.admit(0, max(3))).isFalse();
        assertThat(restored).containsEntry(0, 3);
    }
}
