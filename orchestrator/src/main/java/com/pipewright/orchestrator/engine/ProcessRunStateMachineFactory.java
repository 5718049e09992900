package com.pipewright.orchestrator.engine;

import com.pipewright.orchestrator.config.OrchestratorConfig;
import com.pipewright.orchestrator.config.OrchestratorConfigResolver;
import com.pipewright.orchestrator.config.PipewrightProperties;
import com.pipewright.orchestrator.executor.StepExecutor;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.ProcessRun;
import com.pipewright.orchestrator.task.TaskRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Builds a state machine for a run, with the supervisor settings resolved
 * from the global defaults and the run's own process overlay.
 */
@Component
public class ProcessRunStateMachineFactory {

    private final OrchestratorConfigResolver configResolver;
    private final OrchestratorSupervisor     supervisor;
    private final StepExecutor               executor;
    private final HistoryStore               history;
    private final TaskRegistry               tasks;
    private final OrchestratorContextBuilder contextBuilder;
    private final PipewrightProperties       properties;
    private final MeterRegistry              meterRegistry;

    public ProcessRunStateMachineFactory(OrchestratorConfigResolver configResolver,
                                         OrchestratorSupervisor supervisor,
                                         StepExecutor executor,
                                         HistoryStore history,
                                         TaskRegistry tasks,
                                         OrchestratorContextBuilder contextBuilder,
                                         PipewrightProperties properties,
                                         MeterRegistry meterRegistry) {
        this.configResolver = configResolver;
        this.supervisor     = supervisor;
        this.executor       = executor;
        this.history        = history;
        this.tasks          = tasks;
        this.contextBuilder = contextBuilder;
        this.properties     = properties;
        this.meterRegistry  = meterRegistry;
    }

    public ProcessRunStateMachine create(ProcessRun run) {
        OrchestratorConfig config = configResolver.resolve(run.getSpec().orchestrator());
        return new ProcessRunStateMachine(run, config, supervisor, executor, history, tasks,
                contextBuilder, properties, meterRegistry);
    }
}
