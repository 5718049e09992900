package com.pipewright.orchestrator.tool;

import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.ValidationException;
import com.pipewright.orchestrator.model.DecisionType;
import com.pipewright.orchestrator.model.OrchestratorDecision;
import com.pipewright.orchestrator.model.Phase;
import com.pipewright.orchestrator.model.ProcessStep;
import com.pipewright.orchestrator.task.TaskRegistry;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a supervisor's tool call into a persisted decision.
 *
 * Phase and step index are taken from the caller's execution record, never
 * from the payload. The agent only writes the request here; the state
 * machine picks it up after the agent's run has exited.
 *
 * Rules, all checked before anything is written:
 * <ul>
 *   <li>only pre_step and finalize invocations record decisions</li>
 *   <li>inject is only valid in pre_step</li>
 *   <li>every injected task name must exist</li>
 * </ul>
 */
@Component
public class DecisionRecorder {

    private final HistoryStore history;
    private final TaskRegistry tasks;

    public DecisionRecorder(HistoryStore history, TaskRegistry tasks) {
        this.history = history;
        this.tasks   = tasks;
    }

    /**
     * @throws ValidationException if the decision breaks one of the rules above
     *                             or has an invalid shape
     */
    public Map<String, Object> record(ToolCallContext ctx, DecisionType type, String reasoning,
                                      List<ProcessStep> injectedSteps) {
        if (!ctx.resolved() || ctx.phase() == null || ctx.stepIndex() == null) {
            throw new ValidationException("Task '" + ctx.taskId() + "' is not a supervisor phase invocation");
        }
        Phase phase = ctx.phase();
        if (phase == Phase.POST_STEP) {
            throw new ValidationException("post_step reviews cannot record decisions; use write_result");
        }
        if (type == DecisionType.INJECT && phase != Phase.PRE_STEP) {
            throw new ValidationException("inject is only allowed in pre_step, not " + phase.wireName());
        }
        for (ProcessStep step : injectedSteps) {
            if (!tasks.contains(step.task())) {
                throw new ValidationException("Unknown task '" + step.task() + "' in injected steps");
            }
        }

        OrchestratorDecision decision = new OrchestratorDecision(phase, ctx.stepIndex(), type,
                reasoning, injectedSteps, ctx.taskId(), null);
        history.appendDecision(ctx.processId(), decision);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("recorded", true);
        out.put("decision", type.wireName());
        out.put("phase", phase.wireName());
        out.put("step_index", ctx.stepIndex());
        out.put("injected_steps", injectedSteps.size());
        return out;
    }
}
