package com.pipewright.orchestrator.engine;

import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.Phase;
import com.pipewright.orchestrator.model.ProcessRun;
import com.pipewright.orchestrator.model.ProcessStep;
import com.pipewright.orchestrator.model.StepResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Orientation text handed to agents along with their task prompt.
 *
 * Workers see where they are in the run and short summaries of what earlier
 * steps wrote; supervisors see which phase and step they are deciding on.
 * None of this feeds back into the state machine's own decisions.
 */
@Component
public class OrchestratorContextBuilder {

    private static final int SUMMARY_LIMIT = 500;

    private final HistoryStore history;

    public OrchestratorContextBuilder(HistoryStore history) {
        this.history = history;
    }

    /**
     * Full prompt for a worker step: status block, step prompt, run prompt.
     */
    public String workerPrompt(ProcessRun run, ProcessStep step, String taskPrompt) {
        List<String> parts = new ArrayList<>();
        parts.add(workerStatus(run));
        if (hasText(taskPrompt))      parts.add(taskPrompt);
        if (hasText(step.prompt()))   parts.add(step.prompt());
        if (hasText(run.getPrompt())) parts.add(run.getPrompt());
        return String.join("\n\n", parts);
    }

    String workerStatus(ProcessRun run) {
        List<String> lines = new ArrayList<>();
        lines.add("You are running as part of a multi-step process.");
        lines.add("Use `load_result` to read what previous steps found and `write_result`"
                + " before finishing to pass your findings on.");
        lines.add("");
        lines.add("## Process: " + run.getSpec().name());
        if (hasText(run.getSpec().description())) lines.add(run.getSpec().description());
        lines.add("");
        lines.add("## Steps:");

        List<ProcessStep> steps = run.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            String status = i < run.getCurrentIndex() ? "[COMPLETED]"
                          : i == run.getCurrentIndex() ? "[CURRENT]"
                          : "[PENDING]";
            lines.add("  " + (i + 1) + ". " + steps.get(i).task() + " " + status);
        }

        List<String> summaries = new ArrayList<>();
        for (StepResult r : run.getResults()) {
            history.loadResult(r.taskId()).ifPresent(stored -> {
                String text = stored.result();
                if (text.length() > SUMMARY_LIMIT) text = text.substring(0, SUMMARY_LIMIT);
                summaries.add("");
                summaries.add("### " + r.taskName() + " (step " + (r.stepIndex() + 1) + "):");
                summaries.add(text);
            });
        }
        if (!summaries.isEmpty()) {
            lines.add("");
            lines.add("## Completed Step Summaries:");
            lines.addAll(summaries);
        }

        if (run.hasNextStep()) {
            lines.add("");
            lines.add("Current step: " + run.currentStep().task());
        }
        return String.join("\n", lines);
    }

    /**
     * Orientation block for a supervisor invocation. For finalize the index
     * is past the end of the step list and the step line is left out.
     */
    public String supervisorContext(Phase phase, int stepIndex, ProcessRun run) {
        int total = run.getSteps().size();
        List<String> lines = new ArrayList<>();
        lines.add("Process: " + run.getSpec().name() + " (" + run.getProcessId() + ")");
        lines.add("Phase: " + phase.wireName() + " for step " + (stepIndex + 1) + " of " + total);
        if (stepIndex < total) {
            ProcessStep step = run.getSteps().get(stepIndex);
            lines.add("Step: " + step.task() + ": " + (step.prompt() == null ? "" : step.prompt()));
        }
        lines.add("Completed steps: " + run.getResults().size() + "/" + total);
        return String.join("\n", lines);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
