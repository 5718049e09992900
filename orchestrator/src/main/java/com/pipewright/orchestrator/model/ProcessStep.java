package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One unit of delegated work within a process.
 *
 * @param task             task definition name, resolved through the task registry
 * @param engine           engine override for this step only
 * @param model            model override for this step only
 * @param prompt           extra prompt appended to the task's own prompt
 * @param skipOrchestrator when true the step runs without pre/post supervision
 * @param originStepIndex  set only on injected steps: the index that was current
 *                         when the injection was decided
 * @param anchorIndex      position in the process definition of the original step
 *                         this entry belongs to. Injected steps share the anchor of
 *                         the step they were inserted before; the injection budget
 *                         is counted per anchor. Null until the step enters a live queue.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessStep(
        @JsonProperty("task")              String  task,
        @JsonProperty("engine")            String  engine,
        @JsonProperty("model")             String  model,
        @JsonProperty("prompt")            String  prompt,
        @JsonProperty("skip_orchestrator") boolean skipOrchestrator,
        @JsonProperty("origin_step_index") Integer originStepIndex,
        @JsonProperty("anchor_index")      Integer anchorIndex) {

    public ProcessStep(String task, String engine, String model, String prompt,
                       boolean skipOrchestrator, Integer originStepIndex) {
        this(task, engine, model, prompt, skipOrchestrator, originStepIndex, null);
    }

    public static ProcessStep of(String task) {
        return new ProcessStep(task, null, null, null, false, null);
    }

    public static ProcessStep of(String task, String prompt) {
        return new ProcessStep(task, null, null, prompt, false, null);
    }

    /** Copy of this definition step placed in a live queue at its own position. */
    public ProcessStep anchoredAt(int anchor) {
        return new ProcessStep(task, engine, model, prompt, skipOrchestrator, originStepIndex, anchor);
    }

    /**
     * Copy of this step as it is inserted into a live queue. Injected steps are
     * always supervised, whatever the request said, and any anchor in the
     * request is replaced.
     */
    public ProcessStep injectedAt(int originIndex, Integer anchor) {
        return new ProcessStep(task, engine, model, prompt, false, originIndex, anchor);
    }

    public ProcessStep injectedAt(int originIndex) {
        return injectedAt(originIndex, null);
    }

    @JsonIgnore
    public boolean isInjected() {
        return originStepIndex != null;
    }
}
