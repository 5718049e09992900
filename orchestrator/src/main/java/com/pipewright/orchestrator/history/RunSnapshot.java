package com.pipewright.orchestrator.history;

import com.pipewright.orchestrator.model.OrchestratorDecision;
import com.pipewright.orchestrator.model.ProcessRecord;
import com.pipewright.orchestrator.model.ProcessSpec;
import com.pipewright.orchestrator.model.ProcessStep;
import com.pipewright.orchestrator.model.StepResult;

import java.util.List;
import java.util.Map;

/**
 * Everything persisted about one run, decoded. Input to resumption.
 *
 * @param results one successful result per executed index, in index order,
 *                covering {@code [0, record.currentIndex)}
 */
public record RunSnapshot(
        ProcessRecord              record,
        ProcessSpec                spec,
        List<ProcessStep>          steps,
        List<StepResult>           results,
        List<OrchestratorDecision> decisions,
        Map<Integer, Integer>      injectionCounts) {}
