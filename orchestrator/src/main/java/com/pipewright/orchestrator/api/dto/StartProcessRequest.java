package com.pipewright.orchestrator.api.dto;

/**
 * Request body for POST /processes.
 *
 * @param process      name of a configured process definition
 * @param parallel     number of independent runs to start; defaults to 1
 * @param workspaceRef executor workspace the run operates in; suffixed per instance when parallel &gt; 1
 */
public record StartProcessRequest(
        String  process,
        String  prompt,
        String  engine,
        String  model,
        Integer parallel,
        String  workspaceRef,
        String  branch
) {}
