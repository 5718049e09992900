package com.pipewright.orchestrator.executor.dto;

import java.util.List;

/**
 * Body of POST /tasks/run on the execution service.
 * Field names are the service's wire names.
 */
public record RunTaskRequest(
        String       task_id,
        String       process_id,
        String       task_name,
        String       engine,
        String       model,
        String       image,
        String       workspace_ref,
        String       branch,
        String       prompt,
        List<String> tools,
        boolean      is_orchestrator,
        String       tool_endpoint
) {}
