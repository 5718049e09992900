package com.pipewright.orchestrator.tool;

/** Who may see and call a tool. */
public enum ToolScope {
    SHARED,         // workers and supervisors
    ORCHESTRATOR    // supervisor identities only
}
