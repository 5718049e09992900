package com.pipewright.orchestrator.task;

public class TaskNotFoundException extends RuntimeException {
    public TaskNotFoundException(String name) {
        super("No task defined with name: '" + name + "'");
    }
}
