package com.pipewright.orchestrator.task;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of task definitions by name. Used to validate injected step names
 * and to resolve the supervisor task of each phase.
 */
public interface TaskRegistry {

    Optional<TaskDefinition> getByName(String name);

    /** @throws TaskNotFoundException if no task has this name */
    default TaskDefinition require(String name) {
        return getByName(name).orElseThrow(() -> new TaskNotFoundException(name));
    }

    default boolean contains(String name) {
        return getByName(name).isPresent();
    }

    /** All registered names, sorted. */
    List<String> names();
}
