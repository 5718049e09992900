package com.pipewright.orchestrator.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.model.ProcessStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument extraction shared by the tool implementations. Missing or
 * mistyped arguments become {@link ToolException.Kind#INVALID_ARGUMENTS}.
 */
public final class ToolArguments {

    private ToolArguments() {}

    public static String requireText(JsonNode args, String field) {
        String value = optionalText(args, field);
        if (value == null || value.isBlank()) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "'" + field + "' is required");
        }
        return value;
    }

    public static String optionalText(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isTextual()) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "'" + field + "' must be a string");
        }
        return node.asText();
    }

    public static Integer optionalInt(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "'" + field + "' must be an integer");
        }
        return node.asInt();
    }

    /** Null when absent, so callers can tell "not given" from "empty". */
    public static List<String> optionalStringList(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return null;
        if (!node.isArray()) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "'" + field + "' must be a list of strings");
        }
        List<String> values = new ArrayList<>();
        node.forEach(n -> values.add(n.asText()));
        return values;
    }

    /**
     * Steps given as {@code [{task_name, prompt?, engine?, model?}]}; {@code task}
     * is accepted as an alias of {@code task_name}. Never null.
     */
    public static List<ProcessStep> steps(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "'" + field + "' must be a list of steps");
        }
        List<ProcessStep> steps = new ArrayList<>();
        for (JsonNode s : node) {
            if (!s.isObject()) {
                throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "each entry of '" + field + "' must be an object");
            }
            String task = optionalText(s, "task_name");
            if (task == null) task = optionalText(s, "task");
            if (task == null || task.isBlank()) {
                throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "each step needs a 'task_name'");
            }
            steps.add(new ProcessStep(task, optionalText(s, "engine"), optionalText(s, "model"),
                    optionalText(s, "prompt"), false, null));
        }
        return steps;
    }
}
