package com.pipewright.orchestrator.task;

import java.util.List;
import java.util.Set;

/**
 * Structure for an artifact a task may produce (PRD, ADR, release notes...).
 *
 * @param format one of {@link #FORMATS}
 * @param tags   default tags for artifacts written from this template
 */
public record ArtifactTemplate(
        String       name,
        String       description,
        String       format,
        String       content,
        List<String> tags) {

    public static final Set<String> FORMATS = Set.of("json", "markdown", "xml", "text");

    public ArtifactTemplate {
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (description == null) description = "";
        if (content == null) content = "";
    }
}
