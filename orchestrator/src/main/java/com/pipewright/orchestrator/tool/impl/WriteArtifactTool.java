package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.HistoryStore.StoredArtifact;
import com.pipewright.orchestrator.task.ArtifactTemplate;
import com.pipewright.orchestrator.task.ArtifactTemplateCatalog;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Store a document for the caller's task. When a known template is named
 * and no tags are given, the template's default tags are used.
 */
@Component
public class WriteArtifactTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "write_artifact", "1.0.0",
            "write_artifact(title: str, content: str, format: str, template_name: str = None, tags: list[str] = None) -> dict",
            "Store a structured document (PRD, ADR, documentation...) for this task. "
                    + "format is one of json, markdown, xml, text.",
            ToolScope.SHARED);

    private final HistoryStore            history;
    private final ArtifactTemplateCatalog templates;

    public WriteArtifactTool(HistoryStore history, ArtifactTemplateCatalog templates) {
        this.history   = history;
        this.templates = templates;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        Results.requireCaller(ctx);
        String title   = ToolArguments.requireText(args, "title");
        String content = ToolArguments.requireText(args, "content");
        String format  = ToolArguments.requireText(args, "format");
        if (!ArtifactTemplate.FORMATS.contains(format)) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS,
                    "'format' must be one of " + ArtifactTemplate.FORMATS + ", got '" + format + "'");
        }
        String templateName = ToolArguments.optionalText(args, "template_name");
        List<String> tags = ToolArguments.optionalStringList(args, "tags");
        if (tags == null) {
            tags = templates.find(templateName).map(ArtifactTemplate::tags).orElse(List.of());
        }

        StoredArtifact stored = history.writeArtifact(ctx.taskId(), title, content, format, templateName, tags);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("artifact_id", stored.id());
        out.put("task_id", stored.taskId());
        out.put("title", stored.title());
        out.put("format", stored.format());
        return out;
    }
}
