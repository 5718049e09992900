package com.pipewright.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code pipewright.*} in application.yml: worker pool size,
 * the global orchestrator defaults, and the task, process and artifact
 * template catalogs.
 */
@Component
@ConfigurationProperties(prefix = "pipewright")
public class PipewrightProperties {

    private int workerThreads = 4;
    private String defaultEngine = "claude";
    private Orchestrator orchestrator = new Orchestrator();
    private Map<String, Task> tasks = new LinkedHashMap<>();
    private Map<String, Process> processes = new LinkedHashMap<>();
    private Map<String, Template> artifactTemplates = new LinkedHashMap<>();

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public String getDefaultEngine() { return defaultEngine; }
    public void setDefaultEngine(String defaultEngine) { this.defaultEngine = defaultEngine; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Map<String, Task> getTasks() { return tasks; }
    public void setTasks(Map<String, Task> tasks) { this.tasks = tasks; }
    public Map<String, Process> getProcesses() { return processes; }
    public void setProcesses(Map<String, Process> processes) { this.processes = processes; }
    public Map<String, Template> getArtifactTemplates() { return artifactTemplates; }
    public void setArtifactTemplates(Map<String, Template> artifactTemplates) { this.artifactTemplates = artifactTemplates; }

    /** Global supervisor defaults. Empty engine/model/image mean "same as the worker". */
    public static class Orchestrator {
        private boolean enabled = true;
        private String engine;
        private String model;
        private int maxInjections = 3;
        private String image;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getEngine() { return engine; }
        public void setEngine(String engine) { this.engine = engine; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public int getMaxInjections() { return maxInjections; }
        public void setMaxInjections(int maxInjections) { this.maxInjections = maxInjections; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
    }

    public static class Task {
        private String description = "";
        private String model;
        private List<String> tools = new ArrayList<>();
        private String prompt = "";

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools; }
        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }
    }

    public static class Process {
        private String description = "";
        private List<Step> steps = new ArrayList<>();
        // Per-process overlay; unset fields inherit the global values.
        private Overlay orchestrator;

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<Step> getSteps() { return steps; }
        public void setSteps(List<Step> steps) { this.steps = steps; }
        public Overlay getOrchestrator() { return orchestrator; }
        public void setOrchestrator(Overlay orchestrator) { this.orchestrator = orchestrator; }
    }

    public static class Step {
        private String task;
        private String engine;
        private String model;
        private String prompt;
        private boolean skipOrchestrator;

        public String getTask() { return task; }
        public void setTask(String task) { this.task = task; }
        public String getEngine() { return engine; }
        public void setEngine(String engine) { this.engine = engine; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }
        public boolean isSkipOrchestrator() { return skipOrchestrator; }
        public void setSkipOrchestrator(boolean skipOrchestrator) { this.skipOrchestrator = skipOrchestrator; }
    }

    public static class Overlay {
        private Boolean enabled;
        private String engine;
        private String model;
        private Integer maxInjections;
        private String image;

        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }
        public String getEngine() { return engine; }
        public void setEngine(String engine) { this.engine = engine; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Integer getMaxInjections() { return maxInjections; }
        public void setMaxInjections(Integer maxInjections) { this.maxInjections = maxInjections; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
    }

    /** Starting point for an artifact; agents fetch it with load_artifact_template. */
    public static class Template {
        private String description = "";
        private String format = "text";
        private String content = "";
        private List<String> tags = new ArrayList<>();

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }
        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags; }
    }
}
