package com.purchasingpower.flowinsight.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Prompt template loaded from YAML.
 *
 * <p>Both parts are Mustache templates and are rendered separately, so the
 * system part can go into a system message and the user part into a user message.
 *
 * YAML structure:
 * <pre>
 * name: process-analysis
 * version: 1.0
 * task: analysis
 * systemPrompt: |
 *   You are a business process analyst...
 * userPrompt: |
 *   {{{metricsText}}}
 * </pre>
 *
 * @see com.purchasingpower.flowinsight.service.PromptLibraryService
 */
@JsonIgnoreProperties(ignoreUnknown = true)  // Allow extra fields like "notes" for documentation
public class PromptTemplate {
    private String name;
    private String version;
    /** Model task the prompt is written for, e.g. "analysis" or "clarification". */
    private String task;
    private String systemPrompt;
    private String userPrompt;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public void setUserPrompt(String userPrompt) {
        this.userPrompt = userPrompt;
    }
}
