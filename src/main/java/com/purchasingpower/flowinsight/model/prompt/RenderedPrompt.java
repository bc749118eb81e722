package com.purchasingpower.flowinsight.model.prompt;

/**
 * System and user text of a rendered template. Either part may be empty.
 */
public record RenderedPrompt(String systemPrompt, String userPrompt) {
}
