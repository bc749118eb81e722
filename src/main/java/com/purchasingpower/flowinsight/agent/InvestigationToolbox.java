package com.purchasingpower.flowinsight.agent;

import com.purchasingpower.flowinsight.model.llm.ToolDefinition;
import com.purchasingpower.flowinsight.workflow.state.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registry of the investigation tools offered to the model.
 * Spring injects every {@link InvestigationTool} bean.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvestigationToolbox {

    private final List<InvestigationTool> tools;

    public List<ToolDefinition> definitions() {
        return tools.stream()
                .map(InvestigationTool::toDefinition)
                .collect(Collectors.toList());
    }

    /**
     * Runs one tool call and returns the text for the model. Never throws:
     * unknown tools and tool failures come back as explanatory text.
     */
    public String execute(ToolCall call, InvestigationContext context) {
        Map<String, Object> arguments = call.getArguments() == null ? Map.of() : call.getArguments();
        for (InvestigationTool tool : tools) {
            if (tool.getName().equals(call.getName())) {
                try {
                    ToolResult result = tool.execute(arguments, context);
                    if (!result.isSuccess()) {
                        log.debug("Tool {} returned no match: {}", call.getName(), result.getOutput());
                    }
                    return result.getOutput();
                } catch (RuntimeException e) {
                    log.error("Tool {} failed", call.getName(), e);
                    return "Tool execution failed: " + e.getMessage();
                }
            }
        }
        String validTools = tools.stream().map(InvestigationTool::getName).collect(Collectors.joining(", "));
        log.warn("Unknown tool '{}'. Valid tools: {}", call.getName(), validTools);
        return "Tool '" + call.getName() + "' does not exist. Valid tools: " + validTools;
    }
}
