package com.purchasingpower.flowinsight.agent;

import com.purchasingpower.flowinsight.model.llm.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * A read-only query the model may run while investigating its initial findings.
 *
 * <p>Contract for implementations:
 * <ul>
 *   <li>no side effects, same input gives the same output</li>
 *   <li>missing steps or issues produce an explanatory result, not an exception</li>
 *   <li>output is short plain text the model can quote</li>
 * </ul>
 *
 * <p>Example implementation:
 * <pre>
 * public class StepLookupTool implements InvestigationTool {
 *     public String getName() { return "lookup_step"; }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; arguments, InvestigationContext context) {
 *         String step = (String) arguments.get("step_name");
 *         // read context.getMetrics() and format an answer
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface InvestigationTool {

    /**
     * Unique name the model uses to call this tool (e.g. "validate_root_cause").
     */
    String getName();

    /**
     * Explains to the model what the tool does and when to use it.
     */
    String getDescription();

    /**
     * String parameters, all required.
     */
    List<ToolDefinition.Parameter> getParameters();

    ToolResult execute(Map<String, Object> arguments, InvestigationContext context);

    default ToolDefinition toDefinition() {
        return new ToolDefinition(getName(), getDescription(), getParameters());
    }
}
