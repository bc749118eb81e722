package com.purchasingpower.flowinsight.workflow.agents;

import com.purchasingpower.flowinsight.agent.InvestigationContext;
import com.purchasingpower.flowinsight.agent.InvestigationToolbox;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.workflow.AnalysisStage;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import com.purchasingpower.flowinsight.workflow.state.ChatMessage;
import com.purchasingpower.flowinsight.workflow.state.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the tool calls of the last assistant message.
 * Results are appended in the order the calls were issued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolExecutionAgent implements AnalysisStage {

    private final InvestigationToolbox toolbox;
    private final AnalysisConfig config;

    @Override
    public AnalysisPhase phase() {
        return AnalysisPhase.TOOL_EXEC;
    }

    @Override
    public AgentState execute(AgentState state) {
        List<ToolCall> calls = state.lastMessage()
                .filter(ChatMessage::hasToolCalls)
                .map(ChatMessage::getToolCalls)
                .orElse(List.of());

        InvestigationContext context = InvestigationContext.builder()
                .metrics(state.getMetrics())
                .insight(state.getInsight())
                .constraints(state.getConstraints())
                .build();

        List<ChatMessage> results = new ArrayList<>(calls.size());
        List<String> findings = new ArrayList<>(state.getToolFindings());
        List<String> names = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            String output = toolbox.execute(call, context);
            results.add(ChatMessage.toolResult(call, output));
            findings.add("[" + call.getName() + "] " + output);
            names.add(call.getName());
        }

        return state.toBuilder()
                .toolFindings(List.copyOf(findings))
                .build()
                .withMessages(results)
                .withTrace("Executed " + calls.size() + " tool call(s): " + String.join(", ", names),
                        config.getMaxTraceEntries());
    }
}
