package com.purchasingpower.flowinsight.workflow.agents;

import com.purchasingpower.flowinsight.agent.InvestigationToolbox;
import com.purchasingpower.flowinsight.client.ModelGateway;
import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.exception.ModelTransientException;
import com.purchasingpower.flowinsight.model.llm.ModelRequest;
import com.purchasingpower.flowinsight.model.llm.ModelTurn;
import com.purchasingpower.flowinsight.service.ProcessInsightService;
import com.purchasingpower.flowinsight.workflow.AnalysisStage;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import com.purchasingpower.flowinsight.workflow.state.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One model turn of the investigation loop, with tool calling enabled.
 *
 * <p>The cycle counter goes up only when the model asks for tools. A transient
 * model failure ends the investigation; the insight from the initial analysis
 * is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvestigationAgent implements AnalysisStage {

    private final ModelGateway modelGateway;
    private final InvestigationToolbox toolbox;
    private final AnalysisConfig config;

    @Override
    public AnalysisPhase phase() {
        return AnalysisPhase.INVESTIGATE;
    }

    @Override
    public AgentState execute(AgentState state) {
        ModelRequest request = ModelRequest.builder()
                .task(ProcessInsightService.TASK_ANALYSIS)
                .analysisMode(state.getAnalysisMode())
                .provider(state.getLlmProvider())
                .messages(state.getMessages())
                .build();

        if (!modelGateway.supportsToolCalling(request)) {
            log.info("Tool calling not supported by the configured model, skipping investigation");
            return state.withTrace("Investigation skipped: model does not support tool calling",
                    config.getMaxTraceEntries());
        }

        ModelTurn turn;
        try {
            turn = modelGateway.generateWithTools(request, toolbox.definitions());
        } catch (ModelTransientException e) {
            log.warn("⚠️ Investigation stopped after {} cycle(s): {}", state.getCycleCount(), e.getMessage());
            return state.withTrace("Investigation stopped: " + e.getMessage() + " (initial findings kept)",
                    config.getMaxTraceEntries());
        }

        AgentState next = state.withMessages(List.of(turn.toMessage()));
        if (!turn.hasToolCalls()) {
            log.info("✅ Investigation complete after {} cycle(s)", state.getCycleCount());
            return next.withTrace("Investigation complete after " + state.getCycleCount() + " cycle(s)",
                    config.getMaxTraceEntries());
        }

        int cycle = state.getCycleCount() + 1;
        int maxCycles = state.effectiveMaxCycles(config.getMaxCycles());
        String requested = turn.getToolCalls().stream().map(ToolCall::getName).collect(Collectors.joining(", "));
        log.info("🔧 Investigation cycle {}/{}: model requested {}", cycle, maxCycles, requested);

        String reasoning = cycle > maxCycles
                ? "Investigation cycle limit reached (" + maxCycles + "), ignoring request for: " + requested
                : "Investigation cycle " + cycle + ": requested " + requested;
        return next.toBuilder()
                .cycleCount(cycle)
                .build()
                .withTrace(reasoning, config.getMaxTraceEntries());
    }
}
