package com.purchasingpower.flowinsight.workflow.state;

import com.purchasingpower.flowinsight.model.context.BusinessProfile;
import com.purchasingpower.flowinsight.model.context.Constraints;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import com.purchasingpower.flowinsight.model.metrics.ProcessMetrics;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Working state of one analysis run.
 *
 * <p>Immutable. Every stage returns a new instance and the orchestrator
 * swaps its reference only after the stage has finished, so a checkpointed
 * state is always the result of a completed transition.
 *
 * <p>Nullable fields: constraints, profile, analysisMode, llmProvider,
 * maxCyclesOverride, metrics, insight, userResponse, error, errorCode.
 */
@Value
@Builder(toBuilder = true)
public class AgentState {

    String threadId;

    ProcessData process;
    Constraints constraints;
    BusinessProfile profile;

    /** Preset name: cost_optimized, balanced or deep_analysis. */
    String analysisMode;
    String llmProvider;

    /** Per-run investigation limit; replaces the configured max cycles when set. */
    Integer maxCyclesOverride;

    double confidenceScore;

    @Builder.Default
    List<String> dataGaps = List.of();

    /** Investigation conversation, in order. */
    @Builder.Default
    List<ChatMessage> messages = List.of();

    @Builder.Default
    List<String> reasoningTrace = List.of();

    /** How many of the oldest trace entries were dropped to respect the cap. */
    int truncatedTraceEntries;

    int cycleCount;

    /** Tool outputs collected during investigation, in execution order. */
    @Builder.Default
    List<String> toolFindings = List.of();

    ProcessMetrics metrics;
    AnalysisInsight insight;

    @Builder.Default
    AnalysisPhase phase = AnalysisPhase.CHECK_CONTEXT;

    boolean needsClarification;

    @Builder.Default
    List<String> clarificationQuestions = List.of();

    String userResponse;

    /** User-facing error message; set only when the run failed. */
    String error;
    String errorCode;

    public static AgentState initial(String threadId,
                                     ProcessData process,
                                     Constraints constraints,
                                     BusinessProfile profile) {
        return AgentState.builder()
                .threadId(threadId)
                .process(process)
                .constraints(constraints)
                .profile(profile)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isAwaitingInput() {
        return phase == AnalysisPhase.AWAITING_INPUT;
    }

    public boolean isComplete() {
        return phase.isTerminal();
    }

    public int effectiveMaxCycles(int configured) {
        return maxCyclesOverride != null ? maxCyclesOverride : configured;
    }

    public Optional<ChatMessage> lastMessage() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    /**
     * Copy with {@code entry} appended to the reasoning trace.
     *
     * <p>When the trace would exceed {@code maxEntries}, the oldest entries are
     * dropped and the first line becomes a note saying how many were removed
     * in total. The newest entries are never dropped.
     */
    public AgentState withTrace(String entry, int maxEntries) {
        List<String> entries = new ArrayList<>(truncatedTraceEntries > 0
                ? reasoningTrace.subList(1, reasoningTrace.size())
                : reasoningTrace);
        entries.add(entry);

        int dropped = truncatedTraceEntries;
        int room = Math.max(maxEntries - 1, 1);
        if (dropped > 0 || entries.size() > maxEntries) {
            int excess = entries.size() - room;
            if (excess > 0) {
                entries = new ArrayList<>(entries.subList(excess, entries.size()));
                dropped += excess;
            }
        }

        List<String> trace = new ArrayList<>();
        if (dropped > 0) {
            trace.add(truncationNote(dropped));
        }
        trace.addAll(entries);

        return toBuilder()
                .reasoningTrace(List.copyOf(trace))
                .truncatedTraceEntries(dropped)
                .build();
    }

    public AgentState withMessages(List<ChatMessage> appended) {
        List<ChatMessage> all = new ArrayList<>(messages);
        all.addAll(appended);
        return toBuilder().messages(List.copyOf(all)).build();
    }

    /**
     * Copy carrying a user-facing error. Insight and trace computed so far are kept.
     */
    public AgentState failed(String userMessage, String code) {
        return toBuilder().error(userMessage).errorCode(code).build();
    }

    static String truncationNote(int dropped) {
        return "[" + dropped + " earlier trace entries truncated]";
    }
}
