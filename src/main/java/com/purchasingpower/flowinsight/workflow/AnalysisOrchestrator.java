package com.purchasingpower.flowinsight.workflow;

import com.purchasingpower.flowinsight.config.AnalysisConfig;
import com.purchasingpower.flowinsight.exception.FlowInsightException;
import com.purchasingpower.flowinsight.storage.CheckpointStore;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import com.purchasingpower.flowinsight.workflow.state.AnalysisEvent;
import com.purchasingpower.flowinsight.workflow.state.AnalysisPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Drives an analysis run through its phases.
 *
 * <p>Flow:
 * <pre>
 * CHECK_CONTEXT → (insufficient) → REQUEST_CLARIFICATION → AWAITING_INPUT (suspended)
 *               → (sufficient)   → INITIAL_ANALYSIS → INVESTIGATE ⇄ TOOL_EXEC → FINALIZE → DONE
 * </pre>
 *
 * <p>Guarantees:
 * <ul>
 *   <li>no exception escapes {@link #start} or {@link #resume}; failures end in DONE with an error</li>
 *   <li>each stage's result is applied as a whole and checkpointed before the next stage runs</li>
 *   <li>an interrupted thread stops at the next stage boundary</li>
 * </ul>
 *
 * <p>Runs are single-threaded; independent runs may execute concurrently since
 * they share no mutable state.
 */
@Slf4j
@Service
public class AnalysisOrchestrator {

    private final Map<AnalysisPhase, AnalysisStage> stages = new EnumMap<>(AnalysisPhase.class);
    private final AnalysisRouter router;
    private final CheckpointStore checkpointStore;
    private final AnalysisConfig config;

    public AnalysisOrchestrator(List<AnalysisStage> stages,
                                AnalysisRouter router,
                                CheckpointStore checkpointStore,
                                AnalysisConfig config) {
        for (AnalysisStage stage : stages) {
            AnalysisStage previous = this.stages.put(stage.phase(), stage);
            if (previous != null) {
                throw new IllegalStateException("Two stages registered for " + stage.phase() + ": "
                        + previous.getClass().getSimpleName() + ", " + stage.getClass().getSimpleName());
            }
        }
        for (AnalysisPhase phase : AnalysisPhase.values()) {
            if (!phase.isSuspended() && !this.stages.containsKey(phase)) {
                throw new IllegalStateException("No stage registered for " + phase);
            }
        }
        this.router = router;
        this.checkpointStore = checkpointStore;
        this.config = config;
    }

    /**
     * Runs a fresh analysis until it completes or needs user input.
     */
    public AgentState start(AgentState initial) {
        log.info("🚀 Starting analysis run (thread={})", initial.getThreadId());
        AgentState state = initial.toBuilder().phase(AnalysisPhase.CHECK_CONTEXT).build();
        return run(state);
    }

    /**
     * Continues a run suspended in AWAITING_INPUT. The caller puts the user's
     * answer, if any, into {@code userResponse}.
     */
    public AgentState resume(AgentState suspended) {
        if (!suspended.isAwaitingInput()) {
            log.warn("Resume requested for thread {} in phase {}; nothing to resume",
                    suspended.getThreadId(), suspended.getPhase());
            return suspended;
        }
        log.info("🔄 Resuming analysis run (thread={})", suspended.getThreadId());

        AnalysisEvent event = router.route(AnalysisPhase.AWAITING_INPUT, suspended);
        AgentState state = suspended
                .withTrace(resumeReasoning(event, suspended), config.getMaxTraceEntries())
                .toBuilder()
                .phase(AnalysisStateMachine.transition(AnalysisPhase.AWAITING_INPUT, event))
                .build();
        checkpoint(state);
        return run(state);
    }

    private AgentState run(AgentState initial) {
        AgentState state = initial;
        int transitions = 0;

        while (!state.getPhase().isSuspended()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Analysis run interrupted at {} (thread={})", state.getPhase(), state.getThreadId());
                return state;
            }

            AnalysisPhase phase = state.getPhase();
            if (transitions++ >= config.getMaxTransitions() && phase != AnalysisPhase.FINALIZE) {
                log.error("❌ Transition limit {} reached at {} (thread={})",
                        config.getMaxTransitions(), phase, state.getThreadId());
                state = state.failed("Analysis stopped: too many processing steps.", "transition_limit")
                        .withTrace("Transition limit reached at " + phase, config.getMaxTraceEntries())
                        .toBuilder()
                        .phase(AnalysisStateMachine.transition(phase, AnalysisEvent.FAILURE))
                        .build();
                checkpoint(state);
                continue;
            }

            state = step(phase, state);
            checkpoint(state);
        }

        log.info("Analysis run suspended at {} (thread={}, trace entries={})",
                state.getPhase(), state.getThreadId(), state.getReasoningTrace().size());
        return state;
    }

    private AgentState step(AnalysisPhase phase, AgentState state) {
        try {
            AgentState next = stages.get(phase).execute(state);
            AnalysisEvent event = router.route(phase, next);
            AnalysisPhase nextPhase = AnalysisStateMachine.transition(phase, event);
            log.debug("{} --{}--> {}", phase, event, nextPhase);
            return next.toBuilder().phase(nextPhase).build();
        } catch (FlowInsightException e) {
            log.error("❌ {} failed ({}): {}", phase, e.getErrorCode(), e.getMessage(), e);
            return failed(phase, state, e.getUserMessage(), e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ {} failed unexpectedly", phase, e);
            return failed(phase, state, "Analysis failed unexpectedly: " + e.getMessage(),
                    "unexpected_error", e.getClass().getSimpleName());
        }
    }

    private AgentState failed(AnalysisPhase phase, AgentState state, String userMessage, String code, String detail) {
        return state.failed(userMessage, code)
                .withTrace(phase + " failed: " + detail, config.getMaxTraceEntries())
                .toBuilder()
                .phase(AnalysisStateMachine.transition(phase, AnalysisEvent.FAILURE))
                .build();
    }

    private void checkpoint(AgentState state) {
        if (state.getThreadId() == null) {
            return;
        }
        try {
            checkpointStore.put(state.getThreadId(), state);
        } catch (RuntimeException e) {
            log.error("Failed to checkpoint thread {} at {}", state.getThreadId(), state.getPhase(), e);
        }
    }

    private static String resumeReasoning(AnalysisEvent event, AgentState state) {
        String confidence = String.format("confidence=%.1f%%", state.getConfidenceScore() * 100);
        return switch (event) {
            case USER_RESPONDED -> "User provided clarification, re-checking context";
            case PROCEED_WITHOUT_INPUT -> "No new input, proceeding with available data (" + confidence + ")";
            default -> "Still awaiting input (" + confidence + ")";
        };
    }
}
