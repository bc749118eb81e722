package com.purchasingpower.flowinsight.service;

import com.purchasingpower.flowinsight.analysis.ConfidenceResult;
import com.purchasingpower.flowinsight.analysis.ConfidenceScorer;
import com.purchasingpower.flowinsight.analysis.RoiCalculator;
import com.purchasingpower.flowinsight.exception.FlowInsightException;
import com.purchasingpower.flowinsight.exception.InsufficientDataException;
import com.purchasingpower.flowinsight.model.context.BusinessProfile;
import com.purchasingpower.flowinsight.model.dto.AnalysisRequest;
import com.purchasingpower.flowinsight.model.dto.AnalysisResponse;
import com.purchasingpower.flowinsight.model.dto.ClarificationRequest;
import com.purchasingpower.flowinsight.model.dto.RoiRequest;
import com.purchasingpower.flowinsight.model.process.ProcessData;
import com.purchasingpower.flowinsight.model.roi.RoiEstimate;
import com.purchasingpower.flowinsight.storage.CheckpointStore;
import com.purchasingpower.flowinsight.workflow.AnalysisOrchestrator;
import com.purchasingpower.flowinsight.workflow.state.AgentState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for callers: starts runs, resumes them with the user's answers
 * and reads saved state.
 *
 * <p>Never throws for analysis failures; they come back as an
 * {@link AnalysisResponse} with {@code success == false} and an error code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final AnalysisOrchestrator orchestrator;
    private final CheckpointStore checkpointStore;
    private final RoiCalculator roiCalculator;
    private final ConfidenceScorer confidenceScorer;
    private final PostExtractionEnricher enricher;

    public AnalysisResponse analyze(AnalysisRequest request) {
        String threadId = request.getThreadId() != null && !request.getThreadId().isBlank()
                ? request.getThreadId()
                : UUID.randomUUID().toString();

        try {
            ProcessData process = requireProcess(request.getProcess());
            log.info("Starting analysis for process: {} (thread={})", process.getName(), threadId);

            AgentState initial = AgentState.initial(threadId, process, request.getConstraints(), request.getProfile())
                    .toBuilder()
                    .analysisMode(request.getAnalysisMode())
                    .llmProvider(request.getLlmProvider())
                    .maxCyclesOverride(request.getMaxCycles())
                    .build();

            return AnalysisResponse.fromState(orchestrator.start(initial));

        } catch (FlowInsightException e) {
            log.error("Analysis failed for thread {}: {}", threadId, e.getMessage());
            return AnalysisResponse.error(threadId, e.getUserMessage(), e.getErrorCode());
        } catch (RuntimeException e) {
            log.error("Analysis failed with unexpected error (thread={})", threadId, e);
            return AnalysisResponse.error(threadId, "Analysis failed unexpectedly: " + e.getMessage(),
                    "unexpected_error");
        }
    }

    /**
     * Continues a saved thread with the user's answer.
     *
     * <p>A run waiting for input is resumed. A finished run is analyzed again
     * with the answer added to the profile notes.
     *
     * @return empty when no checkpoint exists for the thread
     */
    public Optional<AnalysisResponse> continueWithClarification(String threadId, ClarificationRequest request) {
        Optional<AgentState> saved = checkpointStore.get(threadId);
        if (saved.isEmpty()) {
            log.info("No checkpoint found for thread {}", threadId);
            return Optional.empty();
        }
        log.info("Continuing conversation: thread={}", threadId);

        try {
            AgentState state = saved.get();
            String answer = request.getResponse() == null || request.getResponse().isBlank()
                    ? null
                    : request.getResponse().strip();

            ProcessData process = state.getProcess();
            if (request.getProcess() != null) {
                process = process.mergeWith(request.getProcess());
                log.info("Merged updated process data: {} steps", process.getSteps().size());
            }
            requireProcess(process);
            BusinessProfile profile = answer == null ? state.getProfile() : withNote(state.getProfile(), answer);

            AgentState result;
            if (state.isAwaitingInput()) {
                AgentState.AgentStateBuilder resumed = state.toBuilder()
                        .process(process)
                        .profile(profile)
                        .userResponse(answer);
                if (request.getProcess() != null) {
                    // routing without an answer reads this score
                    ConfidenceResult confidence = confidenceScorer.score(process, state.getConstraints(), profile);
                    resumed.confidenceScore(confidence.getScore())
                            .dataGaps(List.copyOf(confidence.getDataGaps()));
                }
                result = orchestrator.resume(resumed.build());
            } else {
                result = orchestrator.start(AgentState.initial(threadId, process, state.getConstraints(), profile)
                        .toBuilder()
                        .analysisMode(state.getAnalysisMode())
                        .llmProvider(state.getLlmProvider())
                        .maxCyclesOverride(state.getMaxCyclesOverride())
                        .build());
            }
            return Optional.of(AnalysisResponse.fromState(result));

        } catch (FlowInsightException e) {
            log.error("Continuing thread {} failed: {}", threadId, e.getMessage());
            return Optional.of(AnalysisResponse.error(threadId, e.getUserMessage(), e.getErrorCode()));
        } catch (RuntimeException e) {
            log.error("Continuing thread {} failed with unexpected error", threadId, e);
            return Optional.of(AnalysisResponse.error(threadId, "Analysis failed unexpectedly: " + e.getMessage(),
                    "unexpected_error"));
        }
    }

    public Optional<AgentState> getState(String threadId) {
        return checkpointStore.get(threadId);
    }

    public RoiEstimate estimateRoi(RoiRequest request) {
        return roiCalculator.estimate(
                request.getSuggestionType(),
                request.getStepName(),
                request.getProcess(),
                request.getImplementationCost(),
                request.getExecutionsPerYear() != null
                        ? request.getExecutionsPerYear() : RoiCalculator.DEFAULT_EXECUTIONS_PER_YEAR,
                request.getBaseConfidence() != null
                        ? request.getBaseConfidence() : RoiCalculator.DEFAULT_CONFIDENCE);
    }

    /**
     * Confidence, improvement suggestions and a draft analysis for data the
     * user has not confirmed yet. Nothing is checkpointed.
     */
    public EnrichmentResult preview(AnalysisRequest request) {
        ProcessData process = requireProcess(request.getProcess());
        return enricher.enrich(process, request.getConstraints(), request.getProfile(),
                request.getAnalysisMode(), request.getLlmProvider());
    }

    private static ProcessData requireProcess(ProcessData process) {
        if (process == null) {
            throw new InsufficientDataException("No process data provided", List.of("process"));
        }
        return process.requireValid();
    }

    private static BusinessProfile withNote(BusinessProfile profile, String note) {
        if (profile == null) {
            return BusinessProfile.builder().notes(note).build();
        }
        String notes = profile.getNotes() == null || profile.getNotes().isBlank()
                ? note
                : profile.getNotes() + "\n" + note;
        return profile.toBuilder().notes(notes).build();
    }
}
