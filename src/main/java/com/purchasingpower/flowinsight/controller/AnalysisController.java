package com.purchasingpower.flowinsight.controller;

import com.purchasingpower.flowinsight.exception.FlowInsightException;
import com.purchasingpower.flowinsight.model.dto.AnalysisRequest;
import com.purchasingpower.flowinsight.model.dto.AnalysisResponse;
import com.purchasingpower.flowinsight.model.dto.ClarificationRequest;
import com.purchasingpower.flowinsight.model.dto.RoiRequest;
import com.purchasingpower.flowinsight.model.roi.RoiEstimate;
import com.purchasingpower.flowinsight.service.AnalysisService;
import com.purchasingpower.flowinsight.service.EnrichmentResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

/**
 * REST controller for process analysis.
 *
 * Runs are synchronous: each call returns once the run has finished or
 * needs user input. Use the thread id from the response to answer
 * clarification questions or to read the saved state.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private static final Set<String> BAD_INPUT_CODES = Set.of("invalid_data", "insufficient_data");

    private final AnalysisService analysisService;

    /**
     * Analyze confirmed process data.
     */
    @PostMapping
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        log.info("Analysis requested for process: {}", request.getProcess().getName());
        return respond(analysisService.analyze(request));
    }

    /**
     * Confidence, improvement suggestions and a draft analysis, without starting a run.
     */
    @PostMapping("/preview")
    public ResponseEntity<EnrichmentResult> preview(@Valid @RequestBody AnalysisRequest request) {
        try {
            return ResponseEntity.ok(analysisService.preview(request));
        } catch (FlowInsightException e) {
            log.warn("Preview rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    /**
     * Answer the clarification questions of a run (or add context to a finished one).
     */
    @PostMapping("/{threadId}/clarification")
    public ResponseEntity<AnalysisResponse> clarify(@PathVariable String threadId,
                                                    @RequestBody ClarificationRequest request) {
        return analysisService.continueWithClarification(threadId, request)
                .map(this::respond)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{threadId}")
    public ResponseEntity<AnalysisResponse> getState(@PathVariable String threadId) {
        return analysisService.getState(threadId)
                .map(AnalysisResponse::fromState)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/roi")
    public ResponseEntity<RoiEstimate> estimateRoi(@Valid @RequestBody RoiRequest request) {
        return ResponseEntity.ok(analysisService.estimateRoi(request));
    }

    private ResponseEntity<AnalysisResponse> respond(AnalysisResponse response) {
        if (!response.isSuccess() && BAD_INPUT_CODES.contains(response.getErrorCode())) {
            log.warn("Analysis rejected ({}): {}", response.getErrorCode(), response.getError());
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
