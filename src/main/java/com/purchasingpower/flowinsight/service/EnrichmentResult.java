package com.purchasingpower.flowinsight.service;

import com.purchasingpower.flowinsight.analysis.ConfidenceResult;
import com.purchasingpower.flowinsight.model.insight.AnalysisInsight;
import lombok.Builder;
import lombok.Value;

/**
 * Extras produced right after process data was extracted.
 * Either part is null when it was skipped or failed.
 */
@Value
@Builder
public class EnrichmentResult {
    ConfidenceResult confidence;
    String improvementSuggestions;
    AnalysisInsight draftInsight;
}
