package com.purchasingpower.flowinsight.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for the analysis pipeline.
 *
 * <p>Properties are loaded from the {@code app.analysis} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   analysis:
 *     confidence-threshold: 0.6
 *     post-interaction-threshold: 0.4
 *     max-cycles: 5
 *     max-trace-entries: 200
 * </pre>
 *
 * <p><b>Thread Safety:</b> Bound once at startup and only read afterwards.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.analysis")
public class AnalysisConfig {

    /**
     * Minimum confidence score to analyze without asking for more data.
     * Default: 0.6
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.6;

    /**
     * Lower bar applied after the user has been asked once and answered nothing,
     * so a run never loops on clarification forever.
     * Default: 0.4
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double postInteractionThreshold = 0.4;

    /**
     * Upper bound on investigation cycles. 0 disables investigation.
     * Default: 5
     */
    @Min(0)
    private int maxCycles = 5;

    /**
     * Maximum clarification questions returned to the user.
     * Default: 3
     */
    @Min(1)
    private int maxClarificationQuestions = 3;

    /**
     * Reasoning trace cap. Oldest entries are dropped first and a note records how many.
     * Default: 200
     */
    @Min(10)
    private int maxTraceEntries = 200;

    /**
     * Guard against a routing bug looping forever within one run.
     * Default: 50
     */
    @Min(5)
    private int maxTransitions = 50;

    /**
     * Pause before the single retry of a failed model call.
     * Default: 500
     */
    @Min(0)
    private long retryBackoffMs = 500;

    /**
     * Threads kept by the in-memory checkpoint store. The least recently
     * saved thread is evicted first.
     * Default: 1000
     */
    @Min(1)
    private int maxCheckpoints = 1000;

    /**
     * Minimum confidence before the enricher drafts an analysis.
     * Default: 0.5
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double draftAnalysisThreshold = 0.5;

    /**
     * Whether model-generated clarification questions are attempted before
     * falling back to scorer suggestions.
     * Default: true
     */
    private boolean llmClarificationEnabled = true;
}
