package com.argument.mapping.argweave.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable settings threaded through every pipeline stage.
 * Defaults mirror application.yml; per-request overrides go through toBuilder().
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

    // Input inclusion
    @Builder.Default double minNodeConfidence = 0.0;
    @Builder.Default double maxNodeConfidence = 1.0;
    @Builder.Default double minEdgeConfidence = 0.0;
    @Builder.Default double maxEdgeConfidence = 1.0;

    // Deduplication
    @Builder.Default double dedupThreshold = 0.8;

    // Conclusion inference
    @Builder.Default double incomingSupportWeight = 2.0;
    @Builder.Default double distinctSourceWeight = 1.5;
    @Builder.Default double sinkBonusWeight = 1.0;
    @Builder.Default double conclusionScoreThreshold = 1.0;
    @Builder.Default int maxConclusions = 1;

    // Synthetic rewiring
    @Builder.Default boolean syntheticEnabled = false;
    @Builder.Default int minClusterSize = 2;
    @Builder.Default int maxClusterSize = 10;
    @Builder.Default int maxPositionDistance = 3;
    @Builder.Default double clusterSimilarityThreshold = 0.3;
    @Builder.Default int fanInThreshold = 3;
    @Builder.Default double minCoherence = 0.3;
    @Builder.Default double minSynthesisConfidence = 0.5;
    @Builder.Default int maxSyntheticClaimWords = 20;
    @Builder.Default double syntheticEdgePenalty = 0.95;
    @Builder.Default Duration synthesisTimeout = Duration.ofSeconds(30);

    // Layout
    @Builder.Default int barycenterIterations = 8;
    @Builder.Default double layerSpacing = 200;
    @Builder.Default double siblingSpacing = 250;

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }
}
