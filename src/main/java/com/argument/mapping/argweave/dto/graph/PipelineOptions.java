package com.argument.mapping.argweave.dto.graph;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional per-request overrides of the pipeline configuration.
 * A null field keeps the service default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineOptions {

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double dedupThreshold;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double minNodeConfidence;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double maxNodeConfidence;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double minEdgeConfidence;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double maxEdgeConfidence;

    private Double conclusionScoreThreshold;

    @Min(0)
    private Integer maxConclusions;

    private Boolean syntheticEnabled;

    @Min(2)
    private Integer minClusterSize;

    @Min(1) @Max(64)
    private Integer barycenterIterations;

    @Positive
    private Double layerSpacing;

    @Positive
    private Double siblingSpacing;
}
