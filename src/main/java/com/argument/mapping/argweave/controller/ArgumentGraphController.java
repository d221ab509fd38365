package com.argument.mapping.argweave.controller;

import com.argument.mapping.argweave.dto.graph.GraphLayoutRequest;
import com.argument.mapping.argweave.dto.graph.GraphLayoutResponse;
import com.argument.mapping.argweave.dto.graph.PipelineOptions;
import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.service.graph.ArgumentGraphPipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller that turns extracted argument components into a laid-out graph.
 */
@RestController
@RequestMapping("/api/argument-graphs")
@Slf4j
@RequiredArgsConstructor
public class ArgumentGraphController {

    private final ArgumentGraphPipeline pipeline;
    private final PipelineConfig defaultConfig;

    /**
     * Build, repair and lay out the graph.
     * Malformed nodes and edges are dropped and reported in metadata.warnings.
     */
    @PostMapping("/layout")
    public ResponseEntity<GraphLayoutResponse> layout(@Valid @RequestBody GraphLayoutRequest request) {
        log.info("Layout request: {} nodes, {} edges",
                request.getNodes() != null ? request.getNodes().size() : 0,
                request.getEdges() != null ? request.getEdges().size() : 0);

        PipelineConfig config = applyOverrides(defaultConfig, request.getOptions());
        return ResponseEntity.ok(pipeline.run(request, config));
    }

    /**
     * Effective default configuration
     */
    @GetMapping("/config")
    public ResponseEntity<PipelineConfig> getConfig() {
        return ResponseEntity.ok(defaultConfig);
    }

    static PipelineConfig applyOverrides(PipelineConfig base, PipelineOptions options) {
        if (options == null) {
            return base;
        }
        PipelineConfig.PipelineConfigBuilder builder = base.toBuilder();
        if (options.getDedupThreshold() != null) builder.dedupThreshold(options.getDedupThreshold());
        if (options.getMinNodeConfidence() != null) builder.minNodeConfidence(options.getMinNodeConfidence());
        if (options.getMaxNodeConfidence() != null) builder.maxNodeConfidence(options.getMaxNodeConfidence());
        if (options.getMinEdgeConfidence() != null) builder.minEdgeConfidence(options.getMinEdgeConfidence());
        if (options.getMaxEdgeConfidence() != null) builder.maxEdgeConfidence(options.getMaxEdgeConfidence());
        if (options.getConclusionScoreThreshold() != null) builder.conclusionScoreThreshold(options.getConclusionScoreThreshold());
        if (options.getMaxConclusions() != null) builder.maxConclusions(options.getMaxConclusions());
        if (options.getSyntheticEnabled() != null) builder.syntheticEnabled(options.getSyntheticEnabled());
        if (options.getMinClusterSize() != null) builder.minClusterSize(options.getMinClusterSize());
        if (options.getBarycenterIterations() != null) builder.barycenterIterations(options.getBarycenterIterations());
        if (options.getLayerSpacing() != null) builder.layerSpacing(options.getLayerSpacing());
        if (options.getSiblingSpacing() != null) builder.siblingSpacing(options.getSiblingSpacing());
        return builder.build();
    }
}
