package com.argument.mapping.argweave.config;

import com.argument.mapping.argweave.model.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the default {@link PipelineConfig} from application.yml.
 * Requests may override individual values; see ArgumentGraphController.
 */
@Configuration
@Slf4j
public class PipelineConfiguration {

    @Value("${argweave.input.min-node-confidence:0.0}")
    private double minNodeConfidence;

    @Value("${argweave.input.max-node-confidence:1.0}")
    private double maxNodeConfidence;

    @Value("${argweave.input.min-edge-confidence:0.0}")
    private double minEdgeConfidence;

    @Value("${argweave.input.max-edge-confidence:1.0}")
    private double maxEdgeConfidence;

    @Value("${argweave.dedup.threshold:0.8}")
    private double dedupThreshold;

    @Value("${argweave.conclusion.incoming-support-weight:2.0}")
    private double incomingSupportWeight;

    @Value("${argweave.conclusion.distinct-source-weight:1.5}")
    private double distinctSourceWeight;

    @Value("${argweave.conclusion.sink-bonus-weight:1.0}")
    private double sinkBonusWeight;

    @Value("${argweave.conclusion.score-threshold:1.0}")
    private double conclusionScoreThreshold;

    @Value("${argweave.conclusion.max-conclusions:1}")
    private int maxConclusions;

    @Value("${argweave.synthetic.enabled:false}")
    private boolean syntheticEnabled;

    @Value("${argweave.synthetic.min-cluster-size:2}")
    private int minClusterSize;

    @Value("${argweave.synthetic.max-cluster-size:10}")
    private int maxClusterSize;

    @Value("${argweave.synthetic.max-position-distance:3}")
    private int maxPositionDistance;

    @Value("${argweave.synthetic.cluster-similarity-threshold:0.3}")
    private double clusterSimilarityThreshold;

    @Value("${argweave.synthetic.fan-in-threshold:3}")
    private int fanInThreshold;

    @Value("${argweave.synthetic.min-coherence:0.3}")
    private double minCoherence;

    @Value("${argweave.synthetic.min-confidence:0.5}")
    private double minSynthesisConfidence;

    @Value("${argweave.synthetic.max-claim-words:20}")
    private int maxSyntheticClaimWords;

    @Value("${argweave.synthetic.edge-penalty:0.95}")
    private double syntheticEdgePenalty;

    @Value("${argweave.synthetic.timeout-seconds:30}")
    private long synthesisTimeoutSeconds;

    @Value("${argweave.layout.barycenter-iterations:8}")
    private int barycenterIterations;

    @Value("${argweave.layout.layer-spacing:200}")
    private double layerSpacing;

    @Value("${argweave.layout.sibling-spacing:250}")
    private double siblingSpacing;

    @Bean
    public PipelineConfig pipelineConfig() {
        PipelineConfig config = PipelineConfig.builder()
                .minNodeConfidence(minNodeConfidence)
                .maxNodeConfidence(maxNodeConfidence)
                .minEdgeConfidence(minEdgeConfidence)
                .maxEdgeConfidence(maxEdgeConfidence)
                .dedupThreshold(dedupThreshold)
                .incomingSupportWeight(incomingSupportWeight)
                .distinctSourceWeight(distinctSourceWeight)
                .sinkBonusWeight(sinkBonusWeight)
                .conclusionScoreThreshold(conclusionScoreThreshold)
                .maxConclusions(maxConclusions)
                .syntheticEnabled(syntheticEnabled)
                .minClusterSize(minClusterSize)
                .maxClusterSize(maxClusterSize)
                .maxPositionDistance(maxPositionDistance)
                .clusterSimilarityThreshold(clusterSimilarityThreshold)
                .fanInThreshold(fanInThreshold)
                .minCoherence(minCoherence)
                .minSynthesisConfidence(minSynthesisConfidence)
                .maxSyntheticClaimWords(maxSyntheticClaimWords)
                .syntheticEdgePenalty(syntheticEdgePenalty)
                .synthesisTimeout(Duration.ofSeconds(synthesisTimeoutSeconds))
                .barycenterIterations(barycenterIterations)
                .layerSpacing(layerSpacing)
                .siblingSpacing(siblingSpacing)
                .build();
        log.info("[Pipeline Config] dedupThreshold={}, maxConclusions={}, syntheticEnabled={}, iterations={}",
                dedupThreshold, maxConclusions, syntheticEnabled, barycenterIterations);
        return config;
    }
}
