package com.argument.mapping.argweave.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Observability data about one pipeline run.
 * Provides summary information for the UI; never required for correctness.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphMetadata {

    private int inputNodeCount;
    private int inputEdgeCount;
    private int nodeCount;
    private int edgeCount;

    private int mergeCount;
    private Map<String, String> mergedIds;          // removed id -> surviving id
    private int danglingEdgesDropped;
    private int cyclesRemoved;
    private int orphansRemoved;

    private List<String> conclusionIds;
    private List<ConclusionScore> conclusionScores;
    private int conclusionEdgesRemoved;

    private int clustersFound;
    private int syntheticNodesAdded;
    private Map<String, Integer> clusterSkipReasons;

    private int crossingCount;
    private int layerCount;
    private int maxLayerWidth;

    private List<String> warnings;
}
