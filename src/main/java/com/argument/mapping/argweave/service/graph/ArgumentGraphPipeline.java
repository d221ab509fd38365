package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.dto.graph.GraphLayoutRequest;
import com.argument.mapping.argweave.dto.graph.GraphLayoutResponse;
import com.argument.mapping.argweave.dto.graph.GraphMetadata;
import com.argument.mapping.argweave.exception.GraphPipelineException;
import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.service.layout.HierarchicalLayout;
import com.argument.mapping.argweave.service.layout.HierarchicalLayoutEngine;
import com.argument.mapping.argweave.service.llm.ClaimSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Supplier;

/**
 * Runs the construction stages in order and assembles the response.
 *
 * Each stage gets an immutable graph and returns a new one. When a stage fails, the
 * failure is logged and reported in the metadata warnings and the graph it received
 * moves on to the next stage unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArgumentGraphPipeline {

    private final GraphIngestor graphIngestor;
    private final NodeDeduplicator nodeDeduplicator;
    private final ConsistencyValidator consistencyValidator;
    private final ConclusionInferencer conclusionInferencer;
    private final SyntheticNodeRewirer syntheticNodeRewirer;
    private final HierarchicalLayoutEngine layoutEngine;
    private final ArgumentGraphMapper graphMapper;
    private final ObjectProvider<ClaimSynthesizer> claimSynthesizer;

    public GraphLayoutResponse run(GraphLayoutRequest request, PipelineConfig config) {
        long start = System.currentTimeMillis();
        List<String> warnings = new ArrayList<>();
        GraphMetadata.GraphMetadataBuilder meta = GraphMetadata.builder()
                .mergedIds(Collections.emptyMap())
                .conclusionIds(Collections.emptyList())
                .conclusionScores(Collections.emptyList())
                .clusterSkipReasons(Collections.emptyMap());

        ArgumentGraph graph = ArgumentGraph.empty();
        int orphansRemoved = 0;

        Optional<IngestResult> ingested = runStage("ingest", () -> graphIngestor.ingest(request, config), warnings);
        if (ingested.isPresent()) {
            graph = ingested.get().getGraph();
            warnings.addAll(ingested.get().getWarnings());
            meta.inputNodeCount(ingested.get().getInputNodeCount())
                    .inputEdgeCount(ingested.get().getInputEdgeCount());
        }

        ArgumentGraph deduplicationInput = graph;
        Optional<DeduplicationResult> deduplicated = runStage("deduplicate",
                () -> nodeDeduplicator.deduplicate(deduplicationInput, config), warnings);
        if (deduplicated.isPresent()) {
            graph = deduplicated.get().getGraph();
            meta.mergeCount(deduplicated.get().getMergeCount())
                    .mergedIds(deduplicated.get().getMergedIds());
        }

        ArgumentGraph validationInput = graph;
        Optional<ValidationResult> validated = runStage("validate",
                () -> consistencyValidator.validate(validationInput), warnings);
        if (validated.isPresent()) {
            graph = validated.get().getGraph();
            meta.danglingEdgesDropped(validated.get().getDanglingEdgesDropped())
                    .cyclesRemoved(validated.get().getCyclesRemoved());
            orphansRemoved += validated.get().getOrphansRemoved();
        }

        ArgumentGraph inferenceInput = graph;
        Optional<ConclusionInferenceResult> inferred = runStage("infer-conclusions",
                () -> conclusionInferencer.infer(inferenceInput, config), warnings);
        if (inferred.isPresent()) {
            graph = inferred.get().getGraph();
            meta.conclusionIds(inferred.get().getSelectedIds())
                    .conclusionScores(inferred.get().getScores())
                    .conclusionEdgesRemoved(inferred.get().getEdgesRemoved());
            orphansRemoved += inferred.get().getOrphansRemoved();
        }
        meta.orphansRemoved(orphansRemoved);

        if (config.isSyntheticEnabled()) {
            ClaimSynthesizer synthesizer = claimSynthesizer.getIfAvailable();
            if (synthesizer == null) {
                warnings.add("Synthetic rewiring requested but no claim synthesizer is configured");
            } else {
                ArgumentGraph rewireInput = graph;
                Optional<RewireResult> rewired = runStage("rewire",
                        () -> syntheticNodeRewirer.rewire(rewireInput, config, synthesizer), warnings);
                if (rewired.isPresent()) {
                    graph = rewired.get().getGraph();
                    meta.clustersFound(rewired.get().getClustersFound())
                            .syntheticNodesAdded(rewired.get().getSyntheticNodeIds().size())
                            .clusterSkipReasons(rewired.get().getSkipReasons());
                }
            }
        }

        ArgumentGraph layoutInput = graph;
        HierarchicalLayout layout = runStage("layout", () -> layoutEngine.layout(layoutInput, config), warnings)
                .orElseGet(HierarchicalLayout::empty);
        warnings.addAll(layout.getWarnings());

        GraphLayoutResponse response = GraphLayoutResponse.builder()
                .nodes(graphMapper.toNodes(graph, layout))
                .edges(graphMapper.toEdges(graph))
                .metadata(meta
                        .nodeCount(graph.nodeCount())
                        .edgeCount(graph.edgeCount())
                        .crossingCount(layout.getCrossingCount())
                        .layerCount(layout.getLayerCount())
                        .maxLayerWidth(layout.getMaxLayerWidth())
                        .warnings(warnings)
                        .build())
                .build();

        log.info("Pipeline finished in {}ms: {} nodes, {} edges, {} warnings",
                System.currentTimeMillis() - start, graph.nodeCount(), graph.edgeCount(), warnings.size());
        return response;
    }

    private <T> Optional<T> runStage(String stage, Supplier<T> action, List<String> warnings) {
        try {
            return Optional.ofNullable(action.get());
        } catch (RuntimeException e) {
            GraphPipelineException failure = new GraphPipelineException(stage, e);
            log.error("Pipeline stage '{}' failed, keeping the previous graph", stage, failure);
            warnings.add(failure.getMessage());
            return Optional.empty();
        }
    }
}
