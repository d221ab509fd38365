package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import com.argument.mapping.argweave.model.argument.NodeRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.argument.mapping.argweave.model.argument.ArgumentGraphFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NodeDeduplicatorTest {

    private final NodeDeduplicator deduplicator = new NodeDeduplicator(new TextSimilarity());

    @Test
    void mergesNearDuplicate_intoHigherConfidenceNode_andRewritesEdges() {
        ArgumentGraph graph = ArgumentGraph.of(
                List.of(
                        claim("C1", "Cities should invest in renewable energy"),
                        node("P1", NodeRole.PREMISE, "Renewable energy reduces long term electricity costs", 0.9, 1),
                        node("P2", NodeRole.PREMISE, "Renewable energy reduces long term electricity prices", 0.6, 2),
                        node("P3", NodeRole.PREMISE, "Solar farms create local construction jobs", 0.7, 3)),
                List.of(
                        support("P1", "C1", 0.8),
                        support("P2", "C1", 0.7),
                        attack("P3", "P2", 0.5)));

        DeduplicationResult result = deduplicator.deduplicate(graph, PipelineConfig.defaults());

        ArgumentGraph deduplicated = result.getGraph();
        assertThat(result.getMergedIds()).containsExactly(Map.entry("P2", "P1"));
        assertThat(result.getMergeCount()).isEqualTo(1);
        assertThat(deduplicated.getNodeIds()).containsExactly("C1", "P1", "P3");
        assertThat(deduplicated.getNode("P1").getConfidence()).isEqualTo(0.9);
        assertThat(deduplicated.getEdges()).noneMatch(e -> e.touches("P2"));
        assertThat(deduplicated.getEdges()).containsExactly(
                support("P1", "C1", 0.8),
                attack("P3", "P1", 0.5));
        assertThat(result.getEdgesCollapsed()).isEqualTo(1);
    }

    @Test
    void tiedConfidence_keepsLexicographicallySmallerId() {
        ArgumentGraph graph = ArgumentGraph.of(
                List.of(
                        node("b", NodeRole.PREMISE, "Buses reduce traffic", 0.5, 0),
                        node("a", NodeRole.PREMISE, "Buses reduce traffic!", 0.5, 1)),
                List.of());

        DeduplicationResult result = deduplicator.deduplicate(graph, PipelineConfig.defaults());

        assertThat(result.getGraph().getNodeIds()).containsExactly("a");
        assertThat(result.getMergedIds()).containsEntry("b", "a");
    }

    @Test
    void edgeBetweenMergedNodes_isDroppedAsSelfLoop() {
        ArgumentGraph graph = ArgumentGraph.of(
                List.of(
                        node("P1", NodeRole.PREMISE, "Trains are fast", 0.9, 0),
                        node("P2", NodeRole.PREMISE, "Trains are fast.", 0.4, 1)),
                List.of(support("P2", "P1", 0.6)));

        DeduplicationResult result = deduplicator.deduplicate(graph, PipelineConfig.defaults());

        assertThat(result.getGraph().getEdges()).isEmpty();
        assertThat(result.getSelfLoopsDropped()).isEqualTo(1);
    }

    @Test
    void distinctTexts_leaveGraphUnchanged() {
        ArgumentGraph graph = ArgumentGraph.of(
                List.of(
                        claim("C1", "Cities should expand public transport"),
                        premise("P1", "Bike lanes improve commuter health", 1)),
                List.of(support("P1", "C1", 0.7)));

        DeduplicationResult result = deduplicator.deduplicate(graph, PipelineConfig.defaults());

        assertThat(result.getGraph()).isEqualTo(graph);
        assertThat(result.getMergedIds()).isEmpty();
    }

    @Test
    void similarityFailure_failsClosed() {
        TextSimilarity broken = mock(TextSimilarity.class);
        when(broken.tokenSortRatio(any(), any())).thenThrow(new IllegalArgumentException("malformed text"));
        NodeDeduplicator failing = new NodeDeduplicator(broken);

        List<ArgumentNode> nodes = List.of(
                premise("P1", "Same text", 0),
                premise("P2", "Same text", 1));
        ArgumentGraph graph = ArgumentGraph.of(nodes, List.<ArgumentEdge>of());

        DeduplicationResult result = failing.deduplicate(graph, PipelineConfig.defaults());

        assertThat(result.getGraph().nodeCount()).isEqualTo(2);
        assertThat(result.getMergedIds()).isEmpty();
    }
}
