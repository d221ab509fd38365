package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.dto.graph.EdgeInput;
import com.argument.mapping.argweave.dto.graph.GraphLayoutRequest;
import com.argument.mapping.argweave.dto.graph.NodeInput;
import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.NodeRole;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.argument.mapping.argweave.model.argument.ArgumentGraphFixtures.support;
import static org.assertj.core.api.Assertions.assertThat;

class GraphIngestorTest {

    private final GraphIngestor ingestor = new GraphIngestor();

    @Test
    void dropsMalformedNodes_withWarnings() {
        GraphLayoutRequest request = GraphLayoutRequest.builder()
                .nodes(Arrays.asList(
                        NodeInput.builder().id("C1").role("claim").label("Claim").build(),
                        NodeInput.builder().id(" ").role("premise").build(),
                        NodeInput.builder().id("X").role("rebuttal").build(),
                        NodeInput.builder().id("P1").role("premise").span("Buses are cheap").confidence(1.4).build(),
                        NodeInput.builder().id("C1").role("premise").build(),
                        null,
                        NodeInput.builder().id("P2").role("PREMISE").span("Buses are cheap").confidence(0.6).build()))
                .build();

        IngestResult result = ingestor.ingest(request, PipelineConfig.defaults());

        ArgumentGraph graph = result.getGraph();
        assertThat(graph.getNodeIds()).containsExactly("C1", "P2");
        assertThat(graph.getNode("C1").getConfidence()).isEqualTo(1.0);
        assertThat(graph.getNode("P2").getOrdinal()).isEqualTo(6);
        assertThat(graph.getNode("P2").getLabel()).isEqualTo("Buses are cheap");
        assertThat(result.getInputNodeCount()).isEqualTo(7);
        assertThat(result.getWarnings()).hasSize(5);
    }

    @Test
    void conclusionRole_isDowngradedToClaim() {
        GraphLayoutRequest request = GraphLayoutRequest.builder()
                .nodes(List.of(NodeInput.builder().id("K").role("conclusion").label("Therefore").build()))
                .build();

        IngestResult result = ingestor.ingest(request, PipelineConfig.defaults());

        assertThat(result.getGraph().getNode("K").getRole()).isEqualTo(NodeRole.CLAIM);
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0)).contains("treated as claim");
    }

    @Test
    void dropsMalformedEdges_andCollapsesParallelOnes() {
        GraphLayoutRequest request = GraphLayoutRequest.builder()
                .nodes(List.of(
                        NodeInput.builder().id("C1").role("claim").build(),
                        NodeInput.builder().id("P1").role("premise").build()))
                .edges(List.of(
                        EdgeInput.builder().source("P1").target("C1").relation("support").confidence(0.6).build(),
                        EdgeInput.builder().source("P1").target("C1").relation("support").confidence(0.9).build(),
                        EdgeInput.builder().source("P1").target("P1").relation("support").build(),
                        EdgeInput.builder().source("P1").target("C1").relation("implies").build(),
                        EdgeInput.builder().source("").target("C1").relation("attack").build(),
                        EdgeInput.builder().source("C1").target("P1").relation("attack").confidence(-0.1).build()))
                .build();

        IngestResult result = ingestor.ingest(request, PipelineConfig.defaults());

        assertThat(result.getGraph().getEdges()).containsExactly(support("P1", "C1", 0.9));
        assertThat(result.getInputEdgeCount()).isEqualTo(6);
        assertThat(result.getWarnings()).hasSize(5);
    }

    @Test
    void confidenceBoundsComeFromConfig() {
        GraphLayoutRequest request = GraphLayoutRequest.builder()
                .nodes(List.of(
                        NodeInput.builder().id("C1").role("claim").confidence(0.9).build(),
                        NodeInput.builder().id("P1").role("premise").confidence(0.2).build()))
                .build();
        PipelineConfig config = PipelineConfig.builder().minNodeConfidence(0.5).build();

        assertThat(ingestor.ingest(request, config).getGraph().getNodeIds()).containsExactly("C1");
    }

    @Test
    void nullLists_produceEmptyGraph() {
        IngestResult result = ingestor.ingest(new GraphLayoutRequest(), PipelineConfig.defaults());

        assertThat(result.getGraph().isEmpty()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
    }
}
