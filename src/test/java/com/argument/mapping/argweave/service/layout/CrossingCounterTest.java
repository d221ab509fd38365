package com.argument.mapping.argweave.service.layout;

import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.argument.mapping.argweave.model.argument.ArgumentGraphFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class CrossingCounterTest {

    private final CrossingCounter crossingCounter = new CrossingCounter();

    private final ArgumentGraph graph = ArgumentGraph.of(
            List.of(claim("A", "a"), claim("B", "b"), premise("X", "x", 1), premise("Y", "y", 2)),
            List.of(support("X", "A", 0.8), support("Y", "B", 0.8), attack("X", "Y", 0.4)));

    private final LayerAssignment layering = LayerAssignment.builder()
            .layers(Map.of("A", 0, "B", 0, "X", 1, "Y", 1))
            .unresolvedIds(List.of())
            .build();

    @Test
    void countsInvertedEdgePairs() {
        int crossings = crossingCounter.count(graph, layering, Map.of("A", 0, "B", 1, "X", 1, "Y", 0));

        assertThat(crossings).isEqualTo(1);
    }

    @Test
    void parallelEdgesDoNotCross_andSameLayerEdgesAreIgnored() {
        int crossings = crossingCounter.count(graph, layering, Map.of("A", 0, "B", 1, "X", 0, "Y", 1));

        assertThat(crossings).isZero();
    }
}
