package com.argument.mapping.argweave.service.layout;

import com.argument.mapping.argweave.model.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class PositionAssignerTest {

    private final PositionAssigner positionAssigner = new PositionAssigner();

    @Test
    void centersEachLayer_andDerivesYFromLayerOnly() {
        SortedMap<Integer, List<String>> nodesByLayer = new TreeMap<>(Map.of(
                0, List.of("C1"),
                1, List.of("P1", "P2", "P3")));
        Map<String, Integer> orders = Map.of("C1", 0, "P1", 0, "P2", 1, "P3", 2);

        Map<String, LayoutPosition> positions = positionAssigner.assign(nodesByLayer, orders, PipelineConfig.defaults());

        assertThat(positions.get("C1")).isEqualTo(new LayoutPosition(0, 0));
        assertThat(positions.get("P1")).isEqualTo(new LayoutPosition(-250, 200));
        assertThat(positions.get("P2")).isEqualTo(new LayoutPosition(0, 200));
        assertThat(positions.get("P3")).isEqualTo(new LayoutPosition(250, 200));
    }

    @Test
    void evenWidthLayer_isSymmetricAroundZero() {
        SortedMap<Integer, List<String>> nodesByLayer = new TreeMap<>(Map.of(2, List.of("A", "B")));
        PipelineConfig config = PipelineConfig.builder().siblingSpacing(100).layerSpacing(50).build();

        Map<String, LayoutPosition> positions = positionAssigner.assign(nodesByLayer, Map.of("A", 0, "B", 1), config);

        assertThat(positions.get("A")).isEqualTo(new LayoutPosition(-50, 100));
        assertThat(positions.get("B")).isEqualTo(new LayoutPosition(50, 100));
    }
}
