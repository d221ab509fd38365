package com.argument.mapping.argweave.service.layout;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Result of the layout stage: layer, order and position per node.
 */
@Value
@Builder
public class HierarchicalLayout {

    Map<String, Integer> layers;
    Map<String, Integer> orders;
    Map<String, LayoutPosition> positions;
    SortedMap<Integer, List<String>> nodesByLayer;
    int crossingCount;
    List<String> warnings;

    public static HierarchicalLayout empty() {
        return HierarchicalLayout.builder()
                .layers(Collections.emptyMap())
                .orders(Collections.emptyMap())
                .positions(Collections.emptyMap())
                .nodesByLayer(new TreeMap<>())
                .crossingCount(0)
                .warnings(Collections.emptyList())
                .build();
    }

    public int getLayerCount() {
        return nodesByLayer.size();
    }

    public int getMaxLayerWidth() {
        return nodesByLayer.values().stream().mapToInt(List::size).max().orElse(0);
    }

    public int layerOf(String nodeId) {
        return layers.getOrDefault(nodeId, 0);
    }

    public int orderOf(String nodeId) {
        return orders.getOrDefault(nodeId, 0);
    }
}
