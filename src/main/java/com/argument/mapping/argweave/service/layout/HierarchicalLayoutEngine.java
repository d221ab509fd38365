package com.argument.mapping.argweave.service.layout;

import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Layered drawing of a validated graph: layering, crossing reduction, then coordinates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HierarchicalLayoutEngine {

    private final LayerAssigner layerAssigner;
    private final BarycenterOrderer barycenterOrderer;
    private final CrossingCounter crossingCounter;
    private final PositionAssigner positionAssigner;

    public HierarchicalLayout layout(ArgumentGraph graph, PipelineConfig config) {
        if (graph.isEmpty()) {
            return HierarchicalLayout.empty();
        }

        LayerAssignment layering = layerAssigner.assign(graph);

        SortedMap<Integer, List<String>> nodesByLayer = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : layering.getLayers().entrySet()) {
            nodesByLayer.computeIfAbsent(entry.getValue(), k -> new ArrayList<>()).add(entry.getKey());
        }

        Map<String, Integer> orders = barycenterOrderer.order(nodesByLayer, layering, graph,
                config.getBarycenterIterations());
        int crossings = crossingCounter.count(graph, layering, orders);
        Map<String, LayoutPosition> positions = positionAssigner.assign(nodesByLayer, orders, config);

        List<String> warnings = new ArrayList<>();
        if (!layering.getUnresolvedIds().isEmpty()) {
            warnings.add("Layering left " + layering.getUnresolvedIds().size()
                    + " node(s) on layer 0 because of a remaining support cycle");
        }

        SortedMap<Integer, List<String>> frozen = new TreeMap<>();
        nodesByLayer.forEach((layer, ids) -> frozen.put(layer, Collections.unmodifiableList(ids)));

        HierarchicalLayout layout = HierarchicalLayout.builder()
                .layers(layering.getLayers())
                .orders(Collections.unmodifiableMap(orders))
                .positions(Collections.unmodifiableMap(positions))
                .nodesByLayer(Collections.unmodifiableSortedMap(frozen))
                .crossingCount(crossings)
                .warnings(warnings)
                .build();

        log.info("Layout: {} layers, max width {}, {} crossings",
                layout.getLayerCount(), layout.getMaxLayerWidth(), crossings);
        return layout;
    }
}
