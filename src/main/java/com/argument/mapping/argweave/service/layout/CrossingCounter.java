package com.argument.mapping.argweave.service.layout;

import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Diagnostic only: counts pairs of edges that cross between the same two layers.
 * Edges inside a single layer are ignored.
 */
@Component
public class CrossingCounter {

    public int count(ArgumentGraph graph, LayerAssignment layering, Map<String, Integer> orders) {
        Map<String, List<int[]>> segmentsByLayerPair = new LinkedHashMap<>();
        for (ArgumentEdge edge : graph.getEdges()) {
            if (!orders.containsKey(edge.getSource()) || !orders.containsKey(edge.getTarget())) {
                continue;
            }
            int sourceLayer = layering.layerOf(edge.getSource());
            int targetLayer = layering.layerOf(edge.getTarget());
            if (sourceLayer == targetLayer) {
                continue;
            }
            boolean sourceOnTop = sourceLayer < targetLayer;
            String upper = sourceOnTop ? edge.getSource() : edge.getTarget();
            String lower = sourceOnTop ? edge.getTarget() : edge.getSource();
            String pair = Math.min(sourceLayer, targetLayer) + ":" + Math.max(sourceLayer, targetLayer);
            segmentsByLayerPair.computeIfAbsent(pair, k -> new ArrayList<>())
                    .add(new int[]{orders.get(upper), orders.get(lower)});
        }

        int crossings = 0;
        for (List<int[]> segments : segmentsByLayerPair.values()) {
            for (int i = 0; i < segments.size(); i++) {
                for (int j = i + 1; j < segments.size(); j++) {
                    int[] a = segments.get(i);
                    int[] b = segments.get(j);
                    if ((a[0] < b[0] && a[1] > b[1]) || (a[0] > b[0] && a[1] < b[1])) {
                        crossings++;
                    }
                }
            }
        }
        return crossings;
    }
}
