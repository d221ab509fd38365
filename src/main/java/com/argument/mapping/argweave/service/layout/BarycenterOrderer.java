package com.argument.mapping.argweave.service.layout;

import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Crossing reduction inside layers with the barycenter heuristic, followed by a
 * grouping pass on the deepest layer so that premises of the same parent form
 * one contiguous block.
 */
@Slf4j
@Component
public class BarycenterOrderer {

    /**
     * @param nodesByLayer layer index -> node ids in insertion order; rewritten in place to the final order
     * @return node id -> order within its layer
     */
    public Map<String, Integer> order(SortedMap<Integer, List<String>> nodesByLayer,
                                      LayerAssignment layering,
                                      ArgumentGraph graph,
                                      int iterations) {
        Map<String, Integer> orders = new HashMap<>();
        nodesByLayer.values().forEach(layer -> renumber(layer, orders));

        Map<String, List<String>> upperNeighbors = new HashMap<>();
        Map<String, List<String>> lowerNeighbors = new HashMap<>();
        for (ArgumentEdge edge : graph.getEdges()) {
            if (!orders.containsKey(edge.getSource()) || !orders.containsKey(edge.getTarget())) {
                continue;
            }
            int sourceLayer = layering.layerOf(edge.getSource());
            int targetLayer = layering.layerOf(edge.getTarget());
            if (Math.abs(sourceLayer - targetLayer) != 1) {
                continue;
            }
            String upper = sourceLayer < targetLayer ? edge.getSource() : edge.getTarget();
            String lower = sourceLayer < targetLayer ? edge.getTarget() : edge.getSource();
            upperNeighbors.computeIfAbsent(lower, k -> new ArrayList<>()).add(upper);
            lowerNeighbors.computeIfAbsent(upper, k -> new ArrayList<>()).add(lower);
        }

        List<Integer> layerKeys = new ArrayList<>(nodesByLayer.keySet());
        for (int i = 0; i < iterations; i++) {
            downSweep(nodesByLayer, layerKeys, upperNeighbors, orders);
            upSweep(nodesByLayer, layerKeys, lowerNeighbors, orders);
        }

        if (layerKeys.size() > 1) {
            List<String> deepest = nodesByLayer.get(layerKeys.get(layerKeys.size() - 1));
            groupLeafLayer(deepest, graph, orders);
        }
        return orders;
    }

    private void downSweep(SortedMap<Integer, List<String>> nodesByLayer, List<Integer> layerKeys,
                           Map<String, List<String>> upperNeighbors, Map<String, Integer> orders) {
        for (int i = 1; i < layerKeys.size(); i++) {
            reorder(nodesByLayer.get(layerKeys.get(i)), upperNeighbors, orders);
        }
    }

    private void upSweep(SortedMap<Integer, List<String>> nodesByLayer, List<Integer> layerKeys,
                         Map<String, List<String>> lowerNeighbors, Map<String, Integer> orders) {
        for (int i = layerKeys.size() - 2; i >= 0; i--) {
            reorder(nodesByLayer.get(layerKeys.get(i)), lowerNeighbors, orders);
        }
    }

    private void reorder(List<String> layer, Map<String, List<String>> neighbors, Map<String, Integer> orders) {
        if (layer.size() <= 1) {
            return;
        }
        Map<String, Double> barycenters = new HashMap<>();
        for (String id : layer) {
            barycenters.put(id, barycenter(id, neighbors.getOrDefault(id, Collections.emptyList()), orders));
        }
        layer.sort(Comparator.<String>comparingDouble(barycenters::get).thenComparingInt(orders::get));
        renumber(layer, orders);
    }

    /**
     * Mean order of the neighbors; a node without neighbors keeps its current order.
     */
    double barycenter(String nodeId, List<String> neighbors, Map<String, Integer> orders) {
        if (neighbors.isEmpty()) {
            return orders.get(nodeId);
        }
        return neighbors.stream().mapToInt(orders::get).average().orElse(orders.get(nodeId));
    }

    private void groupLeafLayer(List<String> leafLayer, ArgumentGraph graph, Map<String, Integer> orders) {
        Map<String, List<String>> groups = new HashMap<>();
        Map<String, Double> groupPositions = new HashMap<>();
        List<String> orphans = new ArrayList<>();

        for (String id : leafLayer) {
            List<String> parents = graph.outgoing(id).stream()
                    .filter(ArgumentEdge::isSupport)
                    .map(ArgumentEdge::getTarget)
                    .filter(orders::containsKey)
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
            if (parents.isEmpty()) {
                orphans.add(id);
                continue;
            }
            String key = String.join(",", parents);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(id);
            groupPositions.computeIfAbsent(key, k -> parents.stream().mapToInt(orders::get).average().orElse(0));
        }

        List<String> groupKeys = new ArrayList<>(groups.keySet());
        groupKeys.sort(Comparator.<String>comparingDouble(groupPositions::get).thenComparing(Comparator.naturalOrder()));

        leafLayer.clear();
        for (String key : groupKeys) {
            List<String> members = groups.get(key);
            Collections.sort(members);
            leafLayer.addAll(members);
        }
        Collections.sort(orphans);
        leafLayer.addAll(orphans);
        renumber(leafLayer, orders);

        log.debug("Leaf layer grouped into {} block(s), {} node(s) without parent", groupKeys.size(), orphans.size());
    }

    private void renumber(List<String> layer, Map<String, Integer> orders) {
        for (int i = 0; i < layer.size(); i++) {
            orders.put(layer.get(i), i);
        }
    }
}
