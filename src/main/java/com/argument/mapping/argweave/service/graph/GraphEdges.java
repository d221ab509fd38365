package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.argument.ArgumentEdge;

import java.util.*;

/**
 * Edge list helpers shared by the pipeline stages.
 */
final class GraphEdges {

    private GraphEdges() {
    }

    /**
     * Keep one edge per ordered (source, target) pair: the highest-confidence one.
     * The survivor takes the slot of the first edge seen for that pair; ties keep the first.
     */
    static List<ArgumentEdge> collapseByPair(List<ArgumentEdge> edges) {
        LinkedHashMap<String, ArgumentEdge> byPair = new LinkedHashMap<>();
        for (ArgumentEdge edge : edges) {
            byPair.merge(edge.pairKey(), edge,
                    (kept, candidate) -> candidate.getConfidence() > kept.getConfidence() ? candidate : kept);
        }
        return new ArrayList<>(byPair.values());
    }

    /**
     * Support adjacency (source -> outgoing support edges) in edge-list order.
     */
    static Map<String, List<ArgumentEdge>> supportAdjacency(List<ArgumentEdge> edges) {
        Map<String, List<ArgumentEdge>> adjacency = new LinkedHashMap<>();
        for (ArgumentEdge edge : edges) {
            if (edge.isSupport()) {
                adjacency.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
            }
        }
        return adjacency;
    }
}
