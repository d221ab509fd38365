package com.argument.mapping.argweave.service.layout;

import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Longest-path layering over the support relation.
 *
 * A support edge u -> v makes v the parent of u, so roots are the nodes that support
 * nothing and every premise ends up strictly below what it supports.
 * Runs Kahn's algorithm from the roots in O(V + E).
 */
@Slf4j
@Component
public class LayerAssigner {

    public LayerAssignment assign(ArgumentGraph graph) {
        Map<String, List<String>> children = new HashMap<>();
        Map<String, Integer> pendingParents = new HashMap<>();
        for (String id : graph.getNodeIds()) {
            pendingParents.put(id, 0);
        }
        for (ArgumentEdge edge : graph.supportEdges()) {
            if (!graph.containsNode(edge.getSource()) || !graph.containsNode(edge.getTarget())) {
                continue;
            }
            children.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge.getSource());
            pendingParents.merge(edge.getSource(), 1, Integer::sum);
        }

        Map<String, Integer> layers = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String id : graph.getNodeIds()) {
            if (pendingParents.get(id) == 0) {
                layers.put(id, 0);
                queue.add(id);
            }
        }

        while (!queue.isEmpty()) {
            String parent = queue.poll();
            int parentLayer = layers.get(parent);
            for (String child : children.getOrDefault(parent, Collections.emptyList())) {
                layers.merge(child, parentLayer + 1, Math::max);
                int remaining = pendingParents.merge(child, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(child);
                }
            }
        }

        // Only reachable when the support relation still has a cycle
        List<String> unresolved = new ArrayList<>();
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String id : graph.getNodeIds()) {
            Integer layer = layers.get(id);
            if (layer == null || pendingParents.get(id) > 0) {
                unresolved.add(id);
                layer = 0;
            }
            ordered.put(id, layer);
        }
        if (!unresolved.isEmpty()) {
            log.warn("Layering could not resolve {} node(s), placed on layer 0: {}", unresolved.size(), unresolved);
        }

        return LayerAssignment.builder()
                .layers(Collections.unmodifiableMap(ordered))
                .unresolvedIds(Collections.unmodifiableList(unresolved))
                .build();
    }
}
