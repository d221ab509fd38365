package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Repairs structural problems in a deduplicated graph, in a fixed order:
 * 1. edges pointing at unknown nodes are dropped
 * 2. support cycles are broken by removing the weakest edge of each cycle found
 * 3. isolated nodes are removed, except claims and conclusions
 *
 * The result is a DAG on its support edges. Running the validator on its own
 * output changes nothing.
 */
@Service
@Slf4j
public class ConsistencyValidator {

    private static final Comparator<ArgumentEdge> WEAKEST_FIRST = Comparator
            .comparingDouble(ArgumentEdge::getConfidence)
            .thenComparing(ArgumentEdge::getSource)
            .thenComparing(ArgumentEdge::getTarget);

    public ValidationResult validate(ArgumentGraph graph) {
        // 1. Referential integrity
        List<ArgumentEdge> referenced = graph.getEdges().stream()
                .filter(e -> graph.containsNode(e.getSource()) && graph.containsNode(e.getTarget()))
                .collect(Collectors.toList());
        int dangling = graph.edgeCount() - referenced.size();
        if (dangling > 0) {
            log.warn("Dropped {} edges referencing unknown nodes", dangling);
        }
        ArgumentGraph current = graph.withEdges(referenced);

        // 2. Support cycles. Each pass removes one edge, so this ends within edgeCount passes.
        List<String> removedCycleEdges = new ArrayList<>();
        int remainingPasses = current.edgeCount();
        List<ArgumentEdge> cycle = findSupportCycle(current);
        while (!cycle.isEmpty() && remainingPasses-- > 0) {
            ArgumentEdge weakest = Collections.min(cycle, WEAKEST_FIRST);
            log.info("Breaking support cycle {} by removing {}", describeCycle(cycle), weakest);
            current = current.filterEdges(e -> !e.equals(weakest));
            removedCycleEdges.add(weakest.toString());
            cycle = findSupportCycle(current);
        }

        // 3. Orphans
        Set<String> connected = new HashSet<>();
        for (ArgumentEdge edge : current.getEdges()) {
            connected.add(edge.getSource());
            connected.add(edge.getTarget());
        }
        List<String> orphans = current.getNodes().stream()
                .filter(n -> !connected.contains(n.getId()))
                .filter(n -> !n.getRole().isRootCandidate())
                .map(ArgumentNode::getId)
                .collect(Collectors.toList());
        if (!orphans.isEmpty()) {
            log.info("Removing {} orphan nodes: {}", orphans.size(), orphans);
            current = current.withoutNodes(new LinkedHashSet<>(orphans));
        }

        return ValidationResult.builder()
                .graph(current)
                .danglingEdgesDropped(dangling)
                .removedCycleEdges(Collections.unmodifiableList(removedCycleEdges))
                .removedOrphanIds(Collections.unmodifiableList(orphans))
                .build();
    }

    // ========================= DFS CYCLE DETECTION =========================

    /**
     * Find the first support cycle reachable in node insertion order.
     * Returns the cycle's edges in path order, or an empty list for a DAG.
     */
    List<ArgumentEdge> findSupportCycle(ArgumentGraph graph) {
        Map<String, List<ArgumentEdge>> adjacency = GraphEdges.supportAdjacency(graph.getEdges());
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();
        Deque<ArgumentEdge> path = new ArrayDeque<>();

        for (String nodeId : graph.getNodeIds()) {
            if (!visited.contains(nodeId)) {
                List<ArgumentEdge> cycle = dfs(nodeId, adjacency, visited, inStack, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return Collections.emptyList();
    }

    private List<ArgumentEdge> dfs(String node, Map<String, List<ArgumentEdge>> adjacency,
                                   Set<String> visited, Set<String> inStack, Deque<ArgumentEdge> path) {
        visited.add(node);
        inStack.add(node);

        for (ArgumentEdge edge : adjacency.getOrDefault(node, Collections.emptyList())) {
            String next = edge.getTarget();
            if (inStack.contains(next)) {
                return reconstructCycle(next, edge, path);
            }
            if (!visited.contains(next)) {
                path.addLast(edge);
                List<ArgumentEdge> cycle = dfs(next, adjacency, visited, inStack, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
                path.removeLast();
            }
        }

        inStack.remove(node);
        return Collections.emptyList();
    }

    private List<ArgumentEdge> reconstructCycle(String start, ArgumentEdge closing, Deque<ArgumentEdge> path) {
        List<ArgumentEdge> cycle = new ArrayList<>();
        if (!closing.getSource().equals(start)) {
            Iterator<ArgumentEdge> backwards = path.descendingIterator();
            while (backwards.hasNext()) {
                ArgumentEdge edge = backwards.next();
                cycle.add(edge);
                if (edge.getSource().equals(start)) {
                    break;
                }
            }
            Collections.reverse(cycle);
        }
        cycle.add(closing);
        return cycle;
    }

    private String describeCycle(List<ArgumentEdge> cycle) {
        List<String> ids = cycle.stream().map(ArgumentEdge::getSource).collect(Collectors.toList());
        ids.add(cycle.get(cycle.size() - 1).getTarget());
        return String.join(" -> ", ids);
    }
}
