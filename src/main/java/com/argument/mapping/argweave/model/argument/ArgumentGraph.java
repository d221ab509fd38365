package com.argument.mapping.argweave.model.argument;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable argument graph: an id-indexed node table plus an edge list that
 * references nodes by id. Every mutation returns a new graph, so a stage that
 * fails halfway never leaves a caller holding a partially edited instance.
 */
public final class ArgumentGraph {

    private static final ArgumentGraph EMPTY = new ArgumentGraph(new LinkedHashMap<>(), new ArrayList<>());

    private final Map<String, ArgumentNode> nodes;
    private final List<ArgumentEdge> edges;

    private ArgumentGraph(LinkedHashMap<String, ArgumentNode> nodes, List<ArgumentEdge> edges) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableList(edges);
    }

    public static ArgumentGraph empty() {
        return EMPTY;
    }

    /**
     * Build a graph from nodes in insertion order. Later nodes with an id that was
     * already seen are ignored.
     */
    public static ArgumentGraph of(Collection<ArgumentNode> nodes, Collection<ArgumentEdge> edges) {
        LinkedHashMap<String, ArgumentNode> table = new LinkedHashMap<>();
        for (ArgumentNode node : nodes) {
            table.putIfAbsent(node.getId(), node);
        }
        return new ArgumentGraph(table, new ArrayList<>(edges));
    }

    public Collection<ArgumentNode> getNodes() {
        return nodes.values();
    }

    public List<String> getNodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<ArgumentEdge> getEdges() {
        return edges;
    }

    public Optional<ArgumentNode> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public ArgumentNode getNode(String id) {
        ArgumentNode node = nodes.get(id);
        if (node == null) {
            throw new NoSuchElementException("Unknown node id: " + id);
        }
        return node;
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<ArgumentEdge> supportEdges() {
        return edges.stream().filter(ArgumentEdge::isSupport).collect(Collectors.toList());
    }

    public List<ArgumentEdge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.getSource().equals(nodeId)).collect(Collectors.toList());
    }

    public List<ArgumentEdge> incoming(String nodeId) {
        return edges.stream().filter(e -> e.getTarget().equals(nodeId)).collect(Collectors.toList());
    }

    public ArgumentGraph withEdges(List<ArgumentEdge> newEdges) {
        return new ArgumentGraph(new LinkedHashMap<>(nodes), new ArrayList<>(newEdges));
    }

    public ArgumentGraph filterEdges(Predicate<ArgumentEdge> keep) {
        return withEdges(edges.stream().filter(keep).collect(Collectors.toList()));
    }

    /**
     * Replace nodes by id, keeping their slot in the insertion order.
     */
    public ArgumentGraph replaceNodes(Collection<ArgumentNode> replacements) {
        LinkedHashMap<String, ArgumentNode> table = new LinkedHashMap<>(nodes);
        for (ArgumentNode node : replacements) {
            if (table.containsKey(node.getId())) {
                table.put(node.getId(), node);
            }
        }
        return new ArgumentGraph(table, new ArrayList<>(edges));
    }

    /**
     * Append new nodes and edges. Nodes whose id already exists are ignored.
     */
    public ArgumentGraph extend(Collection<ArgumentNode> extraNodes, Collection<ArgumentEdge> newEdges) {
        LinkedHashMap<String, ArgumentNode> table = new LinkedHashMap<>(nodes);
        for (ArgumentNode node : extraNodes) {
            table.putIfAbsent(node.getId(), node);
        }
        return new ArgumentGraph(table, new ArrayList<>(newEdges));
    }

    /**
     * Remove nodes by id together with every edge that touches them.
     */
    public ArgumentGraph withoutNodes(Set<String> removedIds) {
        if (removedIds.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, ArgumentNode> table = new LinkedHashMap<>(nodes);
        table.keySet().removeAll(removedIds);
        List<ArgumentEdge> kept = edges.stream()
                .filter(e -> !removedIds.contains(e.getSource()) && !removedIds.contains(e.getTarget()))
                .collect(Collectors.toList());
        return new ArgumentGraph(table, kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArgumentGraph)) return false;
        ArgumentGraph other = (ArgumentGraph) o;
        return new ArrayList<>(nodes.values()).equals(new ArrayList<>(other.nodes.values()))
                && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(new ArrayList<>(nodes.values()), edges);
    }

    @Override
    public String toString() {
        return "ArgumentGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
