package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.dto.graph.GraphEdge;
import com.argument.mapping.argweave.dto.graph.GraphNode;
import com.argument.mapping.argweave.dto.graph.NodePosition;
import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import com.argument.mapping.argweave.service.layout.HierarchicalLayout;
import com.argument.mapping.argweave.service.layout.LayoutPosition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps the final graph and its layout to response DTOs.
 */
@Component
public class ArgumentGraphMapper {

    public List<GraphNode> toNodes(ArgumentGraph graph, HierarchicalLayout layout) {
        return graph.getNodes().stream()
                .map(node -> toNode(node, layout))
                .sorted(Comparator.comparingInt(GraphNode::getLayer).thenComparingInt(GraphNode::getOrder))
                .collect(Collectors.toList());
    }

    public List<GraphEdge> toEdges(ArgumentGraph graph) {
        return graph.getEdges().stream()
                .map(this::toEdge)
                .collect(Collectors.toList());
    }

    private GraphNode toNode(ArgumentNode node, HierarchicalLayout layout) {
        LayoutPosition position = layout.getPositions().get(node.getId());
        return GraphNode.builder()
                .id(node.getId())
                .role(node.getRole().getValue())
                .label(node.getLabel())
                .span(node.getSpan())
                .confidence(node.getConfidence())
                .synthetic(node.isSynthetic())
                .sourcePremiseIds(node.isSynthetic() ? new ArrayList<>(node.getSourcePremiseIds()) : null)
                .synthesisMethod(node.getSynthesisMethod())
                .layer(layout.layerOf(node.getId()))
                .order(layout.orderOf(node.getId()))
                .position(position != null
                        ? NodePosition.builder().x(position.getX()).y(position.getY()).build()
                        : NodePosition.builder().build())
                .build();
    }

    private GraphEdge toEdge(ArgumentEdge edge) {
        return GraphEdge.builder()
                .source(edge.getSource())
                .target(edge.getTarget())
                .relation(edge.getRelation().getValue())
                .confidence(edge.getConfidence())
                .build();
    }
}
