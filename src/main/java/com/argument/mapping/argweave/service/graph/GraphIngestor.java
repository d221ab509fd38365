package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.dto.graph.EdgeInput;
import com.argument.mapping.argweave.dto.graph.GraphLayoutRequest;
import com.argument.mapping.argweave.dto.graph.NodeInput;
import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Converts raw extraction output into the internal graph.
 * Malformed entries are dropped with a warning; nothing here throws on bad input.
 */
@Slf4j
@Component
public class GraphIngestor {

    private static final double DEFAULT_CONFIDENCE = 1.0;

    public IngestResult ingest(GraphLayoutRequest request, PipelineConfig config) {
        List<NodeInput> nodeInputs = request.getNodes() != null ? request.getNodes() : Collections.emptyList();
        List<EdgeInput> edgeInputs = request.getEdges() != null ? request.getEdges() : Collections.emptyList();
        List<String> warnings = new ArrayList<>();

        LinkedHashMap<String, ArgumentNode> nodes = new LinkedHashMap<>();
        for (int i = 0; i < nodeInputs.size(); i++) {
            ArgumentNode node = toNode(nodeInputs.get(i), i, config, warnings);
            if (node == null) {
                continue;
            }
            if (nodes.containsKey(node.getId())) {
                warn(warnings, "Dropped node #" + i + ": duplicate id '" + node.getId() + "'");
                continue;
            }
            nodes.put(node.getId(), node);
        }

        List<ArgumentEdge> edges = new ArrayList<>();
        for (int i = 0; i < edgeInputs.size(); i++) {
            ArgumentEdge edge = toEdge(edgeInputs.get(i), i, config, warnings);
            if (edge != null) {
                edges.add(edge);
            }
        }
        List<ArgumentEdge> collapsed = GraphEdges.collapseByPair(edges);
        if (collapsed.size() < edges.size()) {
            warn(warnings, "Collapsed " + (edges.size() - collapsed.size()) + " parallel edge(s)");
        }

        ArgumentGraph graph = ArgumentGraph.of(nodes.values(), collapsed);
        log.info("Ingested {} of {} nodes and {} of {} edges",
                graph.nodeCount(), nodeInputs.size(), graph.edgeCount(), edgeInputs.size());

        return IngestResult.builder()
                .graph(graph)
                .inputNodeCount(nodeInputs.size())
                .inputEdgeCount(edgeInputs.size())
                .warnings(warnings)
                .build();
    }

    private ArgumentNode toNode(NodeInput input, int index, PipelineConfig config, List<String> warnings) {
        if (input == null) {
            warn(warnings, "Dropped node #" + index + ": null entry");
            return null;
        }
        if (isBlank(input.getId())) {
            warn(warnings, "Dropped node #" + index + ": missing id");
            return null;
        }
        String id = input.getId().trim();
        NodeRole role = NodeRole.fromString(input.getRole());
        if (role == null) {
            warn(warnings, "Dropped node '" + id + "': unknown role '" + input.getRole() + "'");
            return null;
        }
        if (role == NodeRole.CONCLUSION) {
            warn(warnings, "Node '" + id + "' arrived as conclusion; treated as claim");
            role = NodeRole.CLAIM;
        }
        double confidence = input.getConfidence() != null ? input.getConfidence() : DEFAULT_CONFIDENCE;
        if (Double.isNaN(confidence)
                || confidence < config.getMinNodeConfidence()
                || confidence > config.getMaxNodeConfidence()) {
            warn(warnings, "Dropped node '" + id + "': confidence " + confidence + " outside ["
                    + config.getMinNodeConfidence() + ", " + config.getMaxNodeConfidence() + "]");
            return null;
        }

        String label = isBlank(input.getLabel()) ? input.getSpan() : input.getLabel();
        return ArgumentNode.builder()
                .id(id)
                .role(role)
                .label(label != null ? label : id)
                .span(input.getSpan())
                .confidence(confidence)
                .ordinal(index)
                .build();
    }

    private ArgumentEdge toEdge(EdgeInput input, int index, PipelineConfig config, List<String> warnings) {
        if (input == null) {
            warn(warnings, "Dropped edge #" + index + ": null entry");
            return null;
        }
        if (isBlank(input.getSource()) || isBlank(input.getTarget())) {
            warn(warnings, "Dropped edge #" + index + ": missing endpoint");
            return null;
        }
        String source = input.getSource().trim();
        String target = input.getTarget().trim();
        EdgeRelation relation = EdgeRelation.fromString(input.getRelation());
        if (relation == null) {
            warn(warnings, "Dropped edge " + source + "->" + target + ": unknown relation '" + input.getRelation() + "'");
            return null;
        }
        if (source.equals(target)) {
            warn(warnings, "Dropped edge " + source + "->" + target + ": self-loop");
            return null;
        }
        double confidence = input.getConfidence() != null ? input.getConfidence() : DEFAULT_CONFIDENCE;
        if (Double.isNaN(confidence)
                || confidence < config.getMinEdgeConfidence()
                || confidence > config.getMaxEdgeConfidence()) {
            warn(warnings, "Dropped edge " + source + "->" + target + ": confidence " + confidence + " outside ["
                    + config.getMinEdgeConfidence() + ", " + config.getMaxEdgeConfidence() + "]");
            return null;
        }
        return ArgumentEdge.builder()
                .source(source)
                .target(target)
                .relation(relation)
                .confidence(confidence)
                .build();
    }

    private void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
