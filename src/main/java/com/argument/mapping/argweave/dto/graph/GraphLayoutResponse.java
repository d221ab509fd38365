package com.argument.mapping.argweave.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Main response DTO: the validated, laid-out argument graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphLayoutResponse {

    private List<GraphNode> nodes;
    private List<GraphEdge> edges;
    private GraphMetadata metadata;
}
