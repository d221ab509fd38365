package com.argument.mapping.argweave.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents an edge/relationship in the argument graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    private String source;      // Source node ID
    private String target;      // Target node ID
    private String relation;    // support, attack
    private double confidence;
}
