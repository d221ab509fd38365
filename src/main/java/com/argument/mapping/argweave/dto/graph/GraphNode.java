package com.argument.mapping.argweave.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Laid-out node handed to the rendering frontend.
 * Compatible with vis-network fixed-position nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;
    private String role;                    // claim, premise, objection, reply, conclusion, other
    private String label;
    private String span;
    private double confidence;
    private boolean synthetic;
    private List<String> sourcePremiseIds;  // Only for synthetic nodes
    private String synthesisMethod;
    private int layer;
    private int order;
    private NodePosition position;
}
