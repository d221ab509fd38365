package com.argument.mapping.argweave.dto.graph;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to build and lay out an argument graph from extracted components.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphLayoutRequest {

    private List<NodeInput> nodes;
    private List<EdgeInput> edges;

    @Valid
    private PipelineOptions options;
}
