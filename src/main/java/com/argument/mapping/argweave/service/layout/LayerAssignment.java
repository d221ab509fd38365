package com.argument.mapping.argweave.service.layout;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class LayerAssignment {

    Map<String, Integer> layers;
    // Nodes the topological pass never reached; they fall back to layer 0
    List<String> unresolvedIds;

    public int layerOf(String nodeId) {
        return layers.getOrDefault(nodeId, 0);
    }
}
