package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestResult {

    ArgumentGraph graph;
    int inputNodeCount;
    int inputEdgeCount;
    List<String> warnings;
}
