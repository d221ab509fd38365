package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class RewireResult {

    ArgumentGraph graph;
    boolean enabled;
    int clustersFound;
    List<String> syntheticNodeIds;
    Map<String, Integer> skipReasons;   // reason -> number of clusters skipped for it
}
