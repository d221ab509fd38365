package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ValidationResult {

    ArgumentGraph graph;
    int danglingEdgesDropped;
    List<String> removedCycleEdges;     // "source -support-> target" per broken cycle
    List<String> removedOrphanIds;

    public int getCyclesRemoved() {
        return removedCycleEdges.size();
    }

    public int getOrphansRemoved() {
        return removedOrphanIds.size();
    }
}
