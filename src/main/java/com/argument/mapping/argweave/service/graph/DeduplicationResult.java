package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class DeduplicationResult {

    ArgumentGraph graph;
    Map<String, String> mergedIds;  // removed id -> surviving id
    int selfLoopsDropped;
    int edgesCollapsed;

    public int getMergeCount() {
        return mergedIds.size();
    }
}
