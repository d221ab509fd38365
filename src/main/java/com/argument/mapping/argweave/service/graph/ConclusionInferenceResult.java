package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.dto.graph.ConclusionScore;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConclusionInferenceResult {

    ArgumentGraph graph;
    List<ConclusionScore> scores;       // every claim considered, best first
    List<String> selectedIds;
    int edgesRemoved;
    List<String> orphanedIds;           // non-claims isolated by the edge removal

    public int getOrphansRemoved() {
        return orphanedIds == null ? 0 : orphanedIds.size();
    }
}
