package com.argument.mapping.argweave.service.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Premises that support the same target and sit close together in the source text.
 */
@Value
@Builder
public class PremiseCluster {

    String clusterId;
    String targetId;
    String targetText;
    List<String> premiseIds;
    List<String> premiseTexts;
    double coherence;
    boolean fanIn;      // built from a high fan-in target rather than proximity

    public int size() {
        return premiseIds.size();
    }
}
