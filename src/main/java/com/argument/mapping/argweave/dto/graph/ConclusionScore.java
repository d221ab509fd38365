package com.argument.mapping.argweave.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Score breakdown of one claim considered for conclusion promotion.
 * Exposed for explainability only; nothing downstream depends on it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConclusionScore {

    private String nodeId;
    private int incomingSupportCount;
    private int distinctSources;
    private int outgoingSupportCount;
    private double sinkBonus;
    private double score;
    private boolean eligible;
    private boolean selected;
    private String reasoning;
}
