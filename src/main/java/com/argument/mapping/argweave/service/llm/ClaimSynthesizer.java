package com.argument.mapping.argweave.service.llm;

import com.argument.mapping.argweave.service.graph.PremiseCluster;

/**
 * External collaborator that summarizes a premise cluster into one intermediate claim.
 * Implementations may block; callers apply their own timeout.
 */
public interface ClaimSynthesizer {

    SynthesizedClaim synthesize(PremiseCluster cluster);
}
