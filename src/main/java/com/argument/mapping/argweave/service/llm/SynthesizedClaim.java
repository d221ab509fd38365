package com.argument.mapping.argweave.service.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reply of the claim synthesizer for one premise cluster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SynthesizedClaim {

    private String text;        // Summary claim
    private String label;       // Optional short title
    private boolean coherent;   // Whether the premises share a theme at all
    private double confidence;
    private String reasoning;
}
