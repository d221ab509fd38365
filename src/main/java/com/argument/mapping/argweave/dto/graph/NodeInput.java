package com.argument.mapping.argweave.dto.graph;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Argument component as produced by the extraction step.
 * Fields are loosely validated; bad entries are dropped during ingest, not rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeInput {

    private String id;
    @JsonAlias("type")
    private String role;        // claim, premise, objection, reply, other
    private String label;       // Short title
    private String span;        // Original text
    private Double confidence;  // Classification confidence, 1.0 when absent
}
