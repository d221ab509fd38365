package com.argument.mapping.argweave.model.argument;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable argument component. Identity never changes; the role may only move
 * from CLAIM to CONCLUSION through {@link #promoteToConclusion()}.
 */
@Value
@Builder(toBuilder = true)
public class ArgumentNode {

    String id;
    NodeRole role;
    String label;
    String span;
    double confidence;

    // Position of the node in the extraction input, used as a proximity signal
    int ordinal;

    boolean synthetic;
    @Singular
    List<String> sourcePremiseIds;
    String synthesisMethod;

    /**
     * Text used for similarity checks: the span when present, the label otherwise.
     */
    public String comparableText() {
        if (span != null && !span.isBlank()) {
            return span;
        }
        return label;
    }

    public ArgumentNode promoteToConclusion() {
        if (!role.canTransitionTo(NodeRole.CONCLUSION)) {
            throw new IllegalStateException("Illegal role transition for node " + id + ": "
                    + role.getValue() + " -> " + NodeRole.CONCLUSION.getValue());
        }
        return toBuilder().role(NodeRole.CONCLUSION).build();
    }
}
