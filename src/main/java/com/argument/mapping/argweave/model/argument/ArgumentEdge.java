package com.argument.mapping.argweave.model.argument;

import lombok.Builder;
import lombok.Value;

/**
 * Directed relation between two nodes, referenced by id only.
 */
@Value
@Builder(toBuilder = true)
public class ArgumentEdge {

    String source;
    String target;
    EdgeRelation relation;
    double confidence;

    public boolean isSupport() {
        return relation == EdgeRelation.SUPPORT;
    }

    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }

    /**
     * Key of the ordered endpoint pair; at most one edge may exist per key.
     */
    public String pairKey() {
        return source + "->" + target;
    }

    public ArgumentEdge retarget(String newSource, String newTarget) {
        return toBuilder().source(newSource).target(newTarget).build();
    }

    @Override
    public String toString() {
        return source + " -" + relation.getValue() + "(" + confidence + ")-> " + target;
    }
}
