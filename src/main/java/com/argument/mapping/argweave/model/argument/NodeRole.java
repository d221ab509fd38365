package com.argument.mapping.argweave.model.argument;

/**
 * Role of an argument component in the graph.
 *
 * CONCLUSION is never accepted from extraction; it is only reached through
 * {@link #canTransitionTo(NodeRole)} from CLAIM.
 */
public enum NodeRole {
    CLAIM("claim"),
    PREMISE("premise"),
    OBJECTION("objection"),
    REPLY("reply"),
    CONCLUSION("conclusion"),
    OTHER("other");

    private final String value;

    NodeRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Only claim -> conclusion is a legal relabeling.
     */
    public boolean canTransitionTo(NodeRole target) {
        return this == CLAIM && target == CONCLUSION;
    }

    /**
     * Roles that survive orphan removal even when isolated.
     */
    public boolean isRootCandidate() {
        return this == CLAIM || this == CONCLUSION;
    }

    /**
     * Get the enum value from a string, case-insensitive.
     */
    public static NodeRole fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase().replace(" ", "_"));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
