package com.argument.mapping.argweave.model.argument;

public enum EdgeRelation {
    SUPPORT("support"),
    ATTACK("attack");

    private final String value;

    EdgeRelation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EdgeRelation fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
