package com.agentite.scene.model;

/**
 * Kind of a parsed property value.
 */
public enum PropType {
    NULL,
    INT,
    FLOAT,
    BOOL,
    STRING,
    VEC2,
    VEC3,
    VEC4,
    IDENTIFIER;

    public boolean isVector() {
        return this == VEC2 || this == VEC3 || this == VEC4;
    }

    public boolean isNumber() {
        return this == INT || this == FLOAT;
    }

    /**
     * Vector type for the given component count, or null when the count is not 2 to 4.
     */
    public static PropType vectorOf(int components) {
        return switch (components) {
            case 2 -> VEC2;
            case 3 -> VEC3;
            case 4 -> VEC4;
            default -> null;
        };
    }
}
