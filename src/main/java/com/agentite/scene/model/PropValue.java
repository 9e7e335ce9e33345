package com.agentite.scene.model;

import java.util.Arrays;
import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Immutable literal value of a component field.
 *
 * Exactly one variant is active, selected by {@link #getType()}. Strings and bare identifiers
 * are distinct kinds: {@code "idle"} is a STRING, {@code idle} an IDENTIFIER.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class PropValue {

    public static final PropValue NULL = new PropValue(PropType.NULL, 0L, 0.0, false, null, null);

    private final PropType type;
    private final long intValue;
    private final double floatValue;
    private final boolean boolValue;
    private final String text;
    @Getter(AccessLevel.NONE)
    private final float[] vector;

    public static PropValue ofInt(long value) {
        return new PropValue(PropType.INT, value, 0.0, false, null, null);
    }

    public static PropValue ofFloat(double value) {
        return new PropValue(PropType.FLOAT, 0L, value, false, null, null);
    }

    public static PropValue ofBool(boolean value) {
        return new PropValue(PropType.BOOL, 0L, 0.0, value, null, null);
    }

    public static PropValue ofString(String value) {
        return new PropValue(PropType.STRING, 0L, 0.0, false, Objects.requireNonNull(value, "value"), null);
    }

    public static PropValue ofIdentifier(String value) {
        return new PropValue(PropType.IDENTIFIER, 0L, 0.0, false, Objects.requireNonNull(value, "value"), null);
    }

    /**
     * Vector literal with 2, 3 or 4 components.
     */
    public static PropValue ofVector(float... components) {
        PropType type = PropType.vectorOf(components.length);
        if (type == null) {
            throw new IllegalArgumentException("Vector must have 2-4 components, got " + components.length);
        }
        return new PropValue(type, 0L, 0.0, false, null, components.clone());
    }

    public float[] getVector() {
        return vector != null ? vector.clone() : null;
    }

    public int vectorSize() {
        return vector != null ? vector.length : 0;
    }

    public float component(int index) {
        return vector[index];
    }

    /**
     * Numeric view of an INT or FLOAT value.
     */
    public double asDouble() {
        return type == PropType.INT ? intValue : floatValue;
    }

    public boolean isText() {
        return type == PropType.STRING || type == PropType.IDENTIFIER;
    }

    @Override
    public String toString() {
        return switch (type) {
            case NULL -> "null";
            case INT -> Long.toString(intValue);
            case FLOAT -> Double.toString(floatValue);
            case BOOL -> Boolean.toString(boolValue);
            case STRING -> "\"" + text + "\"";
            case IDENTIFIER -> text;
            case VEC2, VEC3, VEC4 -> Arrays.toString(vector);
        };
    }
}
