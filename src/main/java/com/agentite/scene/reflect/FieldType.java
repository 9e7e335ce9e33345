package com.agentite.scene.reflect;

/**
 * Semantic type of a reflected component field, with its natural byte size.
 */
public enum FieldType {
    INT("int", 4),
    UINT("uint", 4),
    FLOAT("float", 4),
    DOUBLE("double", 8),
    BOOL("bool", 1),
    VEC2("vec2", 8),
    VEC3("vec3", 12),
    VEC4("vec4", 16),
    /** Interned string handle, see {@code StringPool}. */
    STRING("string", 8),
    ENTITY("entity", 8),
    INT8("int8", 1),
    UINT8("uint8", 1),
    INT16("int16", 2),
    UINT16("uint16", 2),
    INT64("int64", 8),
    UINT64("uint64", 8),
    UNKNOWN("unknown", 0);

    private final String typeName;
    private final int naturalSize;

    FieldType(String typeName, int naturalSize) {
        this.typeName = typeName;
        this.naturalSize = naturalSize;
    }

    public String typeName() {
        return typeName;
    }

    public int naturalSize() {
        return naturalSize;
    }

    public int vectorArity() {
        return switch (this) {
            case VEC2 -> 2;
            case VEC3 -> 3;
            case VEC4 -> 4;
            default -> 0;
        };
    }

    public static FieldType fromTypeName(String name) {
        for (FieldType type : values()) {
            if (type.typeName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
