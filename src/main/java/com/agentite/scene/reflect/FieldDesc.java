package com.agentite.scene.reflect;

import lombok.NonNull;
import lombok.Value;

/**
 * Layout of one field inside a component record.
 */
@Value
public class FieldDesc {
    @NonNull
    String name;
    @NonNull
    FieldType type;
    int offset;
    int size;

    /**
     * Field sized by its type's natural size.
     */
    public static FieldDesc of(String name, FieldType type, int offset) {
        return new FieldDesc(name, type, offset, type.naturalSize());
    }

    public boolean fitsIn(int bufferSize) {
        return offset >= 0 && size > 0 && offset + size <= bufferSize;
    }
}
