package com.agentite.scene.spawn;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import com.agentite.scene.model.PropValue;
import com.agentite.scene.reflect.FieldDesc;
import com.agentite.scene.reflect.FieldType;
import com.agentite.scene.world.StringPool;

import lombok.RequiredArgsConstructor;

/**
 * Reads a reflected field of a component record back into a literal value.
 * Inverse of {@link FieldValueApplier}; fields that cannot be read give {@link PropValue#NULL}.
 */
@RequiredArgsConstructor
public class FieldValueReader {

    private final StringPool strings;

    public PropValue read(byte[] record, FieldDesc field) {
        FieldType type = field.getType();
        int width = type.naturalSize();
        if (record == null || width == 0 || field.getOffset() < 0 || field.getOffset() + width > record.length) {
            return PropValue.NULL;
        }

        ByteBuffer buf = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        int at = field.getOffset();

        return switch (type) {
            case INT -> PropValue.ofInt(buf.getInt(at));
            case UINT -> PropValue.ofInt(Integer.toUnsignedLong(buf.getInt(at)));
            case FLOAT -> PropValue.ofFloat(buf.getFloat(at));
            case DOUBLE -> PropValue.ofFloat(buf.getDouble(at));
            case BOOL -> PropValue.ofBool(buf.get(at) != 0);
            case VEC2, VEC3, VEC4 -> {
                float[] components = new float[type.vectorArity()];
                for (int i = 0; i < components.length; i++) {
                    components[i] = buf.getFloat(at + i * Float.BYTES);
                }
                yield PropValue.ofVector(components);
            }
            case STRING -> {
                String text = strings.resolve(buf.getLong(at));
                yield text != null ? PropValue.ofString(text) : PropValue.NULL;
            }
            case ENTITY, INT64, UINT64 -> PropValue.ofInt(buf.getLong(at));
            case INT8 -> PropValue.ofInt(buf.get(at));
            case UINT8 -> PropValue.ofInt(Byte.toUnsignedInt(buf.get(at)));
            case INT16 -> PropValue.ofInt(buf.getShort(at));
            case UINT16 -> PropValue.ofInt(Short.toUnsignedInt(buf.getShort(at)));
            case UNKNOWN -> PropValue.NULL;
        };
    }
}
