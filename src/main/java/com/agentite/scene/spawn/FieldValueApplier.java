package com.agentite.scene.spawn;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import com.agentite.scene.model.PropType;
import com.agentite.scene.model.PropValue;
import com.agentite.scene.reflect.FieldDesc;
import com.agentite.scene.reflect.FieldType;
import com.agentite.scene.world.StringPool;

import lombok.RequiredArgsConstructor;

/**
 * Writes a parsed literal into a component record according to the field's reflected type.
 *
 * Coercions:
 * <ul>
 *   <li>int: integer or float literal, floats truncated toward zero</li>
 *   <li>uint and the sized integers: integer literal, narrowed to the field width</li>
 *   <li>float, double: integer or float literal</li>
 *   <li>bool: boolean literal only</li>
 *   <li>vec2/vec3/vec4: vector literal of the same arity</li>
 *   <li>string: string or identifier literal, stored as an interned handle</li>
 * </ul>
 * Anything else, including entity and unknown fields, is refused and leaves the record untouched.
 */
@RequiredArgsConstructor
public class FieldValueApplier {

    private final StringPool strings;

    /**
     * @return true if the value was written
     */
    public boolean apply(byte[] record, FieldDesc field, PropValue value) {
        FieldType type = field.getType();
        int width = type.naturalSize();
        if (width == 0 || field.getSize() < width || field.getOffset() < 0
                || field.getOffset() + width > record.length) {
            return false;
        }

        ByteBuffer buf = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        int at = field.getOffset();
        PropType kind = value.getType();

        switch (type) {
            case INT -> {
                if (!kind.isNumber()) {
                    return false;
                }
                buf.putInt(at, kind == PropType.INT ? (int) value.getIntValue() : (int) value.getFloatValue());
            }
            case UINT -> {
                if (kind != PropType.INT) {
                    return false;
                }
                buf.putInt(at, (int) value.getIntValue());
            }
            case FLOAT -> {
                if (!kind.isNumber()) {
                    return false;
                }
                buf.putFloat(at, (float) value.asDouble());
            }
            case DOUBLE -> {
                if (!kind.isNumber()) {
                    return false;
                }
                buf.putDouble(at, value.asDouble());
            }
            case BOOL -> {
                if (kind != PropType.BOOL) {
                    return false;
                }
                buf.put(at, (byte) (value.isBoolValue() ? 1 : 0));
            }
            case VEC2, VEC3, VEC4 -> {
                if (!kind.isVector() || value.vectorSize() != type.vectorArity()) {
                    return false;
                }
                for (int i = 0; i < value.vectorSize(); i++) {
                    buf.putFloat(at + i * Float.BYTES, value.component(i));
                }
            }
            case STRING -> {
                if (!value.isText()) {
                    return false;
                }
                buf.putLong(at, strings.intern(value.getText()));
            }
            case INT8, UINT8 -> {
                if (kind != PropType.INT) {
                    return false;
                }
                buf.put(at, (byte) value.getIntValue());
            }
            case INT16, UINT16 -> {
                if (kind != PropType.INT) {
                    return false;
                }
                buf.putShort(at, (short) value.getIntValue());
            }
            case INT64, UINT64 -> {
                if (kind != PropType.INT) {
                    return false;
                }
                buf.putLong(at, value.getIntValue());
            }
            default -> {
                return false;
            }
        }
        return true;
    }
}
