package com.agentite.scene.reflect;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Locale;

import com.agentite.scene.world.StringPool;

import lombok.experimental.UtilityClass;

/**
 * Renders the current value of a reflected field as human-readable text,
 * for inspection and debugging output.
 */
@UtilityClass
public class FieldFormatter {

    private static final int MAX_HEX_BYTES = 8;

    public static String format(FieldDesc field, byte[] data, StringPool strings) {
        if (data == null) {
            return "(null)";
        }
        if (field.getType() != FieldType.UNKNOWN && !fits(field, data)) {
            return "(out of range)";
        }

        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        int at = field.getOffset();

        return switch (field.getType()) {
            case INT -> Integer.toString(buf.getInt(at));
            case UINT -> Integer.toUnsignedString(buf.getInt(at));
            case FLOAT -> String.format(Locale.ROOT, "%.3f", buf.getFloat(at));
            case DOUBLE -> String.format(Locale.ROOT, "%.6f", buf.getDouble(at));
            case BOOL -> buf.get(at) != 0 ? "true" : "false";
            case VEC2, VEC3, VEC4 -> formatVector(buf, at, field.getType().vectorArity());
            case STRING -> formatString(buf.getLong(at), strings);
            case ENTITY -> {
                long entity = buf.getLong(at);
                yield entity == 0 ? "(none)" : Long.toUnsignedString(entity);
            }
            case INT8 -> Byte.toString(buf.get(at));
            case UINT8 -> Integer.toString(Byte.toUnsignedInt(buf.get(at)));
            case INT16 -> Short.toString(buf.getShort(at));
            case UINT16 -> Integer.toString(Short.toUnsignedInt(buf.getShort(at)));
            case INT64 -> Long.toString(buf.getLong(at));
            case UINT64 -> Long.toUnsignedString(buf.getLong(at));
            case UNKNOWN -> formatHex(data, field);
        };
    }

    private static boolean fits(FieldDesc field, byte[] data) {
        int needed = field.getType().naturalSize();
        return field.getOffset() >= 0 && field.getOffset() + needed <= data.length;
    }

    private static String formatVector(ByteBuffer buf, int at, int arity) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < arity; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(String.format(Locale.ROOT, "%.2f", buf.getFloat(at + i * Float.BYTES)));
        }
        return sb.append(')').toString();
    }

    private static String formatString(long handle, StringPool strings) {
        String value = strings != null ? strings.resolve(handle) : null;
        return value != null ? "\"" + value + "\"" : "(null)";
    }

    private static String formatHex(byte[] data, FieldDesc field) {
        StringBuilder sb = new StringBuilder();
        int shown = Math.min(field.getSize(), MAX_HEX_BYTES);
        for (int i = 0; i < shown && field.getOffset() >= 0 && field.getOffset() + i < data.length; i++) {
            sb.append(String.format("%02X ", data[field.getOffset() + i]));
        }
        if (field.getSize() > MAX_HEX_BYTES) {
            sb.append("...");
        }
        return sb.toString().trim();
    }
}
