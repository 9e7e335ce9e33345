package com.agentite.scene;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import com.agentite.scene.reflect.ComponentMeta;
import com.agentite.scene.reflect.FieldDesc;
import com.agentite.scene.reflect.FieldType;
import com.agentite.scene.reflect.ReflectRegistry;
import com.agentite.scene.world.EcsWorld;

/**
 * Component layouts shared by the tests.
 */
public final class TestComponents {

    public static final long POSITION = 1;
    public static final long HEALTH = 2;
    public static final long SPRITE = 3;
    public static final long STATS = 4;
    public static final long C_POSITION = 5;
    public static final long ARMOR = 6;
    public static final long VELOCITY = 7;
    public static final long FLAGS = 8;

    private TestComponents() {
    }

    public static ReflectRegistry registry() {
        ReflectRegistry reflect = new ReflectRegistry();
        reflect.register(ComponentMeta.builder().id(POSITION).name("TestPosition").size(8)
                .field(FieldDesc.of("x", FieldType.FLOAT, 0))
                .field(FieldDesc.of("y", FieldType.FLOAT, 4))
                .build());
        reflect.register(ComponentMeta.builder().id(HEALTH).name("TestHealth").size(8)
                .field(FieldDesc.of("current", FieldType.INT, 0))
                .field(FieldDesc.of("max", FieldType.INT, 4))
                .build());
        reflect.register(ComponentMeta.builder().id(SPRITE).name("TestSprite").size(8)
                .field(FieldDesc.of("texture_path", FieldType.STRING, 0))
                .build());
        reflect.register(ComponentMeta.builder().id(STATS).name("TestStats").size(12)
                .field(FieldDesc.of("strength", FieldType.INT, 0))
                .field(FieldDesc.of("defense", FieldType.INT, 4))
                .field(FieldDesc.of("speed", FieldType.FLOAT, 8))
                .build());
        reflect.register(ComponentMeta.builder().id(C_POSITION).name("C_Position").size(8)
                .field(FieldDesc.of("x", FieldType.FLOAT, 0))
                .field(FieldDesc.of("y", FieldType.FLOAT, 4))
                .build());
        reflect.register(ComponentMeta.builder().id(ARMOR).name("Armor").size(4)
                .field(FieldDesc.of("rating", FieldType.INT, 0))
                .build());
        reflect.register(ComponentMeta.builder().id(VELOCITY).name("Velocity").size(8)
                .field(FieldDesc.of("v", FieldType.VEC2, 0))
                .build());
        reflect.register(ComponentMeta.builder().id(FLAGS).name("Flags").size(4)
                .field(FieldDesc.of("visible", FieldType.BOOL, 0))
                .field(FieldDesc.of("layer", FieldType.UINT8, 1))
                .field(FieldDesc.of("order", FieldType.INT16, 2))
                .build());
        return reflect;
    }

    public static int readInt(EcsWorld world, long entity, long componentId, int offset) {
        return buffer(world, entity, componentId).getInt(offset);
    }

    public static float readFloat(EcsWorld world, long entity, long componentId, int offset) {
        return buffer(world, entity, componentId).getFloat(offset);
    }

    public static String readString(EcsWorld world, long entity, long componentId, int offset) {
        return world.strings().resolve(buffer(world, entity, componentId).getLong(offset));
    }

    private static ByteBuffer buffer(EcsWorld world, long entity, long componentId) {
        byte[] data = world.getComponent(entity, componentId);
        if (data == null) {
            throw new AssertionError("Entity " + entity + " has no component " + componentId);
        }
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }
}
