package com.agentite.scene.writer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.model.ComponentConfig;
import com.agentite.scene.model.Prefab;
import com.agentite.scene.model.PropType;
import com.agentite.scene.model.PropValue;
import com.agentite.scene.reflect.ComponentMeta;
import com.agentite.scene.reflect.FieldDesc;
import com.agentite.scene.reflect.FieldType;
import com.agentite.scene.reflect.ReflectRegistry;
import com.agentite.scene.spawn.FieldValueReader;
import com.agentite.scene.spawn.SpawnContext;
import com.agentite.scene.world.EcsWorld;

import lombok.RequiredArgsConstructor;

/**
 * Writes live entities as definition source.
 *
 * Each entity is first captured as a prefab node, reading every registered component it has
 * through the reflection registry, then rendered by {@link SceneWriter}. The position component
 * goes into the header instead of the body.
 */
@RequiredArgsConstructor
public class EntityWriter {
    private static final Logger log = LoggerFactory.getLogger(EntityWriter.class);

    private final ReflectRegistry reflect;
    private final String positionComponent;
    private final SceneWriter sceneWriter = new SceneWriter();

    public EntityWriter(ReflectRegistry reflect) {
        this(reflect, SpawnContext.DEFAULT_POSITION_COMPONENT);
    }

    public String write(EcsWorld world, long entity) {
        return sceneWriter.write(capture(world, entity));
    }

    /**
     * Write the root entities among {@code entities}; dead entities and entities with
     * a parent are skipped, since parents write their children.
     */
    public String write(EcsWorld world, List<Long> entities) {
        List<Prefab> roots = new ArrayList<>();
        for (long entity : entities) {
            if (!world.isAlive(entity) || world.getParent(entity) != EcsWorld.NULL_ENTITY) {
                continue;
            }
            roots.add(capture(world, entity));
        }
        return sceneWriter.write(roots);
    }

    /**
     * Snapshot a live entity and its descendants as a prefab tree.
     */
    public Prefab capture(EcsWorld world, long entity) {
        Prefab prefab = new Prefab(world.getName(entity));
        FieldValueReader reader = new FieldValueReader(world.strings());

        for (ComponentMeta meta : reflect.getAll()) {
            if (meta.getName().equals(positionComponent)) {
                readPosition(world, entity, meta, prefab);
                continue;
            }
            byte[] record = world.getComponent(entity, meta.getId());
            if (record == null) {
                continue;
            }
            if (prefab.getComponentCount() >= Prefab.MAX_COMPONENTS) {
                log.warn("Entity {} has more than {} components, '{}' not written",
                        entity, Prefab.MAX_COMPONENTS, meta.getName());
                continue;
            }
            prefab.addComponent(toConfig(meta, record, reader));
        }

        for (long child : world.getChildren(entity)) {
            if (!world.isAlive(child)) {
                continue;
            }
            if (prefab.getChildCount() >= Prefab.MAX_CHILDREN) {
                log.warn("Entity {} has more than {} children, the rest are not written", entity, Prefab.MAX_CHILDREN);
                break;
            }
            prefab.addChild(capture(world, child));
        }
        return prefab;
    }

    private ComponentConfig toConfig(ComponentMeta meta, byte[] record, FieldValueReader reader) {
        if (meta.getFieldCount() == 1) {
            PropValue value = reader.read(record, meta.firstField());
            return value.getType() == PropType.NULL
                    ? new ComponentConfig(meta.getName())
                    : ComponentConfig.shorthand(meta.getName(), value);
        }

        ComponentConfig config = new ComponentConfig(meta.getName());
        for (FieldDesc field : meta.getFields()) {
            PropValue value = reader.read(record, field);
            if (value.getType() != PropType.NULL) {
                config.addField(field.getName(), value);
            }
        }
        return config;
    }

    private void readPosition(EcsWorld world, long entity, ComponentMeta meta, Prefab prefab) {
        byte[] record = world.getComponent(entity, meta.getId());
        if (record == null) {
            return;
        }
        Optional<FieldDesc> x = meta.findField("x").or(() -> fieldAt(meta, 0));
        Optional<FieldDesc> y = meta.findField("y").or(() -> fieldAt(meta, 1));
        if (x.isEmpty() || y.isEmpty() || !readable(x.get(), record) || !readable(y.get(), record)) {
            return;
        }
        ByteBuffer buf = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        prefab.setOffset(buf.getFloat(x.get().getOffset()), buf.getFloat(y.get().getOffset()));
    }

    private static Optional<FieldDesc> fieldAt(ComponentMeta meta, int index) {
        return index < meta.getFieldCount() ? Optional.of(meta.getFields().get(index)) : Optional.empty();
    }

    private static boolean readable(FieldDesc field, byte[] record) {
        return field.getType() == FieldType.FLOAT
                && field.getOffset() >= 0
                && field.getOffset() + Float.BYTES <= record.length;
    }
}
