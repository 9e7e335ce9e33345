package com.agentite.scene.spawn;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.model.ComponentConfig;
import com.agentite.scene.model.FieldAssign;
import com.agentite.scene.model.Prefab;
import com.agentite.scene.reflect.ComponentMeta;
import com.agentite.scene.reflect.FieldDesc;
import com.agentite.scene.reflect.FieldType;
import com.agentite.scene.world.EcsWorld;

/**
 * Turns a prefab tree into live entities.
 *
 * For each node: create the entity, attach it to the context parent, apply the base prefab's
 * components, apply the node's own components, write the position component and recurse into
 * the children. Every component config is written into a zeroed record that replaces the whole
 * component, so a later config of the same component discards the earlier one's fields. A
 * {@code value} field always targets the component's first field. A root is placed at the context offset plus its declared offset;
 * a child gets exactly its declared offset, which is relative to its parent.
 *
 * Unknown components, unknown fields and mismatched values are skipped. An entity that cannot
 * be created yields {@link EcsWorld#NULL_ENTITY} for that branch; entities already created stay.
 */
public class PrefabSpawner {
    private static final Logger log = LoggerFactory.getLogger(PrefabSpawner.class);

    public long spawn(Prefab prefab, SpawnContext ctx) {
        Objects.requireNonNull(prefab, "prefab");
        Objects.requireNonNull(ctx, "ctx");

        EcsWorld world = ctx.getWorld();
        long entity = world.createEntity(prefab.getName());
        if (entity == EcsWorld.NULL_ENTITY) {
            log.warn("Failed to create entity for prefab '{}'", prefab.getName());
            return EcsWorld.NULL_ENTITY;
        }

        if (ctx.hasParent()) {
            world.setParent(entity, ctx.getParent());
        }

        if (prefab.getBasePrefab() != null) {
            applyBasePrefab(entity, prefab, ctx);
        }

        for (ComponentConfig component : prefab.getComponents()) {
            applyComponent(entity, prefab, component, ctx);
        }

        applyPosition(entity, ctx.getOffsetX() + prefab.getOffsetX(), ctx.getOffsetY() + prefab.getOffsetY(), ctx);

        SpawnContext childCtx = ctx.forChild(entity);
        for (Prefab child : prefab.getChildren()) {
            spawn(child, childCtx);
        }

        log.debug("Spawned entity {} ('{}') with {} components and {} children",
                entity, prefab.getName(), prefab.getComponentCount(), prefab.getChildCount());
        return entity;
    }

    /**
     * Spawn with the root placed at {@code (x, y)} plus its declared offset.
     */
    public long spawnAt(Prefab prefab, SpawnContext ctx, float x, float y) {
        return spawn(prefab, ctx.at(x, y));
    }

    private void applyBasePrefab(long entity, Prefab prefab, SpawnContext ctx) {
        String basePath = prefab.getBasePrefab();
        if (ctx.getPrefabs() == null) {
            softFailure(ctx, "Base prefab '" + basePath + "' of " + describe(prefab) + " needs a prefab registry");
            return;
        }

        Optional<Prefab> base = ctx.getPrefabs().lookup(basePath);
        if (base.isEmpty()) {
            softFailure(ctx, "Base prefab '" + basePath + "' of " + describe(prefab) + " is not loaded");
            return;
        }

        // Single level: the base's own base is not followed.
        for (ComponentConfig component : base.get().getComponents()) {
            applyComponent(entity, prefab, component, ctx);
        }
    }

    private void applyComponent(long entity, Prefab prefab, ComponentConfig component, SpawnContext ctx) {
        Optional<ComponentMeta> found = ctx.getReflect().getByName(component.getComponentName());
        if (found.isEmpty()) {
            softFailure(ctx, "Unknown component '" + component.getComponentName() + "' on " + describe(prefab));
            return;
        }

        // Each config starts from a zeroed record and replaces the whole component.
        ComponentMeta meta = found.get();
        EcsWorld world = ctx.getWorld();
        byte[] record = new byte[meta.getSize()];

        FieldValueApplier applier = new FieldValueApplier(world.strings());
        for (FieldAssign assign : component.getFields()) {
            FieldDesc field = resolveField(meta, assign.getName());
            if (field == null) {
                softFailure(ctx, "Unknown field '" + meta.getName() + "." + assign.getName() + "' on " + describe(prefab));
                continue;
            }
            if (!applier.apply(record, field, assign.getValue())) {
                softFailure(ctx, "Cannot assign " + assign.getValue().getType() + " value to "
                        + field.getType().typeName() + " field '" + meta.getName() + "." + field.getName()
                        + "' on " + describe(prefab));
            }
        }

        world.setComponent(entity, meta.getId(), record);
    }

    private FieldDesc resolveField(ComponentMeta meta, String fieldName) {
        if (ComponentConfig.SHORTHAND_FIELD.equals(fieldName) && meta.getFieldCount() > 0) {
            return meta.firstField();
        }
        return meta.findField(fieldName).orElse(null);
    }

    private void applyPosition(long entity, float x, float y, SpawnContext ctx) {
        Optional<ComponentMeta> found = ctx.getReflect().getByName(ctx.getPositionComponent());
        if (found.isEmpty()) {
            return;
        }

        ComponentMeta meta = found.get();
        FieldDesc fieldX = meta.findField("x").orElse(meta.getFieldCount() > 0 ? meta.getFields().get(0) : null);
        FieldDesc fieldY = meta.findField("y").orElse(meta.getFieldCount() > 1 ? meta.getFields().get(1) : null);
        if (!isFloatField(fieldX, meta) || !isFloatField(fieldY, meta)) {
            log.debug("Position component '{}' has no usable x/y float fields", meta.getName());
            return;
        }

        EcsWorld world = ctx.getWorld();
        byte[] record = new byte[meta.getSize()];

        ByteBuffer buf = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        buf.putFloat(fieldX.getOffset(), x);
        buf.putFloat(fieldY.getOffset(), y);
        world.setComponent(entity, meta.getId(), record);
    }

    private static boolean isFloatField(FieldDesc field, ComponentMeta meta) {
        return field != null
                && field.getType() == FieldType.FLOAT
                && field.getOffset() >= 0
                && field.getOffset() + Float.BYTES <= meta.getSize();
    }

    private static void softFailure(SpawnContext ctx, String message) {
        log.debug(message);
        if (ctx.getDiagnostics() != null) {
            ctx.getDiagnostics().warn(message);
        }
    }

    private static String describe(Prefab prefab) {
        return prefab.getName() != null ? "'" + prefab.getName() + "'" : "<anonymous>";
    }
}
