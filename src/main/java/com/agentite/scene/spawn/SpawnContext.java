package com.agentite.scene.spawn;

import com.agentite.scene.model.SceneDiagnostics;
import com.agentite.scene.reflect.ReflectRegistry;
import com.agentite.scene.registry.PrefabRegistry;
import com.agentite.scene.world.EcsWorld;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

/**
 * Everything a spawn needs: the target world, component layouts, where to place the
 * root and which entity to attach it to.
 */
@Data
@Builder(toBuilder = true)
public class SpawnContext {

    public static final String DEFAULT_POSITION_COMPONENT = "C_Position";

    @NonNull
    private final EcsWorld world;

    @NonNull
    private final ReflectRegistry reflect;

    /** Resolves base prefab references; optional. */
    private final PrefabRegistry prefabs;

    private final float offsetX;
    private final float offsetY;

    /** Parent for the spawned root, or {@link EcsWorld#NULL_ENTITY}. */
    private final long parent;

    /** Name of the component that receives entity positions. */
    @Builder.Default
    private final String positionComponent = DEFAULT_POSITION_COMPONENT;

    /** Collects soft failures when set. */
    private final SceneDiagnostics diagnostics;

    /**
     * Context for a child of {@code entity}: same registries, no spawn offset.
     */
    public SpawnContext forChild(long entity) {
        return toBuilder()
                .parent(entity)
                .offsetX(0.0f)
                .offsetY(0.0f)
                .build();
    }

    public SpawnContext at(float x, float y) {
        return toBuilder()
                .offsetX(x)
                .offsetY(y)
                .build();
    }

    public boolean hasParent() {
        return parent != EcsWorld.NULL_ENTITY;
    }
}
