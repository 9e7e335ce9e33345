package com.agentite.scene.scene;

import com.agentite.scene.model.SceneDiagnostics;
import com.agentite.scene.reflect.ReflectRegistry;
import com.agentite.scene.registry.PrefabRegistry;
import com.agentite.scene.spawn.SpawnContext;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

/**
 * Settings for instantiating scenes.
 */
@Data
@Builder
public class SceneLoadContext {

    @NonNull
    private final ReflectRegistry reflect;

    /** Resolves base prefabs and receives preloaded prefab assets; optional. */
    private final PrefabRegistry prefabs;

    /** Load referenced prefab files before spawning. */
    private final boolean preloadAssets;

    @Builder.Default
    private final String positionComponent = SpawnContext.DEFAULT_POSITION_COMPONENT;

    private final SceneDiagnostics diagnostics;
}
