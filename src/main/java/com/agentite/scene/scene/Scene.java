package com.agentite.scene.scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

import com.agentite.scene.model.Prefab;
import com.agentite.scene.world.EcsWorld;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A level: one or more root prefab trees parsed together, plus the entities spawned from them
 * while instantiated.
 *
 * The scene owns its trees and the ids it spawned, not the entities themselves. Lifecycle
 * changes go through {@link SceneManager}.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class Scene {

    /** Source path; null for scenes loaded from a string. */
    @ToString.Include
    private final String path;

    @ToString.Include
    private final String name;

    @ToString.Include
    @Setter(AccessLevel.PACKAGE)
    private SceneState state = SceneState.UNLOADED;

    @Getter(AccessLevel.NONE)
    private final List<Prefab> roots = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<AssetRef> assetRefs = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<Long> entities = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<Long> rootEntities = new ArrayList<>();

    /** World the scene is instantiated in; null otherwise. */
    @Getter(AccessLevel.PACKAGE)
    private EcsWorld world;

    Scene(String path, String name, List<Prefab> roots, List<AssetRef> assetRefs) {
        this.path = path;
        this.name = name;
        this.roots.addAll(roots);
        this.assetRefs.addAll(assetRefs);
    }

    public List<Prefab> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    public int getRootCount() {
        return roots.size();
    }

    public List<AssetRef> getAssetRefs() {
        return Collections.unmodifiableList(assetRefs);
    }

    /**
     * Every spawned entity, roots and descendants, in recording order.
     */
    public List<Long> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    public List<Long> getRootEntities() {
        return Collections.unmodifiableList(rootEntities);
    }

    public int getEntityCount() {
        return entities.size();
    }

    public boolean isInstantiated() {
        return state == SceneState.INSTANTIATED;
    }

    /**
     * First live tracked entity carrying {@code entityName}.
     */
    public OptionalLong findEntity(String entityName) {
        if (world == null || entityName == null) {
            return OptionalLong.empty();
        }
        for (long entity : entities) {
            if (world.isAlive(entity) && entityName.equals(world.getName(entity))) {
                return OptionalLong.of(entity);
            }
        }
        return OptionalLong.empty();
    }

    void track(EcsWorld targetWorld, List<Long> spawnedRoots, List<Long> spawned) {
        this.world = targetWorld;
        rootEntities.addAll(spawnedRoots);
        entities.addAll(spawned);
    }

    void clearTracking() {
        world = null;
        rootEntities.clear();
        entities.clear();
    }

    void release() {
        clearTracking();
        roots.clear();
        assetRefs.clear();
    }
}
