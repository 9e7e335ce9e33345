package com.agentite.scene.scene;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.model.Prefab;
import com.agentite.scene.parser.ParseErrors;
import com.agentite.scene.parser.PrefabParser;
import com.agentite.scene.parser.SceneParseException;
import com.agentite.scene.registry.PrefabRegistry;
import com.agentite.scene.registry.SceneLoadException;
import com.agentite.scene.spawn.PrefabSpawner;
import com.agentite.scene.spawn.SpawnContext;
import com.agentite.scene.world.EcsWorld;
import com.agentite.scene.writer.SceneWriter;

/**
 * Loads, caches and instantiates scenes, and switches the active scene.
 *
 * States move {@code unloaded -> parsed -> instantiated} and back to {@code parsed} on
 * uninstantiate. While instantiated a scene tracks exactly the entities it spawned.
 * A path is parsed at most once per manager.
 */
public class SceneManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SceneManager.class);

    public static final int MAX_SCENES = 64;
    public static final String DEFAULT_SCENE_NAME = "unnamed";

    private final Path baseDir;
    private final Map<String, Scene> scenes = new LinkedHashMap<>();
    private final PrefabSpawner spawner = new PrefabSpawner();
    private final SceneWriter writer = new SceneWriter();

    private Scene active;

    public SceneManager() {
        this(Path.of(""));
    }

    public SceneManager(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    /**
     * Load and parse a scene file. Uses cache if already loaded.
     *
     * @throws SceneLoadException if the cache is full or the file cannot be read or parsed
     */
    public Scene load(String path) {
        Objects.requireNonNull(path, "path");

        Scene cached = scenes.get(path);
        if (cached != null) {
            return cached;
        }

        if (scenes.size() >= MAX_SCENES) {
            throw loadFailure("scene: Manager is full (" + MAX_SCENES + " scenes), cannot load '" + path + "'", null);
        }

        String source;
        try {
            source = Files.readString(baseDir.resolve(path));
        } catch (IOException e) {
            throw loadFailure("scene: Failed to read '" + path + "': " + e.getMessage(), e);
        }

        Scene scene = parse(source, path, nameFromPath(path));
        scenes.put(path, scene);
        log.info("Loaded scene '{}' from {}: {} roots, {} asset refs",
                scene.getName(), path, scene.getRootCount(), scene.getAssetRefs().size());
        return scene;
    }

    /**
     * Parse a scene from source text. The scene is not cached and has no path.
     */
    public Scene loadString(String source, String name) {
        String sceneName = name != null ? name : DEFAULT_SCENE_NAME;
        Scene scene = parse(source, null, sceneName);
        log.debug("Loaded scene '{}' from string: {} roots", sceneName, scene.getRootCount());
        return scene;
    }

    public Optional<Scene> lookup(String path) {
        return Optional.ofNullable(path != null ? scenes.get(path) : null);
    }

    public int count() {
        return scenes.size();
    }

    private Scene parse(String source, String path, String name) {
        List<Prefab> roots;
        try {
            roots = PrefabParser.parseScene(source, path != null ? path : name);
        } catch (SceneParseException e) {
            throw loadFailure("scene: Failed to parse '" + (path != null ? path : name) + "': " + e.getMessage(), e);
        }

        Scene scene = new Scene(path, name, roots, AssetRefCollector.collect(roots));
        scene.setState(SceneState.PARSED);
        return scene;
    }

    /**
     * Spawn every root of a parsed scene into {@code world}.
     *
     * Each root lands at its declared offset. If a root cannot be spawned, everything spawned
     * so far is deleted and the scene stays parsed.
     *
     * @return false if the scene is not in the parsed state or spawning failed
     */
    public boolean instantiate(Scene scene, EcsWorld world, SceneLoadContext ctx) {
        Objects.requireNonNull(scene, "scene");
        Objects.requireNonNull(world, "world");
        Objects.requireNonNull(ctx, "ctx");

        if (scene.getState() == SceneState.INSTANTIATED) {
            return lifecycleFailure("scene: Already instantiated '" + scene.getName() + "'");
        }
        if (scene.getState() != SceneState.PARSED) {
            return lifecycleFailure("scene: Scene not parsed '" + scene.getName() + "' (" + scene.getState() + ")");
        }

        if (ctx.isPreloadAssets() && ctx.getPrefabs() != null) {
            preloadAssets(scene, ctx.getPrefabs());
        }

        SpawnContext spawnCtx = SpawnContext.builder()
                .world(world)
                .reflect(ctx.getReflect())
                .prefabs(ctx.getPrefabs())
                .positionComponent(ctx.getPositionComponent())
                .diagnostics(ctx.getDiagnostics())
                .build();

        List<Long> rootEntities = new ArrayList<>();
        List<Long> spawned = new ArrayList<>();
        for (Prefab root : scene.getRoots()) {
            long entity = spawner.spawn(root, spawnCtx);
            if (entity == EcsWorld.NULL_ENTITY) {
                deleteReverse(world, spawned);
                return lifecycleFailure("scene: Failed to spawn root '" + root.getName()
                        + "' of scene '" + scene.getName() + "'");
            }
            rootEntities.add(entity);
            collectSubtree(world, entity, spawned);
        }

        scene.track(world, rootEntities, spawned);
        scene.setState(SceneState.INSTANTIATED);
        log.info("Instantiated scene '{}': {} entities ({} roots)", scene.getName(), spawned.size(), rootEntities.size());
        return true;
    }

    /**
     * Delete every entity the scene spawned, newest first, and return it to the parsed state.
     * Does nothing unless the scene is instantiated.
     */
    public void uninstantiate(Scene scene) {
        Objects.requireNonNull(scene, "scene");
        if (scene.getState() != SceneState.INSTANTIATED) {
            log.debug("Scene '{}' is not instantiated ({})", scene.getName(), scene.getState());
            return;
        }

        scene.setState(SceneState.UNLOADING);
        int count = scene.getEntityCount();
        deleteReverse(scene.getWorld(), scene.getEntities());
        scene.clearTracking();
        scene.setState(SceneState.PARSED);
        log.info("Uninstantiated scene '{}': {} entities removed", scene.getName(), count);
    }

    /**
     * Replace the active scene with the scene at {@code path}.
     *
     * The new scene is loaded before anything is torn down, so a broken file leaves the active
     * scene alone. If the new scene fails to instantiate, the previous one is instantiated
     * again where possible.
     *
     * @return the new active scene, or empty on failure
     */
    public Optional<Scene> transition(String path, EcsWorld world, SceneLoadContext ctx) {
        Scene next;
        try {
            next = load(path);
        } catch (SceneLoadException e) {
            log.warn("Scene transition to '{}' aborted: {}", path, e.getMessage());
            return Optional.empty();
        }

        Scene previous = active;
        EcsWorld previousWorld = previous != null ? previous.getWorld() : null;
        if (previous != null) {
            uninstantiate(previous);
        }

        if (!instantiate(next, world, ctx)) {
            log.warn("Scene transition to '{}' failed: {}", path, ParseErrors.lastError());
            if (previous != null && previousWorld != null && previous.getState() == SceneState.PARSED) {
                boolean restored = instantiate(previous, previousWorld, ctx);
                log.warn("Rollback to scene '{}' {}", previous.getName(), restored ? "succeeded" : "failed");
            }
            return Optional.empty();
        }

        active = next;
        log.info("Transitioned to scene '{}'", next.getName());
        return Optional.of(next);
    }

    public Optional<Scene> getActive() {
        return Optional.ofNullable(active);
    }

    public void setActive(Scene scene) {
        this.active = scene;
    }

    public OptionalLong findEntity(Scene scene, String name) {
        return scene.findEntity(name);
    }

    /**
     * Load every prefab the scene references into {@code prefabs}.
     *
     * @return true if all of them loaded
     */
    public boolean preloadAssets(Scene scene, PrefabRegistry prefabs) {
        boolean allLoaded = true;
        for (AssetRef ref : scene.getAssetRefs()) {
            if (ref.getType() != AssetType.PREFAB) {
                continue;
            }
            try {
                prefabs.load(ref.getPath());
            } catch (SceneLoadException e) {
                log.warn("Failed to preload prefab '{}' for scene '{}': {}", ref.getPath(), scene.getName(), e.getMessage());
                allLoaded = false;
            }
        }
        return allLoaded;
    }

    public String writeString(Scene scene) {
        return writer.write(scene.getRoots());
    }

    public void writeFile(Scene scene, Path path) throws IOException {
        writer.writeFile(scene.getRoots(), path);
    }

    /**
     * Uninstantiate if needed, drop the scene from the cache and release its trees.
     */
    public void destroy(Scene scene) {
        uninstantiate(scene);
        if (scene.getPath() != null) {
            scenes.remove(scene.getPath(), scene);
        }
        if (active == scene) {
            active = null;
        }
        scene.release();
        scene.setState(SceneState.UNLOADED);
    }

    @Override
    public void close() {
        for (Scene scene : new ArrayList<>(scenes.values())) {
            destroy(scene);
        }
        if (active != null) {
            destroy(active);
        }
    }

    private static void collectSubtree(EcsWorld world, long entity, List<Long> out) {
        out.add(entity);
        for (long child : world.getChildren(entity)) {
            collectSubtree(world, child, out);
        }
    }

    private static void deleteReverse(EcsWorld world, List<Long> entities) {
        for (int i = entities.size() - 1; i >= 0; i--) {
            long entity = entities.get(i);
            if (world.isAlive(entity)) {
                world.deleteEntity(entity);
            }
        }
    }

    private static boolean lifecycleFailure(String message) {
        ParseErrors.record(message);
        log.warn(message);
        return false;
    }

    private static SceneLoadException loadFailure(String message, Throwable cause) {
        ParseErrors.record(message);
        return cause != null ? new SceneLoadException(message, cause) : new SceneLoadException(message);
    }

    static String nameFromPath(String path) {
        String name = Path.of(path).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
