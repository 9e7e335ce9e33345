package com.agentite.scene.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.model.Prefab;
import com.agentite.scene.parser.ParseErrors;
import com.agentite.scene.parser.PrefabParser;
import com.agentite.scene.parser.SceneParseException;

/**
 * Path-keyed cache of parsed prefab files.
 *
 * A path is read and parsed at most once; later loads return the same tree. Paths are
 * resolved against the base directory but cached under the string the caller used, which
 * is also the string base prefab references are looked up by.
 */
public class PrefabRegistry {
    private static final Logger log = LoggerFactory.getLogger(PrefabRegistry.class);

    public static final int MAX_PREFABS = 256;

    private final Path baseDir;
    private final Map<String, Prefab> prefabs = new LinkedHashMap<>();

    public PrefabRegistry() {
        this(Path.of(""));
    }

    public PrefabRegistry(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * Load and parse a prefab file. Uses cache if already loaded.
     *
     * @throws SceneLoadException if the registry is full or the file cannot be read or parsed
     */
    public Prefab load(String path) {
        Objects.requireNonNull(path, "path");

        Prefab cached = prefabs.get(path);
        if (cached != null) {
            return cached;
        }

        if (prefabs.size() >= MAX_PREFABS) {
            String message = "prefab: Registry is full (" + MAX_PREFABS + " prefabs), cannot load '" + path + "'";
            ParseErrors.record(message);
            throw new SceneLoadException(message);
        }

        String source;
        try {
            source = Files.readString(baseDir.resolve(path));
        } catch (IOException e) {
            String message = "prefab: Failed to read '" + path + "': " + e.getMessage();
            ParseErrors.record(message);
            throw new SceneLoadException(message, e);
        }

        Prefab prefab;
        try {
            prefab = PrefabParser.parsePrefab(source, path);
        } catch (SceneParseException e) {
            String message = "prefab: Failed to parse '" + path + "': " + e.getMessage();
            ParseErrors.record(message);
            throw new SceneLoadException(message, e);
        }

        prefab.setPath(path);
        prefabs.put(path, prefab);
        log.info("Loaded prefab: {}", path);
        return prefab;
    }

    /**
     * Parse a prefab from source text. The result is not cached and belongs to the caller.
     */
    public Prefab loadString(String source, String name) {
        return PrefabParser.parsePrefab(source, name);
    }

    public Optional<Prefab> lookup(String path) {
        return Optional.ofNullable(path != null ? prefabs.get(path) : null);
    }

    public boolean isLoaded(String path) {
        return prefabs.containsKey(path);
    }

    public Set<String> getLoadedPaths() {
        return Collections.unmodifiableSet(prefabs.keySet());
    }

    public int count() {
        return prefabs.size();
    }

    public void clear() {
        log.debug("Clearing {} cached prefabs", prefabs.size());
        prefabs.clear();
    }
}
