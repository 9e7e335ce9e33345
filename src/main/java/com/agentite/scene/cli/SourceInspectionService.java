package com.agentite.scene.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.cli.model.SourceMode;
import com.agentite.scene.cli.output.FileReport;
import com.agentite.scene.model.Prefab;
import com.agentite.scene.registry.PrefabRegistry;
import com.agentite.scene.registry.SceneLoadException;
import com.agentite.scene.scene.AssetRef;
import com.agentite.scene.scene.AssetRefCollector;
import com.agentite.scene.scene.Scene;
import com.agentite.scene.scene.SceneManager;
import com.agentite.scene.writer.SceneWriter;

/**
 * Loads definition files for the scenetool commands: prefabs through a {@link PrefabRegistry},
 * scenes through a {@link SceneManager}, both rooted at the file's directory.
 */
public class SourceInspectionService {
    private static final Logger log = LoggerFactory.getLogger(SourceInspectionService.class);

    private final SceneWriter writer = new SceneWriter();

    /**
     * Root entities of a file.
     *
     * @throws SceneLoadException if the file cannot be read or parsed
     */
    public List<Prefab> loadRoots(Path file, SourceMode mode) {
        Path dir = file.getParent() != null ? file.getParent() : Path.of("");
        String name = file.getFileName().toString();

        if (mode.resolve(file) == SourceMode.PREFAB) {
            return List.of(new PrefabRegistry(dir).load(name));
        }
        try (SceneManager manager = new SceneManager(dir)) {
            Scene scene = manager.load(name);
            return List.copyOf(scene.getRoots());
        }
    }

    public FileReport check(Path file, SourceMode mode) {
        SourceMode resolved = mode.resolve(file);
        List<Prefab> roots;
        try {
            roots = loadRoots(file, resolved);
        } catch (SceneLoadException e) {
            log.debug("Check failed for {}", file, e);
            return FileReport.failure(file.toString(), resolved.name().toLowerCase(Locale.ROOT), e.getMessage());
        }

        return FileReport.builder()
                .path(file.toString())
                .mode(resolved.name().toLowerCase(Locale.ROOT))
                .success(true)
                .rootCount(roots.size())
                .entityCount(roots.stream().mapToInt(Prefab::countEntities).sum())
                .componentCount(roots.stream().mapToInt(Prefab::countComponents).sum())
                .assetRefs(AssetRefCollector.collect(roots))
                .build();
    }

    public String format(Path file, SourceMode mode) {
        return writer.write(loadRoots(file, mode));
    }

    public List<AssetRef> assets(Path file, SourceMode mode) {
        return AssetRefCollector.collect(loadRoots(file, mode));
    }
}
