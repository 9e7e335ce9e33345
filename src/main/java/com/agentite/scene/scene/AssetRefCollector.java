package com.agentite.scene.scene;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.agentite.scene.model.ComponentConfig;
import com.agentite.scene.model.FieldAssign;
import com.agentite.scene.model.Prefab;
import com.agentite.scene.model.PrefabVisitor;
import com.agentite.scene.model.PropType;

/**
 * Collects the asset paths referenced by prefab trees: every base prefab reference, and every
 * string literal whose extension names a known asset type. Results are unique by path and keep
 * first-seen order.
 */
public class AssetRefCollector implements PrefabVisitor {

    private final Map<String, AssetRef> refs = new LinkedHashMap<>();

    public static List<AssetRef> collect(List<Prefab> roots) {
        AssetRefCollector collector = new AssetRefCollector();
        for (Prefab root : roots) {
            root.accept(collector);
        }
        return collector.getRefs();
    }

    @Override
    public void visit(Prefab prefab) {
        if (prefab.getBasePrefab() != null) {
            refs.putIfAbsent(prefab.getBasePrefab(), new AssetRef(prefab.getBasePrefab(), AssetType.PREFAB));
        }
        for (ComponentConfig component : prefab.getComponents()) {
            for (FieldAssign field : component.getFields()) {
                if (field.getValue().getType() != PropType.STRING) {
                    continue;
                }
                String path = field.getValue().getText();
                AssetType type = AssetType.fromPath(path);
                if (type != AssetType.UNKNOWN) {
                    refs.putIfAbsent(path, new AssetRef(path, type));
                }
            }
        }
    }

    public List<AssetRef> getRefs() {
        return new ArrayList<>(refs.values());
    }
}
