package com.agentite.scene.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Node of a prefab tree: one entity declaration with its components and nested children.
 *
 * Each node exclusively owns its children; {@link #addChild} rejects a node that already
 * has a parent so trees can never alias or form cycles.
 */
@Data
@NoArgsConstructor
public class Prefab {

    public static final int MAX_COMPONENTS = 32;
    public static final int MAX_CHILDREN = 64;

    /** Optional entity name. */
    private String name;

    /** Source path, set when loaded from a file. */
    private String path;

    /** Declared offset; world position for roots, local offset for children. */
    private float offsetX;
    private float offsetY;

    /** Base prefab path, resolved at spawn time. */
    private String basePrefab;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Setter(AccessLevel.NONE)
    private Prefab parent;

    private final List<ComponentConfig> components = new ArrayList<>();
    private final List<Prefab> children = new ArrayList<>();

    public Prefab(String name) {
        this.name = name;
    }

    public void setOffset(float x, float y) {
        this.offsetX = x;
        this.offsetY = y;
    }

    public boolean hasOffset() {
        return offsetX != 0.0f || offsetY != 0.0f;
    }

    public void addComponent(ComponentConfig component) {
        if (components.size() >= MAX_COMPONENTS) {
            throw new IllegalStateException("Too many components on " + describe());
        }
        components.add(component);
    }

    public void addChild(Prefab child) {
        if (children.size() >= MAX_CHILDREN) {
            throw new IllegalStateException("Too many child entities on " + describe());
        }
        if (child.parent != null || child == this) {
            throw new IllegalArgumentException("Prefab node already has an owner: " + child.describe());
        }
        child.parent = this;
        children.add(child);
    }

    public List<ComponentConfig> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public List<Prefab> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getComponentCount() {
        return components.size();
    }

    public int getChildCount() {
        return children.size();
    }

    public Optional<ComponentConfig> findComponent(String componentName) {
        return components.stream()
                .filter(c -> c.getComponentName().equals(componentName))
                .findFirst();
    }

    /**
     * Visit this node, then every descendant depth first.
     */
    public void accept(PrefabVisitor visitor) {
        visitor.visit(this);
        for (Prefab child : children) {
            child.accept(visitor);
        }
    }

    /**
     * Number of entity declarations in this subtree, this node included.
     */
    public int countEntities() {
        int[] count = {0};
        accept(p -> count[0]++);
        return count[0];
    }

    /**
     * Number of component configurations in this subtree.
     */
    public int countComponents() {
        int[] count = {0};
        accept(p -> count[0] += p.getComponentCount());
        return count[0];
    }

    private String describe() {
        return name != null ? "'" + name + "'" : "<anonymous>";
    }
}
