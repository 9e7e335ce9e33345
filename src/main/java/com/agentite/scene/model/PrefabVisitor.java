package com.agentite.scene.model;

/**
 * Visitor over a prefab tree. {@link Prefab#accept} visits a node before its children.
 */
public interface PrefabVisitor {

    void visit(Prefab prefab);
}
