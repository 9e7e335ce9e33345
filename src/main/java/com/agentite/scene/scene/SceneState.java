package com.agentite.scene.scene;

/**
 * Lifecycle state of a scene.
 */
public enum SceneState {
    UNLOADED,
    PARSED,
    INSTANTIATED,
    /** Transient while tracked entities are being deleted. */
    UNLOADING
}
