package com.agentite.scene.registry;

/**
 * Raised when a prefab or scene file cannot be loaded: unreadable file, parse error
 * or a full cache.
 */
public class SceneLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SceneLoadException(String message) {
        super(message);
    }

    public SceneLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
