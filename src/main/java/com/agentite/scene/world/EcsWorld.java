package com.agentite.scene.world;

import java.util.List;

/**
 * Entity/component storage used by the spawner, scenes and the entity writer.
 *
 * Entities are plain numeric ids; {@link #NULL_ENTITY} (0) means "no entity".
 * Component payloads are raw little-endian byte records whose layout is described
 * by the reflection registry.
 */
public interface EcsWorld {

    long NULL_ENTITY = 0L;

    /**
     * Create an entity, named when {@code name} is not null.
     *
     * @return the new id, or {@link #NULL_ENTITY} if the world cannot create one
     */
    long createEntity(String name);

    /**
     * Delete an entity and its descendants. Deleting a dead entity does nothing.
     */
    void deleteEntity(long entity);

    boolean isAlive(long entity);

    /**
     * Copy of the component record, or null if the entity does not have it.
     */
    byte[] getComponent(long entity, long componentId);

    boolean hasComponent(long entity, long componentId);

    void setComponent(long entity, long componentId, byte[] data);

    void setParent(long child, long parent);

    /**
     * Parent of the entity, or {@link #NULL_ENTITY}.
     */
    long getParent(long entity);

    List<Long> getChildren(long entity);

    String getName(long entity);

    /**
     * Pool that string-typed fields of this world's components refer into.
     */
    StringPool strings();
}
