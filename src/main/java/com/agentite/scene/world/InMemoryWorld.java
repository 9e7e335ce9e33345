package com.agentite.scene.world;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-backed {@link EcsWorld}.
 *
 * Ids start at 1 and are never reused, so a deleted id stays dead. Deleting an entity
 * cascades to its children. An optional entity limit makes {@link #createEntity} fail
 * once reached.
 */
public class InMemoryWorld implements EcsWorld {
    private static final Logger log = LoggerFactory.getLogger(InMemoryWorld.class);

    private final Map<Long, EntityRecord> entities = new LinkedHashMap<>();
    private final StringPool strings = new StringPool();
    private final int maxEntities;
    private long nextId = 1;

    public InMemoryWorld() {
        this(0);
    }

    /**
     * @param maxEntities maximum number of live entities, 0 for no limit
     */
    public InMemoryWorld(int maxEntities) {
        this.maxEntities = maxEntities;
    }

    @Override
    public long createEntity(String name) {
        if (maxEntities > 0 && entities.size() >= maxEntities) {
            log.warn("Entity limit of {} reached, cannot create '{}'", maxEntities, name);
            return NULL_ENTITY;
        }
        long id = nextId++;
        entities.put(id, new EntityRecord(name));
        return id;
    }

    @Override
    public void deleteEntity(long entity) {
        EntityRecord record = entities.get(entity);
        if (record == null) {
            return;
        }
        for (Long child : new ArrayList<>(record.children)) {
            deleteEntity(child);
        }
        if (record.parent != NULL_ENTITY) {
            EntityRecord parentRecord = entities.get(record.parent);
            if (parentRecord != null) {
                parentRecord.children.remove(Long.valueOf(entity));
            }
        }
        entities.remove(entity);
    }

    @Override
    public boolean isAlive(long entity) {
        return entities.containsKey(entity);
    }

    @Override
    public byte[] getComponent(long entity, long componentId) {
        EntityRecord record = entities.get(entity);
        if (record == null) {
            return null;
        }
        byte[] data = record.components.get(componentId);
        return data != null ? data.clone() : null;
    }

    @Override
    public boolean hasComponent(long entity, long componentId) {
        EntityRecord record = entities.get(entity);
        return record != null && record.components.containsKey(componentId);
    }

    @Override
    public void setComponent(long entity, long componentId, byte[] data) {
        requireRecord(entity).components.put(componentId, data.clone());
    }

    @Override
    public void setParent(long child, long parent) {
        EntityRecord childRecord = requireRecord(child);
        EntityRecord parentRecord = requireRecord(parent);

        for (long ancestor = parent; ancestor != NULL_ENTITY; ancestor = entities.get(ancestor).parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Entity " + parent + " is a descendant of " + child);
            }
        }

        if (childRecord.parent != NULL_ENTITY) {
            entities.get(childRecord.parent).children.remove(Long.valueOf(child));
        }
        childRecord.parent = parent;
        parentRecord.children.add(child);
    }

    @Override
    public long getParent(long entity) {
        EntityRecord record = entities.get(entity);
        return record != null ? record.parent : NULL_ENTITY;
    }

    @Override
    public List<Long> getChildren(long entity) {
        EntityRecord record = entities.get(entity);
        return record != null ? List.copyOf(record.children) : List.of();
    }

    @Override
    public String getName(long entity) {
        EntityRecord record = entities.get(entity);
        return record != null ? record.name : null;
    }

    @Override
    public StringPool strings() {
        return strings;
    }

    public int entityCount() {
        return entities.size();
    }

    private EntityRecord requireRecord(long entity) {
        EntityRecord record = entities.get(entity);
        if (record == null) {
            throw new IllegalArgumentException("Entity " + entity + " is not alive");
        }
        return record;
    }

    private static final class EntityRecord {
        private final String name;
        private long parent = NULL_ENTITY;
        private final List<Long> children = new ArrayList<>();
        private final Map<Long, byte[]> components = new HashMap<>();

        private EntityRecord(String name) {
            this.name = name;
        }
    }
}
