package com.agentite.scene.reflect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catalogue of component layouts keyed by numeric id and by name.
 *
 * Ids are indexed in a fixed open-addressing table with linear probing; names are found by
 * a linear scan over the registration order. Entries are insert-once: registering an id a
 * second time is rejected and leaves the first entry untouched. Id 0 is never valid.
 *
 * Populated by the host before parsing or spawning; read-only afterwards. Not thread-safe.
 */
public class ReflectRegistry {
    private static final Logger log = LoggerFactory.getLogger(ReflectRegistry.class);

    public static final int MAX_COMPONENTS = 256;
    public static final int MAX_FIELDS = 32;
    static final int TABLE_SIZE = 512;

    private static final long HASH_MULTIPLIER = 2654435761L;

    private final List<ComponentMeta> components = new ArrayList<>();

    /** Slot keys; 0 marks an empty slot. */
    private final long[] slotIds = new long[TABLE_SIZE];
    /** Index into {@link #components} for an occupied slot. */
    private final int[] slotEntries = new int[TABLE_SIZE];

    public boolean register(long id, String name, int size, List<FieldDesc> fields) {
        if (name == null || fields == null) {
            log.warn("Rejected component registration with missing name or fields (id {})", id);
            return false;
        }
        return register(ComponentMeta.builder()
                .id(id)
                .name(name)
                .size(size)
                .fields(fields)
                .build());
    }

    /**
     * Register a component layout.
     *
     * @return false if the id is 0 or already present, the field count is outside 1..32,
     *         the size is not positive, a field does not fit in the size, or the registry is full
     */
    public boolean register(ComponentMeta meta) {
        if (meta.getId() == 0) {
            log.warn("Rejected component '{}': id 0 is reserved", meta.getName());
            return false;
        }
        if (meta.getFieldCount() <= 0 || meta.getFieldCount() > MAX_FIELDS) {
            log.warn("Rejected component '{}': field count {} out of range 1-{}",
                    meta.getName(), meta.getFieldCount(), MAX_FIELDS);
            return false;
        }
        if (meta.getSize() <= 0) {
            log.warn("Rejected component '{}': size {} is not positive", meta.getName(), meta.getSize());
            return false;
        }
        for (FieldDesc field : meta.getFields()) {
            if (!field.fitsIn(meta.getSize())) {
                log.warn("Rejected component '{}': field '{}' ({} bytes at offset {}) exceeds size {}",
                        meta.getName(), field.getName(), field.getSize(), field.getOffset(), meta.getSize());
                return false;
            }
        }
        if (components.size() >= MAX_COMPONENTS) {
            log.warn("Rejected component '{}': registry is full ({} components)", meta.getName(), MAX_COMPONENTS);
            return false;
        }
        if (findSlot(meta.getId()) >= 0) {
            log.warn("Rejected component '{}': id {} already registered", meta.getName(), meta.getId());
            return false;
        }

        int slot = hash(meta.getId());
        while (slotIds[slot] != 0) {
            slot = (slot + 1) % TABLE_SIZE;
        }
        slotIds[slot] = meta.getId();
        slotEntries[slot] = components.size();
        components.add(meta);

        log.debug("Registered component '{}' (id {}, {} bytes, {} fields)",
                meta.getName(), meta.getId(), meta.getSize(), meta.getFieldCount());
        return true;
    }

    public Optional<ComponentMeta> get(long id) {
        int slot = findSlot(id);
        return slot >= 0 ? Optional.of(components.get(slotEntries[slot])) : Optional.empty();
    }

    public Optional<ComponentMeta> getByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ComponentMeta meta : components) {
            if (meta.getName().equals(name)) {
                return Optional.of(meta);
            }
        }
        return Optional.empty();
    }

    public boolean isRegistered(long id) {
        return findSlot(id) >= 0;
    }

    /**
     * All registered components in registration order.
     */
    public List<ComponentMeta> getAll() {
        return Collections.unmodifiableList(components);
    }

    public ComponentMeta getByIndex(int index) {
        return components.get(index);
    }

    public int count() {
        return components.size();
    }

    private int findSlot(long id) {
        if (id == 0) {
            return -1;
        }
        int slot = hash(id);
        for (int step = 0; step < TABLE_SIZE; step++) {
            if (slotIds[slot] == 0) {
                return -1;
            }
            if (slotIds[slot] == id) {
                return slot;
            }
            slot = (slot + 1) % TABLE_SIZE;
        }
        return -1;
    }

    private static int hash(long id) {
        long h = (id * HASH_MULTIPLIER) & 0xFFFFFFFFL;
        return (int) (h % TABLE_SIZE);
    }
}
