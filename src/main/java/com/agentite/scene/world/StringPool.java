package com.agentite.scene.world;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interned strings addressed by non-zero handles.
 *
 * String fields of component records store a handle from this pool instead of a reference
 * to parsed text, so spawned entities never depend on the prefab tree that produced them.
 * Handle 0 stands for null.
 */
public class StringPool {

    public static final long NULL_HANDLE = 0L;

    private final Map<String, Long> handles = new HashMap<>();
    private final List<String> strings = new ArrayList<>();

    public long intern(String value) {
        if (value == null) {
            return NULL_HANDLE;
        }
        Long existing = handles.get(value);
        if (existing != null) {
            return existing;
        }
        strings.add(value);
        long handle = strings.size();
        handles.put(value, handle);
        return handle;
    }

    /**
     * The string for a handle, or null for handle 0 or an unknown handle.
     */
    public String resolve(long handle) {
        if (handle <= 0 || handle > strings.size()) {
            return null;
        }
        return strings.get((int) (handle - 1));
    }

    public int size() {
        return strings.size();
    }
}
