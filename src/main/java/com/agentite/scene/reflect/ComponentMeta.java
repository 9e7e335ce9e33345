package com.agentite.scene.reflect;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Registered layout of a component: identity, record size and ordered fields.
 */
@Value
@Builder
public class ComponentMeta {
    long id;
    @NonNull
    String name;
    int size;
    @Singular
    List<FieldDesc> fields;

    public int getFieldCount() {
        return fields.size();
    }

    public Optional<FieldDesc> findField(String fieldName) {
        return fields.stream()
                .filter(f -> f.getName().equals(fieldName))
                .findFirst();
    }

    public FieldDesc firstField() {
        return fields.isEmpty() ? null : fields.get(0);
    }
}
