package com.agentite.scene.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Configuration of one component on a prefab node: the component name and its ordered
 * field assignments. A scalar component ({@code Health: 100}) holds a single field named
 * {@value #SHORTHAND_FIELD}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ComponentConfig {

    public static final int MAX_FIELDS = 32;
    public static final String SHORTHAND_FIELD = "value";

    private final String componentName;
    @Getter(lombok.AccessLevel.NONE)
    private final List<FieldAssign> fields = new ArrayList<>();

    public ComponentConfig(@NonNull String componentName) {
        this.componentName = componentName;
    }

    /**
     * Component written in scalar form, normalized to one {@code value} field.
     */
    public static ComponentConfig shorthand(String componentName, PropValue value) {
        ComponentConfig config = new ComponentConfig(componentName);
        config.addField(SHORTHAND_FIELD, value);
        return config;
    }

    public void addField(String name, PropValue value) {
        if (fields.size() >= MAX_FIELDS) {
            throw new IllegalStateException("Too many fields in component " + componentName);
        }
        fields.add(new FieldAssign(name, value));
    }

    public List<FieldAssign> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public int getFieldCount() {
        return fields.size();
    }

    public boolean isFull() {
        return fields.size() >= MAX_FIELDS;
    }

    public boolean isShorthand() {
        return fields.size() == 1 && SHORTHAND_FIELD.equals(fields.get(0).getName());
    }

    public Optional<PropValue> findField(String name) {
        return fields.stream()
                .filter(f -> f.getName().equals(name))
                .map(FieldAssign::getValue)
                .findFirst();
    }
}
