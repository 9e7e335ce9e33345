package com.agentite.scene.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A {@code name: value} assignment inside a component block.
 */
@Value
public class FieldAssign {
    @NonNull
    String name;
    @NonNull
    PropValue value;
}
