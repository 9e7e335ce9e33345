package com.agentite.scene.scene;

import lombok.NonNull;
import lombok.Value;

/**
 * External asset path referenced by scene content.
 */
@Value
public class AssetRef {
    @NonNull
    String path;
    @NonNull
    AssetType type;
}
