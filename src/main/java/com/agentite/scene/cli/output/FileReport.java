package com.agentite.scene.cli.output;

import java.util.ArrayList;
import java.util.List;

import com.agentite.scene.scene.AssetRef;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of checking one definition file.
 */
@Data
@Builder
public class FileReport {
    private String path;
    private String mode;
    private boolean success;
    private String error;

    private int rootCount;
    private int entityCount;
    private int componentCount;

    @Builder.Default
    private List<AssetRef> assetRefs = new ArrayList<>();

    public static FileReport failure(String path, String mode, String error) {
        return FileReport.builder()
                .path(path)
                .mode(mode)
                .success(false)
                .error(error)
                .build();
    }
}
