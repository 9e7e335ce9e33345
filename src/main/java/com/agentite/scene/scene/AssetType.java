package com.agentite.scene.scene;

import java.util.Locale;

/**
 * Kind of external asset referenced from scene content, guessed from the file extension.
 */
public enum AssetType {
    UNKNOWN,
    TEXTURE,
    SOUND,
    MUSIC,
    FONT,
    PREFAB,
    SCENE;

    public static AssetType fromPath(String path) {
        if (path == null) {
            return UNKNOWN;
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash || dot == path.length() - 1) {
            return UNKNOWN;
        }
        String ext = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "png", "jpg", "jpeg", "bmp", "tga", "gif" -> TEXTURE;
            case "wav", "ogg", "mp3", "flac" -> SOUND;
            case "mod", "xm", "s3m", "it", "mid", "midi" -> MUSIC;
            case "ttf", "otf", "fnt" -> FONT;
            case "prefab" -> PREFAB;
            case "scene" -> SCENE;
            default -> UNKNOWN;
        };
    }
}
