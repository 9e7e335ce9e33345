package com.agentite.scene.parser;

import lombok.experimental.UtilityClass;

/**
 * Holds the latest parse/load error message of the current thread.
 * Every parse call overwrites it; a successful parse clears it.
 */
@UtilityClass
public class ParseErrors {

    private static final ThreadLocal<String> LAST_ERROR = new ThreadLocal<>();

    public static String lastError() {
        return LAST_ERROR.get();
    }

    public static void record(String message) {
        LAST_ERROR.set(message);
    }

    public static void clear() {
        LAST_ERROR.remove();
    }
}
