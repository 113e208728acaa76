package com.pulsesentinel.core.support;

import java.util.UUID;

/**
 * Generates prefixed identifiers such as {@code alert_3f2a...}.
 */
public final class Ids {

    private Ids() {
        // utility class, not instantiable
    }

    public static String next(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
