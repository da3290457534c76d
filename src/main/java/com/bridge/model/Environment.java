package com.bridge.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * A logical isolation boundary. Every environment has its own provider endpoint, circuit
 * breaker, caches and tracking session.
 */
public enum Environment {
    SANDBOX,
    PRODUCTION,
    EXTERNAL;

    /**
     * @return the lower-case key used in configuration and on the command line, e.g. {@code sandbox}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the prefix of the environment variables holding this environment's endpoint, e.g. {@code BRIDGE_SANDBOX}.
     */
    public String envPrefix() {
        return "BRIDGE_" + name();
    }

    /**
     * Resolves a user supplied key, case-insensitively.
     *
     * @param key The environment key, e.g. "production".
     * @return The matching environment.
     * @throws IllegalArgumentException if the key names no environment.
     */
    public static Environment fromKey(String key) {
        return Arrays.stream(values())
                .filter(env -> env.key().equalsIgnoreCase(key == null ? "" : key.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown environment '" + key
                        + "'. Expected one of: sandbox, production, external"));
    }
}
