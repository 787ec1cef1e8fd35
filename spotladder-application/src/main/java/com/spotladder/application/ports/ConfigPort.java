package com.spotladder.application.ports;

import java.math.BigDecimal;

/**
 * Abstraction over configuration and secrets.
 * Infrastructure provides implementation (file/env).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    BigDecimal getDecimal(String key, BigDecimal defaultValue);

    boolean getBoolean(String key, boolean defaultValue);

    /** Returns a secret value, or null when none is configured. */
    String getSecret(String key);
}
