package com.spotladder.cli;

import com.spotladder.application.ports.ConfigPort;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Command-line values layered over file/env configuration. Secrets always come from the delegate.
 */
final class OverrideConfig implements ConfigPort {

    private final ConfigPort delegate;
    private final Map<String, String> overrides = new HashMap<>();

    OverrideConfig(ConfigPort delegate) {
        this.delegate = delegate;
    }

    OverrideConfig with(String key, String value) {
        if (key != null && value != null && !value.isBlank()) overrides.put(key, value.trim());
        return this;
    }

    @Override
    public String get(String key) {
        String v = overrides.get(key);
        return v != null ? v : delegate.get(key);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = overrides.get(key);
        return v != null ? v : delegate.get(key, defaultValue);
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = overrides.get(key);
        if (v == null) return delegate.getInt(key, defaultValue);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        String v = overrides.get(key);
        if (v == null) return delegate.getDecimal(key, defaultValue);
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = overrides.get(key);
        return v == null ? delegate.getBoolean(key, defaultValue) : Boolean.parseBoolean(v);
    }

    @Override
    public String getSecret(String key) {
        return delegate.getSecret(key);
    }
}
