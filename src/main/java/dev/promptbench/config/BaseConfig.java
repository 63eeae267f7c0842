package dev.promptbench.config;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Environment-backed configuration lookups.
 *
 * <p>Values are resolved from the override map first and then from the process environment. An
 * override of {@link #NULL_OVERRIDE} hides an environment value entirely.
 */
abstract class BaseConfig {
    /** Sentinel override value which forces a setting to be absent. */
    static final String NULL_OVERRIDE = "__PROMPTBENCH_NULL__";

    private final Map<String, String> envOverrides;

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    @Nullable
    private String lookup(String key) {
        if (envOverrides.containsKey(key)) {
            var value = envOverrides.get(key);
            return NULL_OVERRIDE.equals(value) ? null : value;
        }
        return System.getenv(key);
    }

    protected String getConfig(String key, String defaultValue) {
        return getConfig(key, defaultValue, String.class);
    }

    protected int getConfig(String key, int defaultValue) {
        return getConfig(key, defaultValue, Integer.class);
    }

    protected long getConfig(String key, long defaultValue) {
        return getConfig(key, defaultValue, Long.class);
    }

    protected double getConfig(String key, double defaultValue) {
        return getConfig(key, defaultValue, Double.class);
    }

    protected boolean getConfig(String key, boolean defaultValue) {
        return getConfig(key, defaultValue, Boolean.class);
    }

    @Nullable
    protected <T> T getConfig(String key, @Nullable T defaultValue, Class<T> type) {
        var raw = lookup(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return type.cast(convert(raw.trim(), type));
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "invalid value for %s (expected %s): %s"
                            .formatted(key, type.getSimpleName(), raw),
                    e);
        }
    }

    private static Object convert(String raw, Class<?> type) {
        if (type == String.class) {
            return raw;
        } else if (type == Integer.class) {
            return Integer.parseInt(raw);
        } else if (type == Long.class) {
            return Long.parseLong(raw);
        } else if (type == Double.class) {
            return Double.parseDouble(raw);
        } else if (type == Boolean.class) {
            return Boolean.parseBoolean(raw);
        }
        throw new IllegalArgumentException("unsupported config type: " + type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return envOverrides.equals(((BaseConfig) o).envOverrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), envOverrides);
    }
}
