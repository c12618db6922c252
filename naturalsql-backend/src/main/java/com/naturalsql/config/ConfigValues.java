package com.naturalsql.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

/**
 * Reads {@code naturalsql.*} properties with an environment-variable fallback.
 */
final class ConfigValues {

    private static final Logger log = LoggerFactory.getLogger(ConfigValues.class);

    private ConfigValues() {
    }

    static String getTrimmed(Environment environment, String propKey, String envKey) {
        String v = null;
        if (environment != null && propKey != null && !propKey.isBlank()) {
            v = environment.getProperty(propKey);
        }
        if ((v == null || v.isBlank()) && envKey != null && !envKey.isBlank()) {
            v = environment != null ? environment.getProperty(envKey) : null;
        }
        if (v == null) {
            return null;
        }
        return v.trim();
    }

    static int getInt(Environment environment, String propKey, String envKey, int defaultValue) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for {} (value={}), using default {}", propKey, raw, defaultValue);
            return defaultValue;
        }
    }

    static boolean getBoolean(Environment environment, String propKey, String envKey, boolean defaultValue) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(raw);
    }
}
