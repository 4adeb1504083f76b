package io.reactormesh.store;

import io.reactormesh.config.ReactorMeshConfig;

import java.util.Collection;

/**
 * Key and interest-pattern rules. A pattern is an exact key, {@code *} for every key,
 * or a prefix ending in {@code *} such as {@code content.*}.
 */
public final class KeyPatterns {
    private KeyPatterns() {
    }

    public static boolean matches(String pattern, String key) {
        if (pattern == null || key == null) {
            return false;
        }
        if (pattern.endsWith("*")) {
            return key.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(key);
    }

    public static boolean matchesAny(Collection<String> patterns, String key) {
        for (String pattern : patterns) {
            if (matches(pattern, key)) {
                return true;
            }
        }
        return false;
    }

    public static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("mesh key cannot be empty");
        }
        if (key.length() > ReactorMeshConfig.MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("mesh key longer than " + ReactorMeshConfig.MAX_KEY_LENGTH + " chars");
        }
        if (key.endsWith("*")) {
            throw new IllegalArgumentException("mesh key cannot end with a wildcard: " + key);
        }
        for (int i = 0; i < key.length(); i++) {
            if (Character.isWhitespace(key.charAt(i))) {
                throw new IllegalArgumentException("mesh key cannot contain whitespace: " + key);
            }
        }
    }
}
