package io.nullsafe.core.model;

import java.util.Locale;

/**
 * The three independently activatable rewrites.
 *
 * <ul>
 *   <li>{@link #NAVIGATION}: expands safe-navigation markers ({@code a?.b}).
 *   <li>{@link #API_GUARD}: injects null guards for non-nullable parameters of exposed functions.
 *   <li>{@link #SEQUENCE_WRAP}: turns sequence literals into index-checked safe sequences.
 * </ul>
 */
public enum Feature {
    NAVIGATION("navigation"),
    API_GUARD("api-guard"),
    SEQUENCE_WRAP("sequence-wrap");

    private final String key;

    Feature(String key) {
        this.key = key;
    }

    /** The configuration key, e.g. {@code "api-guard"}. */
    public String key() {
        return key;
    }

    /**
     * Resolves a configuration key (case-insensitive; {@code _} accepted for {@code -}).
     *
     * @throws IllegalArgumentException if no feature has that key
     */
    public static Feature fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Feature feature : values()) {
            if (feature.key.equals(normalized)) {
                return feature;
            }
        }
        throw new IllegalArgumentException(
                "Unknown feature '" + key + "': must be one of navigation, api-guard, sequence-wrap");
    }
}
