package com.driftguard.core.drift;

import java.util.Locale;
import java.util.Objects;

/**
 * Selectable {@link TextEmbedder} implementations.
 *
 * @since 1.0.0
 */
public enum EmbedderType {

    FEATURES("features"),
    HASH("hash");

    private final String id;

    EmbedderType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * @return a new embedder of this type
     */
    public TextEmbedder create() {
        return switch (this) {
            case FEATURES -> new FeatureTextEmbedder();
            case HASH -> new HashingTextEmbedder();
        };
    }

    /**
     * @param name {@code features} or {@code hash} (case-insensitive)
     * @return the matching type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static EmbedderType fromName(String name) {
        Objects.requireNonNull(name, "Embedder name must not be null");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (EmbedderType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown embedder: '" + name + "'. Supported: features, hash");
    }
}
