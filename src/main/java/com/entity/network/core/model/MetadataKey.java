package com.entity.network.core.model;

import java.util.Optional;

/**
 * Closed set of metadata keys an entity may carry.
 */
public enum MetadataKey {
    /** External disambiguation identifier (e.g. a Wikidata QID). */
    WIKIDATA_ID("wikidata_id"),
    DESCRIPTION("description"),
    COUNTRY("country"),
    ROLE("role"),
    SOURCE("source"),
    URL("url");

    private final String storageKey;

    MetadataKey(String storageKey) {
        this.storageKey = storageKey;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public static Optional<MetadataKey> fromStorageKey(String key) {
        for (MetadataKey candidate : values()) {
            if (candidate.storageKey.equals(key)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
