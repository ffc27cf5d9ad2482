package com.entity.network.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, strongly-typed metadata map keyed by {@link MetadataKey}.
 */
public final class EntityMetadata {
    private static final Logger log = LoggerFactory.getLogger(EntityMetadata.class);
    private static final EntityMetadata EMPTY = new EntityMetadata(new EnumMap<>(MetadataKey.class));

    private final Map<MetadataKey, String> values;

    private EntityMetadata(EnumMap<MetadataKey, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static EntityMetadata empty() {
        return EMPTY;
    }

    public static EntityMetadata of(Map<MetadataKey, String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        EnumMap<MetadataKey, String> copy = new EnumMap<>(MetadataKey.class);
        values.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return new EntityMetadata(copy);
    }

    /**
     * Builds metadata from raw storage keys. Keys outside the known set are dropped.
     */
    public static EntityMetadata fromStorage(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        EnumMap<MetadataKey, String> copy = new EnumMap<>(MetadataKey.class);
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            Optional<MetadataKey> key = MetadataKey.fromStorageKey(entry.getKey());
            if (key.isEmpty()) {
                log.debug("Dropping unknown metadata key '{}'", entry.getKey());
                continue;
            }
            if (entry.getValue() != null) {
                copy.put(key.get(), entry.getValue().toString());
            }
        }
        return new EntityMetadata(copy);
    }

    public Optional<String> get(MetadataKey key) {
        return Optional.ofNullable(values.get(key));
    }

    public EntityMetadata with(MetadataKey key, String value) {
        EnumMap<MetadataKey, String> copy = new EnumMap<>(MetadataKey.class);
        copy.putAll(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new EntityMetadata(copy);
    }

    public Map<MetadataKey, String> asMap() {
        return values;
    }

    /**
     * Returns the metadata keyed by storage names, for persistence and export.
     */
    public Map<String, String> toStorage() {
        Map<String, String> raw = new LinkedHashMap<>();
        values.forEach((key, value) -> raw.put(key.getStorageKey(), value));
        return raw;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((EntityMetadata) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "EntityMetadata" + values;
    }
}
