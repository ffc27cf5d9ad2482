package com.entity.network.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Represents an entity node in the network.
 * Identity is fixed at creation; metadata and aliases change through
 * {@link #toBuilder()} copies so snapshots never observe in-place mutation.
 */
public final class Entity {
    private final String id;
    private final String name;
    private final EntityType type;
    private final EntityMetadata metadata;
    private final Set<String> aliases;
    private final Instant firstSeen;
    private final Instant lastSeen;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.name = builder.name;
        this.type = builder.type;
        this.metadata = builder.metadata != null ? builder.metadata : EntityMetadata.empty();
        this.aliases = builder.aliases != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.aliases))
                : Set.of();
        this.firstSeen = builder.firstSeen != null ? builder.firstSeen : Instant.now();
        this.lastSeen = builder.lastSeen != null ? builder.lastSeen : this.firstSeen;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public EntityType getType() {
        return type;
    }

    public EntityMetadata getMetadata() {
        return metadata;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public Builder toBuilder() {
        return builder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type=" + type +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .name(entity.name)
                .type(entity.type)
                .metadata(entity.metadata)
                .aliases(entity.aliases)
                .firstSeen(entity.firstSeen)
                .lastSeen(entity.lastSeen);
    }

    public static class Builder {
        private String id;
        private String name;
        private EntityType type;
        private EntityMetadata metadata;
        private Set<String> aliases;
        private Instant firstSeen;
        private Instant lastSeen;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder metadata(EntityMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder metadata(MetadataKey key, String value) {
            EntityMetadata current = metadata != null ? metadata : EntityMetadata.empty();
            this.metadata = current.with(key, value);
            return this;
        }

        public Builder aliases(Set<String> aliases) {
            this.aliases = aliases != null ? new LinkedHashSet<>(aliases) : null;
            return this;
        }

        public Builder alias(String alias) {
            if (this.aliases == null) {
                this.aliases = new LinkedHashSet<>();
            }
            this.aliases.add(alias);
            return this;
        }

        public Builder firstSeen(Instant firstSeen) {
            this.firstSeen = firstSeen;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(type, "type is required");
            return new Entity(this);
        }
    }
}
