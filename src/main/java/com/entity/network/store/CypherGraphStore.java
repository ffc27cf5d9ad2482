package com.entity.network.store;

import com.entity.network.core.exception.NetworkAnalyticsException;
import com.entity.network.core.exception.StoreUnavailableException;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityMetadata;
import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.core.model.Scope;
import com.entity.network.graph.CypherExecutor;
import com.entity.network.graph.GraphConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * FalkorDB-backed graph store.
 * Entities are {@code :Entity} nodes and relationships are {@code :RELATES} edges,
 * both tagged with the owning scope. Metadata, aliases and evidence ids are
 * stored as JSON strings; timestamps as ISO-8601 strings.
 */
public class CypherGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(CypherGraphStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final CypherExecutor executor;
    private final ObjectMapper objectMapper;

    public CypherGraphStore(GraphConnection connection) {
        this(new CypherExecutor(connection));
    }

    public CypherGraphStore(CypherExecutor executor) {
        this.executor = executor;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<Entity> findEntities(Scope scope) {
        return call("findEntities", () -> executor.findEntitiesInScope(scope.id()).stream()
                .map(this::mapToEntity)
                .toList());
    }

    @Override
    public List<Relationship> findRelationships(Scope scope) {
        return call("findRelationships", () -> executor.findRelationshipsInScope(scope.id()).stream()
                .map(this::mapToRelationship)
                .toList());
    }

    @Override
    public Optional<Entity> findEntity(Scope scope, String entityId) {
        return call("findEntity", () -> executor.findEntityById(scope.id(), entityId).stream()
                .findFirst()
                .map(this::mapToEntity));
    }

    @Override
    public Optional<Relationship> findRelationship(Scope scope, RelationshipKey key) {
        return call("findRelationship", () -> executor.findRelationship(scope.id(),
                        key.sourceEntityId(), key.targetEntityId(), key.type().name()).stream()
                .findFirst()
                .map(this::mapToRelationship));
    }

    @Override
    public List<Relationship> findRelationshipsOf(Scope scope, String entityId) {
        return call("findRelationshipsOf", () -> executor.findRelationshipsOfEntity(scope.id(), entityId).stream()
                .map(this::mapToRelationship)
                .toList());
    }

    @Override
    public Entity saveEntity(Scope scope, Entity entity) {
        Map<String, Object> props = new HashMap<>();
        props.put("id", entity.getId());
        props.put("name", entity.getName());
        props.put("type", entity.getType().name());
        props.put("metadata", toJson(entity.getMetadata().toStorage()));
        props.put("aliases", toJson(List.copyOf(entity.getAliases())));
        props.put("firstSeen", entity.getFirstSeen().toString());
        props.put("lastSeen", entity.getLastSeen().toString());
        run("saveEntity", () -> executor.upsertEntity(scope.id(), props));
        return entity;
    }

    /**
     * Reads the stored state and writes the folded result; concurrent writers to the
     * same scope are expected to hold the scope write lock.
     */
    @Override
    public Relationship saveRelationship(Scope scope, Relationship relationship) {
        validate(scope, relationship);
        Relationship stored = findRelationship(scope, relationship.key())
                .map(current -> current.reobserve(relationship))
                .orElse(relationship);
        write(scope, stored);
        return stored;
    }

    @Override
    public Relationship replaceRelationship(Scope scope, Relationship relationship) {
        validate(scope, relationship);
        write(scope, relationship);
        return relationship;
    }

    private void validate(Scope scope, Relationship relationship) {
        boolean sourceExists = !relationship.isSelfLoop()
                && findEntity(scope, relationship.getSourceEntityId()).isPresent();
        boolean targetExists = !relationship.isSelfLoop()
                && findEntity(scope, relationship.getTargetEntityId()).isPresent();
        RelationshipValidation.check(scope, relationship, sourceExists, targetExists);
    }

    private void write(Scope scope, Relationship relationship) {
        Map<String, Object> props = new HashMap<>();
        props.put("sourceEntityId", relationship.getSourceEntityId());
        props.put("targetEntityId", relationship.getTargetEntityId());
        props.put("type", relationship.getType().name());
        props.put("confidence", relationship.getConfidence());
        props.put("weight", relationship.getWeight());
        props.put("firstObserved", relationship.getFirstObserved().toString());
        props.put("lastObserved", relationship.getLastObserved().toString());
        props.put("observationCount", relationship.getObservationCount());
        props.put("evidence", toJson(List.copyOf(relationship.getEvidenceIds())));
        run("saveRelationship", () -> executor.upsertRelationship(scope.id(), props));
    }

    @Override
    public boolean deleteRelationship(Scope scope, RelationshipKey key) {
        if (findRelationship(scope, key).isEmpty()) {
            return false;
        }
        run("deleteRelationship", () -> executor.deleteRelationship(scope.id(),
                key.sourceEntityId(), key.targetEntityId(), key.type().name()));
        return true;
    }

    @Override
    public boolean deleteEntity(Scope scope, String entityId) {
        if (findEntity(scope, entityId).isEmpty()) {
            return false;
        }
        run("deleteEntity", () -> executor.deleteEntity(scope.id(), entityId));
        return true;
    }

    @Override
    public boolean isAvailable() {
        return executor.getConnection().isConnected();
    }

    // ========== Mapping ==========

    Entity mapToEntity(Map<String, Object> row) {
        Map<String, Object> rawMetadata = fromJson((String) row.get("metadata"), MAP_TYPE, Map.of());
        List<String> aliases = fromJson((String) row.get("aliases"), LIST_TYPE, List.of());
        return Entity.builder()
                .id((String) row.get("id"))
                .name((String) row.get("name"))
                .type(EntityType.fromLabel((String) row.get("type")))
                .metadata(EntityMetadata.fromStorage(rawMetadata))
                .aliases(new LinkedHashSet<>(aliases))
                .firstSeen(parseInstant(row.get("firstSeen")))
                .lastSeen(parseInstant(row.get("lastSeen")))
                .build();
    }

    Relationship mapToRelationship(Map<String, Object> row) {
        List<String> evidence = fromJson((String) row.get("evidence"), LIST_TYPE, List.of());
        return Relationship.builder()
                .sourceEntityId((String) row.get("sourceEntityId"))
                .targetEntityId((String) row.get("targetEntityId"))
                .type(RelationshipType.fromLabel((String) row.get("type")))
                .confidence(number(row.get("confidence"), 0.5))
                .weight(number(row.get("weight"), 1.0))
                .firstObserved(parseInstant(row.get("firstObserved")))
                .lastObserved(parseInstant(row.get("lastObserved")))
                .observationCount((int) number(row.get("observationCount"), 0))
                .evidenceIds(Set.copyOf(evidence))
                .build();
    }

    private static double number(Object value, double fallback) {
        return value instanceof Number n ? n.doubleValue() : fallback;
    }

    private static Instant parseInstant(Object value) {
        return value instanceof String s && !s.isEmpty() ? Instant.parse(s) : null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Failed to serialize property: " + e.getMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isEmpty()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("store.property.unreadable json='{}' error={}", json, e.getMessage());
            return fallback;
        }
    }

    // ========== Driver failure translation ==========

    private <T> T call(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (NetworkAnalyticsException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("store.failure operation={} error={}", operation, e.getMessage());
            throw new StoreUnavailableException("Graph store " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private void run(String operation, Runnable body) {
        call(operation, () -> {
            body.run();
            return null;
        });
    }
}
