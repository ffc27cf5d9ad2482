package com.entity.network.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the Cypher queries behind the graph store.
 * Every node and edge carries a {@code scopeId} property; all queries filter on it.
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    private static final String ENTITY_COLUMNS = """
            e.id as id, e.name as name, e.type as type, e.metadata as metadata,
            e.aliases as aliases, e.firstSeen as firstSeen, e.lastSeen as lastSeen
            """;

    private static final String RELATIONSHIP_COLUMNS = """
            s.id as sourceEntityId, t.id as targetEntityId, r.type as type,
            r.confidence as confidence, r.weight as weight,
            r.firstObserved as firstObserved, r.lastObserved as lastObserved,
            r.observationCount as observationCount, r.evidence as evidence
            """;

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    // ========== Entities ==========

    public List<Map<String, Object>> findEntitiesInScope(String scopeId) {
        String query = """
                MATCH (e:Entity)
                WHERE e.scopeId = $scopeId
                RETURN %s
                ORDER BY e.id
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("scopeId", scopeId));
    }

    public List<Map<String, Object>> findEntityById(String scopeId, String entityId) {
        String query = """
                MATCH (e:Entity {scopeId: $scopeId, id: $entityId})
                RETURN %s
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("scopeId", scopeId, "entityId", entityId));
    }

    /**
     * Creates the entity or overwrites its mutable properties.
     */
    public void upsertEntity(String scopeId, Map<String, Object> properties) {
        String query = """
                MERGE (e:Entity {scopeId: $scopeId, id: $id})
                SET e.name = $name,
                    e.type = $type,
                    e.metadata = $metadata,
                    e.aliases = $aliases,
                    e.firstSeen = $firstSeen,
                    e.lastSeen = $lastSeen
                """;
        connection.execute(query, withScope(scopeId, properties));
        log.debug("Upserted entity {} in scope {}", properties.get("id"), scopeId);
    }

    /**
     * Removes an entity together with all of its relationships.
     */
    public void deleteEntity(String scopeId, String entityId) {
        String query = """
                MATCH (e:Entity {scopeId: $scopeId, id: $entityId})
                DETACH DELETE e
                """;
        connection.execute(query, Map.of("scopeId", scopeId, "entityId", entityId));
        log.debug("Deleted entity {} in scope {}", entityId, scopeId);
    }

    // ========== Relationships ==========

    public List<Map<String, Object>> findRelationshipsInScope(String scopeId) {
        String query = """
                MATCH (s:Entity {scopeId: $scopeId})-[r:RELATES]->(t:Entity {scopeId: $scopeId})
                RETURN %s
                """.formatted(RELATIONSHIP_COLUMNS);
        return connection.query(query, Map.of("scopeId", scopeId));
    }

    public List<Map<String, Object>> findRelationship(String scopeId, String sourceEntityId,
                                                      String targetEntityId, String type) {
        String query = """
                MATCH (s:Entity {scopeId: $scopeId, id: $sourceEntityId})-[r:RELATES {type: $type}]->(t:Entity {scopeId: $scopeId, id: $targetEntityId})
                RETURN %s
                """.formatted(RELATIONSHIP_COLUMNS);
        return connection.query(query, Map.of(
                "scopeId", scopeId,
                "sourceEntityId", sourceEntityId,
                "targetEntityId", targetEntityId,
                "type", type
        ));
    }

    /**
     * Finds all relationships involving an entity, as source or target.
     */
    public List<Map<String, Object>> findRelationshipsOfEntity(String scopeId, String entityId) {
        String query = """
                MATCH (s:Entity {scopeId: $scopeId})-[r:RELATES]->(t:Entity {scopeId: $scopeId})
                WHERE s.id = $entityId OR t.id = $entityId
                RETURN %s
                """.formatted(RELATIONSHIP_COLUMNS);
        return connection.query(query, Map.of("scopeId", scopeId, "entityId", entityId));
    }

    /**
     * Creates the relationship for (source, target, type) or overwrites its properties.
     */
    public void upsertRelationship(String scopeId, Map<String, Object> properties) {
        String query = """
                MATCH (s:Entity {scopeId: $scopeId, id: $sourceEntityId})
                MATCH (t:Entity {scopeId: $scopeId, id: $targetEntityId})
                MERGE (s)-[r:RELATES {type: $type}]->(t)
                SET r.confidence = $confidence,
                    r.weight = $weight,
                    r.firstObserved = $firstObserved,
                    r.lastObserved = $lastObserved,
                    r.observationCount = $observationCount,
                    r.evidence = $evidence
                """;
        connection.execute(query, withScope(scopeId, properties));
        log.debug("Upserted relationship {} -[{}]-> {} in scope {}",
                properties.get("sourceEntityId"), properties.get("type"),
                properties.get("targetEntityId"), scopeId);
    }

    public void deleteRelationship(String scopeId, String sourceEntityId, String targetEntityId, String type) {
        String query = """
                MATCH (s:Entity {scopeId: $scopeId, id: $sourceEntityId})-[r:RELATES {type: $type}]->(t:Entity {scopeId: $scopeId, id: $targetEntityId})
                DELETE r
                """;
        connection.execute(query, Map.of(
                "scopeId", scopeId,
                "sourceEntityId", sourceEntityId,
                "targetEntityId", targetEntityId,
                "type", type
        ));
    }

    private static Map<String, Object> withScope(String scopeId, Map<String, Object> properties) {
        Map<String, Object> params = new HashMap<>(properties);
        params.put("scopeId", scopeId);
        return params;
    }
}
