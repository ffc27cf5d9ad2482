package com.entity.network.store;

import com.entity.network.core.exception.InvalidRelationshipException;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.core.model.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.entity.network.TestGraphs.SCOPE;
import static com.entity.network.TestGraphs.T0;
import static com.entity.network.TestGraphs.edge;
import static com.entity.network.TestGraphs.entity;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryGraphStore")
class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.saveEntity(SCOPE, entity("b"));
        store.saveEntity(SCOPE, entity("a"));
        store.saveEntity(SCOPE, entity("c"));
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        @DisplayName("Should list entities ordered by id")
        void testOrdered() {
            assertEquals(List.of("a", "b", "c"),
                    store.findEntities(SCOPE).stream().map(e -> e.getId()).toList());
        }

        @Test
        @DisplayName("Deleting an entity removes its relationships")
        void testDeleteCascades() {
            store.saveRelationship(SCOPE, edge("a", "b"));
            store.saveRelationship(SCOPE, edge("b", "c"));
            store.saveRelationship(SCOPE, edge("a", "c"));

            assertTrue(store.deleteEntity(SCOPE, "b"));

            assertTrue(store.findEntity(SCOPE, "b").isEmpty());
            List<Relationship> remaining = store.findRelationships(SCOPE);
            assertEquals(1, remaining.size());
            assertEquals("a", remaining.get(0).getSourceEntityId());
            assertEquals("c", remaining.get(0).getTargetEntityId());
        }

        @Test
        @DisplayName("Deleting an unknown entity reports false")
        void testDeleteUnknown() {
            assertFalse(store.deleteEntity(SCOPE, "missing"));
        }
    }

    @Nested
    @DisplayName("Relationships")
    class Relationships {

        @Test
        @DisplayName("Should reject self-loops")
        void testSelfLoop() {
            assertThrows(InvalidRelationshipException.class, () -> store.saveRelationship(SCOPE, edge("a", "a")));
        }

        @Test
        @DisplayName("Should reject unknown endpoints")
        void testUnknownEndpoint() {
            InvalidRelationshipException e = assertThrows(InvalidRelationshipException.class,
                    () -> store.saveRelationship(SCOPE, edge("a", "ghost")));
            assertTrue(e.getMessage().contains("ghost"));
            assertTrue(store.findRelationships(SCOPE).isEmpty());
        }

        @Test
        @DisplayName("Saving the same key again accumulates into the stored relationship")
        void testReobservation() {
            store.saveRelationship(SCOPE, edge("a", "b", RelationshipType.FUNDS).toBuilder()
                    .observationCount(5).confidence(0.9).weight(5.0).build());
            Relationship later = edge("a", "b", RelationshipType.FUNDS).toBuilder()
                    .observationCount(1).confidence(0.4).weight(1.0)
                    .firstObserved(T0.plusSeconds(3600)).build();

            Relationship returned = store.saveRelationship(SCOPE, later);

            assertEquals(1, store.findRelationships(SCOPE).size());
            Relationship stored = store.findRelationship(SCOPE,
                    new RelationshipKey("a", "b", RelationshipType.FUNDS)).orElseThrow();
            assertEquals(stored, returned);
            assertEquals(6, stored.getObservationCount());
            assertEquals(0.9, stored.getConfidence(), 1e-9);
            assertEquals(6.0, stored.getWeight(), 1e-9);
            assertEquals(T0, stored.getFirstObserved());
            assertEquals(T0.plusSeconds(3600), stored.getLastObserved());
        }

        @Test
        @DisplayName("Evidence is unioned and replayed evidence is not counted twice")
        void testEvidenceReplay() {
            store.saveRelationship(SCOPE, edge("a", "b").toBuilder().evidence("c1").evidence("c2").build());
            store.saveRelationship(SCOPE, edge("a", "b").toBuilder().evidence("c2").evidence("c3").build());
            RelationshipKey key = new RelationshipKey("a", "b", RelationshipType.ASSOCIATED_WITH);
            Relationship stored = store.findRelationship(SCOPE, key).orElseThrow();
            assertEquals(Set.of("c1", "c2", "c3"), stored.getEvidenceIds());
            assertEquals(3, stored.getObservationCount());

            store.saveRelationship(SCOPE, edge("a", "b").toBuilder().evidence("c1").build());
            assertEquals(stored, store.findRelationship(SCOPE, key).orElseThrow());
        }

        @Test
        @DisplayName("Replacing writes the given state as is")
        void testReplace() {
            store.saveRelationship(SCOPE, edge("a", "b").toBuilder().observationCount(4).build());
            store.replaceRelationship(SCOPE, edge("a", "b").toBuilder().observationCount(2).build());
            assertEquals(2, store.findRelationship(SCOPE,
                    new RelationshipKey("a", "b", RelationshipType.ASSOCIATED_WITH)).orElseThrow()
                    .getObservationCount());
        }

        @Test
        @DisplayName("Different types between the same pair are distinct relationships")
        void testTypedParallel() {
            store.saveRelationship(SCOPE, edge("a", "b"));
            store.saveRelationship(SCOPE, edge("a", "b", RelationshipType.FUNDS));
            assertEquals(2, store.findRelationships(SCOPE).size());
        }

        @Test
        @DisplayName("Should find relationships on either end")
        void testFindRelationshipsOf() {
            store.saveRelationship(SCOPE, edge("a", "b"));
            store.saveRelationship(SCOPE, edge("c", "a"));
            store.saveRelationship(SCOPE, edge("b", "c"));
            assertEquals(2, store.findRelationshipsOf(SCOPE, "a").size());
        }

        @Test
        @DisplayName("Should delete by key")
        void testDeleteRelationship() {
            store.saveRelationship(SCOPE, edge("a", "b"));
            RelationshipKey key = new RelationshipKey("a", "b", RelationshipType.ASSOCIATED_WITH);
            assertTrue(store.deleteRelationship(SCOPE, key));
            assertFalse(store.deleteRelationship(SCOPE, key));
        }
    }

    @Test
    @DisplayName("Scopes do not see each other's data")
    void testScopeIsolation() {
        Scope other = Scope.of("other");
        store.saveEntity(other, entity("a"));

        assertEquals(1, store.findEntities(other).size());
        assertThrows(InvalidRelationshipException.class, () -> store.saveRelationship(other, edge("a", "b")));
        assertTrue(store.findEntities(Scope.of("empty")).isEmpty());
        assertTrue(store.isAvailable());
    }
}
