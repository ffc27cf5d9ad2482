package com.entity.network.discovery;

import com.entity.network.cache.MutationListener;
import com.entity.network.core.exception.StoreUnavailableException;
import com.entity.network.core.model.ContentItem;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.lock.DistributedLock;
import com.entity.network.lock.LocalDistributedLock;
import com.entity.network.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static com.entity.network.TestGraphs.SCOPE;
import static com.entity.network.TestGraphs.T0;
import static com.entity.network.TestGraphs.entity;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("RelationshipDiscovery")
class RelationshipDiscoveryTest {

    private static final Instant NOW = T0.plus(Duration.ofDays(10));
    private static final DiscoveryOptions ALL_TIME = new DiscoveryOptions(2, null, null, 100);

    private InMemoryGraphStore store;
    private MutationListener listener;
    private RelationshipDiscovery discovery;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        for (String id : List.of("X", "Y", "Z")) {
            store.saveEntity(SCOPE, entity(id));
        }
        listener = mock(MutationListener.class);
        discovery = newDiscovery(store);
    }

    private RelationshipDiscovery newDiscovery(InMemoryGraphStore target) {
        RelationshipDiscovery created = new RelationshipDiscovery(target, new KeywordRelationshipClassifier(),
                new LocalDistributedLock(), Clock.fixed(NOW, ZoneOffset.UTC));
        created.addMutationListener(listener);
        return created;
    }

    private static ContentItem item(String id, String text, int dayOffset, String... entityIds) {
        return new ContentItem(id, Set.of(entityIds), text, T0.plus(Duration.ofDays(dayOffset)));
    }

    @Nested
    @DisplayName("Co-occurrence threshold")
    class Threshold {

        @Test
        @DisplayName("One co-occurrence below the minimum creates nothing; a second one creates the edge")
        void testThresholdScenario() {
            ContentItem first = item("c1", "", 1, "X", "Y");
            DiscoveryResult before = discovery.discover(SCOPE, List.of(first), ALL_TIME);
            assertFalse(before.hasCommitted());
            assertTrue(store.findRelationships(SCOPE).isEmpty());
            verify(listener, never()).onMutation(any());

            ContentItem second = item("c2", "", 2, "X", "Y");
            DiscoveryResult after = discovery.discover(SCOPE, List.of(first, second), ALL_TIME);
            assertEquals(1, after.created().size());
            Relationship edge = after.created().get(0);
            assertEquals("X", edge.getSourceEntityId());
            assertEquals("Y", edge.getTargetEntityId());
            assertEquals(RelationshipType.ASSOCIATED_WITH, edge.getType());
            assertEquals(2, edge.getObservationCount());
            assertEquals(RelationshipDiscovery.confidence(2, 0), edge.getConfidence(), 1e-9);
            assertEquals(Set.of("c1", "c2"), edge.getEvidenceIds());
            assertEquals(T0.plus(Duration.ofDays(1)), edge.getFirstObserved());
            assertEquals(T0.plus(Duration.ofDays(2)), edge.getLastObserved());
            assertEquals(1, store.findRelationships(SCOPE).size());
            verify(listener, times(1)).onMutation(SCOPE);
        }

        @Test
        @DisplayName("Items outside the time window do not count")
        void testTimeWindow() {
            List<ContentItem> items = List.of(item("old", "", 0, "X", "Y"), item("new", "", 9, "X", "Y"));
            DiscoveryResult result = discovery.discover(SCOPE, items, DiscoveryOptions.of(2, Duration.ofDays(5)));
            assertFalse(result.hasCommitted());
            assertEquals(0, result.candidatePairs());
        }

        @Test
        @DisplayName("The same item mentioning a pair twice counts once")
        void testDistinctItems() {
            List<ContentItem> items = List.of(item("c1", "", 1, "X", "Y"), item("c1", "", 1, "X", "Y"));
            assertFalse(discovery.discover(SCOPE, items, ALL_TIME).hasCommitted());
        }
    }

    @Nested
    @DisplayName("Classification and confidence")
    class Confidence {

        @Test
        @DisplayName("Confidence grows with observations and keyword hits and is capped")
        void testConfidenceFormula() {
            assertEquals(0.6, RelationshipDiscovery.confidence(2, 0), 1e-9);
            assertEquals(0.7, RelationshipDiscovery.confidence(2, 2), 1e-9);
            assertEquals(0.75, RelationshipDiscovery.confidence(2, 10), 1e-9);
            assertEquals(0.95, RelationshipDiscovery.confidence(50, 3), 1e-9);
        }

        @Test
        @DisplayName("Keyword hits decide the relationship type")
        void testTyped() {
            List<ContentItem> items = List.of(
                    item("c1", "X funds Y", 1, "X", "Y"),
                    item("c2", "X finances Y again", 2, "X", "Y"));
            Relationship edge = discovery.discover(SCOPE, items, ALL_TIME).created().get(0);
            assertEquals(RelationshipType.FUNDS, edge.getType());
            assertEquals(RelationshipDiscovery.confidence(2, 2), edge.getConfidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Re-observation")
    class Reobservation {

        @Test
        @DisplayName("Re-running over the same items changes nothing")
        void testIdempotent() {
            List<ContentItem> items = List.of(item("c1", "", 1, "X", "Y"), item("c2", "", 2, "X", "Y"));
            discovery.discover(SCOPE, items, ALL_TIME);
            Relationship before = store.findRelationships(SCOPE).get(0);

            DiscoveryResult again = discovery.discover(SCOPE, items, ALL_TIME);
            assertFalse(again.hasCommitted());
            assertEquals(1, again.unchanged());
            Relationship after = store.findRelationships(SCOPE).get(0);
            assertEquals(before.getObservationCount(), after.getObservationCount());
            assertEquals(before.getConfidence(), after.getConfidence());
            verify(listener, times(1)).onMutation(SCOPE);
        }

        @Test
        @DisplayName("New items strengthen the existing edge")
        void testStrengthen() {
            discovery.discover(SCOPE, List.of(item("c1", "", 1, "X", "Y"), item("c2", "", 2, "X", "Y")), ALL_TIME);

            DiscoveryResult result = discovery.discover(SCOPE, List.of(
                    item("c1", "", 1, "X", "Y"), item("c2", "", 2, "X", "Y"), item("c3", "", 5, "X", "Y")), ALL_TIME);
            assertEquals(1, result.updated().size());
            Relationship edge = store.findRelationship(SCOPE,
                    new RelationshipKey("X", "Y", RelationshipType.ASSOCIATED_WITH)).orElseThrow();
            assertEquals(3, edge.getObservationCount());
            assertEquals(RelationshipDiscovery.confidence(3, 0), edge.getConfidence(), 1e-9);
            assertEquals(T0.plus(Duration.ofDays(5)), edge.getLastObserved());
            assertEquals(T0.plus(Duration.ofDays(1)), edge.getFirstObserved());
        }

        @Test
        @DisplayName("A changed classification retypes the pair's edge instead of adding a second one")
        void testRetype() {
            List<ContentItem> plain = List.of(item("i1", "", 1, "X", "Y"), item("i2", "", 2, "X", "Y"));
            discovery.discover(SCOPE, plain, ALL_TIME);

            DiscoveryResult result = discovery.discover(SCOPE, List.of(
                    plain.get(0), plain.get(1),
                    item("i3", "X funds Y", 3, "X", "Y"),
                    item("i4", "X finances Y", 4, "X", "Y")), ALL_TIME);

            assertTrue(result.created().isEmpty());
            assertEquals(1, result.updated().size());
            List<Relationship> all = store.findRelationships(SCOPE);
            assertEquals(1, all.size());
            Relationship edge = all.get(0);
            assertEquals(RelationshipType.FUNDS, edge.getType());
            assertEquals(4, edge.getObservationCount());
            assertEquals(4.0, edge.getWeight(), 1e-9);
            assertEquals(Set.of("i1", "i2", "i3", "i4"), edge.getEvidenceIds());
            assertTrue(store.findRelationship(SCOPE,
                    new RelationshipKey("X", "Y", RelationshipType.ASSOCIATED_WITH)).isEmpty());
        }

        @Test
        @DisplayName("An unrelated edge of another type between the pair is left alone")
        void testRetypeIgnoresOtherEdges() {
            store.saveRelationship(SCOPE, Relationship.builder().sourceEntityId("X").targetEntityId("Y")
                    .type(RelationshipType.OPPOSES).firstObserved(T0).evidence("manual").build());

            DiscoveryResult result = discovery.discover(SCOPE,
                    List.of(item("c1", "", 1, "X", "Y"), item("c2", "", 2, "X", "Y")), ALL_TIME);

            assertEquals(1, result.created().size());
            assertEquals(2, store.findRelationships(SCOPE).size());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unknown entities are skipped and counted")
        void testUnknownEntities() {
            List<ContentItem> items = List.of(item("c1", "", 1, "X", "Y", "ghost"), item("c2", "", 2, "X", "Y", "ghost"));
            DiscoveryResult result = discovery.discover(SCOPE, items, ALL_TIME);
            assertEquals(1, result.skippedEntities());
            assertEquals(1, result.created().size());
        }

        @Test
        @DisplayName("A failed write stops the run and reports what was committed")
        void testPartialFailure() {
            InMemoryGraphStore flaky = spy(store);
            doCallRealMethod()
                    .doThrow(new StoreUnavailableException("store went away"))
                    .when(flaky).saveRelationship(any(), any());
            RelationshipDiscovery failing = newDiscovery(flaky);

            List<ContentItem> items = List.of(
                    item("c1", "", 1, "X", "Y", "Z"),
                    item("c2", "", 2, "X", "Y", "Z"));
            DiscoveryResult result = failing.discover(SCOPE, items, ALL_TIME);

            assertEquals(3, result.candidatePairs());
            assertEquals(1, result.created().size());
            assertFalse(result.isComplete());
            assertInstanceOf(StoreUnavailableException.class, result.failure().orElseThrow());
            assertEquals(1, flaky.findRelationships(SCOPE).size());
            verify(listener, times(1)).onMutation(SCOPE);
        }

        @Test
        @DisplayName("A failing listener does not fail the run")
        void testListenerFailure() {
            MutationListener broken = scope -> {
                throw new IllegalStateException("listener down");
            };
            discovery.addMutationListener(broken);
            DiscoveryResult result = discovery.discover(SCOPE,
                    List.of(item("c1", "", 1, "X", "Y"), item("c2", "", 2, "X", "Y")), ALL_TIME);
            assertTrue(result.isComplete());
            assertEquals(1, result.created().size());
        }

        @Test
        @DisplayName("Runs on a scope take and release the scope lock")
        void testLocking() {
            DistributedLock lock = mock(DistributedLock.class);
            RelationshipDiscovery locked = new RelationshipDiscovery(store, new KeywordRelationshipClassifier(),
                    lock, Clock.fixed(NOW, ZoneOffset.UTC));
            locked.discover(SCOPE, List.of(), ALL_TIME);

            InOrder order = inOrder(lock);
            order.verify(lock).lock(DistributedLock.writeKey(SCOPE));
            order.verify(lock).unlock(DistributedLock.writeKey(SCOPE));
        }
    }
}
