package com.entity.network.merge;

import com.entity.network.cache.MutationListener;
import com.entity.network.core.exception.EntityNotFoundException;
import com.entity.network.core.exception.StoreUnavailableException;
import com.entity.network.core.model.ContentItem;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.MetadataKey;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipKey;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.discovery.DiscoveryOptions;
import com.entity.network.discovery.DiscoveryResult;
import com.entity.network.discovery.KeywordRelationshipClassifier;
import com.entity.network.discovery.RelationshipDiscovery;
import com.entity.network.lock.LocalDistributedLock;
import com.entity.network.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.entity.network.TestGraphs.SCOPE;
import static com.entity.network.TestGraphs.T0;
import static com.entity.network.TestGraphs.edge;
import static com.entity.network.TestGraphs.entity;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@DisplayName("EntityMerger")
class EntityMergerTest {

    private InMemoryGraphStore store;
    private MutationListener listener;
    private EntityMerger merger;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        listener = mock(MutationListener.class);
        merger = newMerger(store);
        for (String id : new String[]{"A", "B", "C", "D"}) {
            store.saveEntity(SCOPE, entity(id));
        }
    }

    private EntityMerger newMerger(InMemoryGraphStore target) {
        EntityMerger created = new EntityMerger(target, new LocalDistributedLock());
        created.addMutationListener(listener);
        return created;
    }

    @Nested
    @DisplayName("Relationship migration")
    class Migration {

        @Test
        @DisplayName("Relationships of the source move to the target and the source is deleted")
        void testMovesRelationships() {
            store.saveRelationship(SCOPE, edge("B", "C"));
            store.saveRelationship(SCOPE, edge("D", "B", RelationshipType.FUNDS));

            MergeResult result = merger.merge(SCOPE, "B", "A");

            assertTrue(result.isSuccess());
            assertTrue(result.sourceDeleted());
            assertEquals(2, result.migrated().size());
            assertTrue(store.findEntity(SCOPE, "B").isEmpty());
            assertTrue(store.findRelationship(SCOPE,
                    new RelationshipKey("A", "C", RelationshipType.ASSOCIATED_WITH)).isPresent());
            assertTrue(store.findRelationship(SCOPE,
                    new RelationshipKey("D", "A", RelationshipType.FUNDS)).isPresent());
            assertTrue(store.findRelationshipsOf(SCOPE, "B").isEmpty());
            verify(listener).onMutation(SCOPE);
        }

        @Test
        @DisplayName("A relationship between source and target is dropped, not turned into a self-loop")
        void testDropsSelfLoop() {
            store.saveRelationship(SCOPE, edge("A", "B"));

            MergeResult result = merger.merge(SCOPE, "B", "A");

            assertEquals(1, result.dropped());
            assertTrue(result.migrated().isEmpty());
            assertTrue(store.findRelationshipsOf(SCOPE, "A").isEmpty());
        }

        @Test
        @DisplayName("A relationship the target already has is combined instead of duplicated")
        void testCombinesDuplicates() {
            store.saveRelationship(SCOPE, edge("A", "C").toBuilder()
                    .confidence(0.6).weight(2.0).observationCount(2).evidenceIds(Set.of("c1", "c2")).build());
            store.saveRelationship(SCOPE, edge("B", "C").toBuilder()
                    .confidence(0.8).weight(1.0).observationCount(2).evidenceIds(Set.of("c2", "c3"))
                    .lastObserved(T0.plusSeconds(3600)).build());

            MergeResult result = merger.merge(SCOPE, "B", "A");

            assertEquals(1, result.combined());
            Relationship merged = store.findRelationship(SCOPE,
                    new RelationshipKey("A", "C", RelationshipType.ASSOCIATED_WITH)).orElseThrow();
            assertEquals(0.8, merged.getConfidence(), 1e-9);
            assertEquals(3.0, merged.getWeight(), 1e-9);
            assertEquals(3, merged.getObservationCount());
            assertEquals(Set.of("c1", "c2", "c3"), merged.getEvidenceIds());
            assertEquals(T0.plusSeconds(3600), merged.getLastObserved());
            assertEquals(1, store.findRelationships(SCOPE).size());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Discovery on the same scope waits until the merge has deleted the source")
        void testDiscoveryWaitsForMerge() throws Exception {
            store.saveRelationship(SCOPE, edge("B", "C"));
            CountDownLatch merging = new CountDownLatch(1);
            CountDownLatch proceed = new CountDownLatch(1);
            InMemoryGraphStore paused = spy(store);
            doAnswer(invocation -> {
                merging.countDown();
                assertTrue(proceed.await(5, TimeUnit.SECONDS));
                return invocation.callRealMethod();
            }).when(paused).saveEntity(any(), any());

            LocalDistributedLock lock = new LocalDistributedLock();
            EntityMerger pausedMerger = new EntityMerger(paused, lock);
            RelationshipDiscovery discovery = new RelationshipDiscovery(paused, new KeywordRelationshipClassifier(),
                    lock, Clock.fixed(T0, ZoneOffset.UTC));
            List<ContentItem> items = List.of(
                    new ContentItem("i1", Set.of("B", "D"), "", T0),
                    new ContentItem("i2", Set.of("B", "D"), "", T0));

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<MergeResult> merge = executor.submit(() -> pausedMerger.merge(SCOPE, "B", "A"));
                assertTrue(merging.await(5, TimeUnit.SECONDS));
                Future<DiscoveryResult> discovered = executor.submit(
                        () -> discovery.discover(SCOPE, items, new DiscoveryOptions(2, null, null, 100)));

                assertThrows(TimeoutException.class, () -> discovered.get(200, TimeUnit.MILLISECONDS));
                proceed.countDown();

                assertTrue(merge.get(5, TimeUnit.SECONDS).isSuccess());
                DiscoveryResult result = discovered.get(5, TimeUnit.SECONDS);
                assertFalse(result.hasCommitted());
                assertEquals(1, result.skippedEntities());
            } finally {
                proceed.countDown();
                executor.shutdownNow();
            }
            assertTrue(store.findRelationshipsOf(SCOPE, "B").isEmpty());
            assertEquals(1, store.findRelationships(SCOPE).size());
        }
    }

    @Nested
    @DisplayName("Target update")
    class TargetUpdate {

        @Test
        @DisplayName("The source name becomes an alias and missing metadata is copied")
        void testAbsorb() {
            Entity target = Entity.builder().id("T").name("Acme Corp").type(EntityType.ORGANIZATION)
                    .metadata(MetadataKey.WIKIDATA_ID, "kept").firstSeen(T0.plusSeconds(100)).build();
            Entity source = Entity.builder().id("S").name("ACME").type(EntityType.ORGANIZATION)
                    .alias("Acme Corp").alias("Acme Inc")
                    .metadata(MetadataKey.WIKIDATA_ID, "dropped")
                    .metadata(MetadataKey.COUNTRY, "copied")
                    .firstSeen(T0).lastSeen(T0.plusSeconds(500)).build();

            Entity merged = EntityMerger.absorb(target, source);

            assertEquals("T", merged.getId());
            assertEquals("Acme Corp", merged.getName());
            assertEquals(Set.of("ACME", "Acme Inc"), merged.getAliases());
            assertEquals("kept", merged.getMetadata().get(MetadataKey.WIKIDATA_ID).orElseThrow());
            assertEquals("copied", merged.getMetadata().get(MetadataKey.COUNTRY).orElseThrow());
            assertEquals(T0, merged.getFirstSeen());
            assertEquals(T0.plusSeconds(500), merged.getLastSeen());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Unknown entities are rejected before any write")
        void testUnknownEntity() {
            assertThrows(EntityNotFoundException.class, () -> merger.merge(SCOPE, "ghost", "A"));
            assertThrows(EntityNotFoundException.class, () -> merger.merge(SCOPE, "A", "ghost"));
            verify(listener, never()).onMutation(any());
        }

        @Test
        @DisplayName("Merging an entity into itself is rejected")
        void testSelfMerge() {
            assertThrows(IllegalArgumentException.class, () -> merger.merge(SCOPE, "A", "A"));
        }

        @Test
        @DisplayName("A store failure reports what was committed and keeps the source")
        void testPartialFailure() {
            store.saveRelationship(SCOPE, edge("B", "C"));
            InMemoryGraphStore failing = spy(store);
            doThrow(new StoreUnavailableException("down")).when(failing).saveEntity(any(), any());

            MergeResult result = newMerger(failing).merge(SCOPE, "B", "A");

            assertFalse(result.isSuccess());
            assertInstanceOf(StoreUnavailableException.class, result.failure().orElseThrow());
            assertEquals(1, result.migrated().size());
            assertNull(result.canonical());
            assertFalse(result.sourceDeleted());
            assertTrue(store.findEntity(SCOPE, "B").isPresent());
            verify(listener).onMutation(SCOPE);
        }
    }
}
