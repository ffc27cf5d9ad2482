package com.entity.network.snapshot;

import com.entity.network.TestGraphs;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static com.entity.network.TestGraphs.T0;
import static com.entity.network.TestGraphs.edge;
import static com.entity.network.TestGraphs.entity;
import static com.entity.network.TestGraphs.snapshot;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphSnapshot")
class GraphSnapshotTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should index nodes in ascending id order")
        void testDenseIndexing() {
            GraphSnapshot snapshot = snapshot(List.of(entity("c"), entity("a"), entity("b")), List.of());
            assertEquals(0, snapshot.indexOf("a"));
            assertEquals(1, snapshot.indexOf("b"));
            assertEquals(2, snapshot.indexOf("c"));
            assertEquals(-1, snapshot.indexOf("missing"));
        }

        @Test
        @DisplayName("Should merge parallel relationships into one weighted edge")
        void testParallelEdgesMerged() {
            GraphSnapshot snapshot = snapshot(List.of(entity("a"), entity("b")), List.of(
                    edge("a", "b", RelationshipType.SUPPORTS),
                    edge("b", "a", RelationshipType.FUNDS)));

            assertEquals(1, snapshot.edgeCount());
            assertEquals(2, snapshot.relationships().size());
            assertArrayEquals(new int[]{1}, snapshot.neighbors(0));
            assertEquals(2.0, snapshot.weights(0)[0], 1e-9);
            assertEquals(2.0, snapshot.strength(1), 1e-9);
        }

        @Test
        @DisplayName("Should skip relationships with unknown endpoints and self-loops")
        void testSkipsInvalidRelationships() {
            Relationship selfLoop = Relationship.builder().sourceEntityId("a").targetEntityId("a").build();
            GraphSnapshot snapshot = snapshot(List.of(entity("a"), entity("b")), List.of(
                    edge("a", "ghost"), selfLoop, edge("a", "b")));

            assertEquals(1, snapshot.relationships().size());
            assertEquals(1, snapshot.edgeCount());
        }

        @Test
        @DisplayName("Should order components largest first")
        void testComponents() {
            GraphSnapshot snapshot = snapshot(
                    List.of(entity("a"), entity("b"), entity("c"), entity("d"), entity("e")),
                    List.of(edge("d", "e"), edge("c", "d")));

            assertEquals(3, snapshot.components().size());
            assertEquals(3, snapshot.components().get(0).length);
            assertEquals(snapshot.componentOf(snapshot.indexOf("c")), snapshot.componentOf(snapshot.indexOf("e")));
            assertNotEquals(snapshot.componentOf(snapshot.indexOf("a")), snapshot.componentOf(snapshot.indexOf("b")));
        }

        @Test
        @DisplayName("Empty snapshot has no nodes")
        void testEmpty() {
            GraphSnapshot snapshot = GraphSnapshot.empty(com.entity.network.TestGraphs.SCOPE);
            assertTrue(snapshot.isEmpty());
            assertEquals(0, snapshot.stats().componentCount());
            assertEquals(0.0, snapshot.stats().density());
        }
    }

    @Nested
    @DisplayName("Stats")
    class Stats {

        @Test
        @DisplayName("Should compute density, degree and type counts")
        void testStats() {
            GraphSnapshot snapshot = snapshot(
                    List.of(entity("a"), entity("b", EntityType.ORGANIZATION), entity("c", EntityType.ORGANIZATION)),
                    List.of(edge("a", "b", RelationshipType.LEADS), edge("b", "c")));

            GraphStats stats = snapshot.stats();
            assertEquals(3, stats.nodeCount());
            assertEquals(2, stats.edgeCount());
            assertEquals(2, stats.relationshipCount());
            assertEquals(2.0 / 3.0, stats.density(), 1e-9);
            assertEquals(4.0 / 3.0, stats.averageDegree(), 1e-9);
            assertEquals(1, stats.componentCount());
            assertEquals(2, stats.entityTypes().get(EntityType.ORGANIZATION));
            assertEquals(1, stats.relationshipTypes().get(RelationshipType.LEADS));
        }
    }

    @Nested
    @DisplayName("Neighborhood")
    class NeighborhoodTests {

        private final GraphSnapshot chain = snapshot(
                List.of(entity("a"), entity("b"), entity("c"), entity("d")),
                List.of(edge("a", "b", RelationshipType.FUNDS), edge("b", "c"), edge("c", "d")));

        @Test
        @DisplayName("Should include entities within the hop radius")
        void testDepth() {
            Neighborhood one = chain.neighborhood("b", 1);
            assertEquals(List.of("a", "b", "c"), one.entities().stream().map(Entity::getId).toList());
            assertEquals(2, one.relationships().size());

            Neighborhood two = chain.neighborhood("a", 2);
            assertEquals(3, two.entities().size());
        }

        @Test
        @DisplayName("Should filter relationships by type")
        void testTypeFilter() {
            Neighborhood filtered = chain.neighborhood("b", 1, Set.of(RelationshipType.FUNDS));
            assertEquals(1, filtered.relationships().size());
            assertEquals(RelationshipType.FUNDS, filtered.relationships().get(0).getType());
        }

        @Test
        @DisplayName("Unknown center yields an empty neighborhood")
        void testUnknownCenter() {
            assertTrue(chain.neighborhood("zzz", 2).isEmpty());
        }

        @Test
        @DisplayName("Should reject depth below one")
        void testInvalidDepth() {
            assertThrows(IllegalArgumentException.class, () -> chain.neighborhood("a", 0));
        }
    }

    @Nested
    @DisplayName("Timeline")
    class Timeline {

        @Test
        @DisplayName("Should list relationships oldest first with direction")
        void testTimeline() {
            Relationship later = Relationship.builder().sourceEntityId("a").targetEntityId("b")
                    .firstObserved(T0.plus(Duration.ofDays(2))).build();
            Relationship earlier = Relationship.builder().sourceEntityId("c").targetEntityId("a")
                    .firstObserved(T0.plus(Duration.ofDays(1))).build();
            GraphSnapshot snapshot = snapshot(List.of(entity("a"), entity("b"), entity("c")),
                    List.of(later, earlier));

            List<TimelineEntry> timeline = snapshot.timeline("a");
            assertEquals(2, timeline.size());
            assertEquals("c", timeline.get(0).counterpart().getId());
            assertEquals(TimelineEntry.Direction.INCOMING, timeline.get(0).direction());
            assertEquals(TimelineEntry.Direction.OUTGOING, timeline.get(1).direction());
        }

        @Test
        @DisplayName("Unknown entity has an empty timeline")
        void testUnknownEntity() {
            assertTrue(snapshot(List.of(entity("a")), List.of()).timeline("b").isEmpty());
        }
    }

    @Nested
    @DisplayName("Subset")
    class Subset {

        private final GraphSnapshot graph = TestGraphs.groups(2, 5, 3);

        @Test
        @DisplayName("Should page the most connected entities with the relationships among them")
        void testTopByCentrality() {
            GraphSubset subset = graph.subset(SubsetQuery.top(10));

            assertEquals(10, subset.nodes().size());
            assertEquals(TestGraphs.id(4), subset.nodes().get(0).entity().getId());
            assertEquals(TestGraphs.id(5), subset.nodes().get(1).entity().getId());
            assertEquals(5, subset.nodes().get(0).degree());
            assertEquals(5.0 / 12.0, subset.nodes().get(0).centrality(), 1e-9);
            assertEquals(21, subset.relationships().size());
            assertEquals(13, subset.totalEntities());
            assertEquals(13, subset.filteredEntities());
            assertTrue(subset.hasMore());

            GraphSubset rest = graph.subset(SubsetQuery.top(10).withOffset(10));
            assertEquals(3, rest.nodes().size());
            assertTrue(rest.relationships().isEmpty());
            assertFalse(rest.hasMore());
        }

        @Test
        @DisplayName("Should filter by type and by name prefix ignoring case")
        void testFilters() {
            GraphSubset isolated = graph.subset(SubsetQuery.top(10).withEntityType(EntityType.LOCATION));
            assertEquals(3, isolated.filteredEntities());
            assertTrue(isolated.nodes().stream().allMatch(n -> n.degree() == 0));

            GraphSubset named = graph.subset(SubsetQuery.top(10).withNamePrefix("name N0001"));
            assertEquals(List.of(TestGraphs.id(10), TestGraphs.id(11), TestGraphs.id(12)),
                    named.nodes().stream().map(n -> n.entity().getId()).toList());
        }

        @Test
        @DisplayName("Should order by first sighting, newest first")
        void testRecent() {
            GraphSnapshot dated = snapshot(List.of(
                    Entity.builder().id("old").name("Old").firstSeen(T0).build(),
                    Entity.builder().id("new").name("New").firstSeen(T0.plus(Duration.ofDays(3))).build(),
                    Entity.builder().id("mid").name("Mid").firstSeen(T0.plus(Duration.ofDays(1))).build()),
                    List.of());
            GraphSubset subset = dated.subset(SubsetQuery.top(10).withOrder(SubsetOrder.RECENT)
                    .withRelationships(false));
            assertEquals(List.of("new", "mid", "old"),
                    subset.nodes().stream().map(n -> n.entity().getId()).toList());
        }

        @Test
        @DisplayName("Should reject page sizes outside the allowed range")
        void testLimitBounds() {
            assertThrows(IllegalArgumentException.class, () -> SubsetQuery.top(5));
            assertThrows(IllegalArgumentException.class, () -> SubsetQuery.top(201));
        }

        @Test
        @DisplayName("Should find entities by name ignoring case")
        void testFindByName() {
            assertEquals(TestGraphs.id(3), graph.findByName("NAME " + TestGraphs.id(3)).orElseThrow().getId());
            assertTrue(graph.findByName("nobody").isEmpty());
        }
    }

    @Nested
    @DisplayName("Activity")
    class Activity {

        private final GraphSnapshot dated = snapshot(List.of(
                Entity.builder().id("a").name("A").type(EntityType.PERSON)
                        .firstSeen(T0).lastSeen(T0.plus(Duration.ofDays(2))).build(),
                Entity.builder().id("b").name("B").type(EntityType.PERSON)
                        .firstSeen(T0.plus(Duration.ofDays(1))).build(),
                Entity.builder().id("c").name("C").type(EntityType.ORGANIZATION)
                        .firstSeen(T0.plus(Duration.ofDays(8))).build()),
                List.of(Relationship.builder().sourceEntityId("a").targetEntityId("b")
                        .firstObserved(T0.plus(Duration.ofDays(1)))
                        .lastObserved(T0.plus(Duration.ofDays(9))).build()));

        private final Instant end = T0.plus(Duration.ofDays(10));

        @Test
        @DisplayName("Should aggregate activity per day, omitting quiet days")
        void testDaily() {
            List<ActivityEntry> days = dated.activity(ActivityPeriod.DAY, T0, end, null);

            assertEquals(List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3),
                            LocalDate.of(2024, 1, 9), LocalDate.of(2024, 1, 10)),
                    days.stream().map(ActivityEntry::period).toList());
            assertEquals(new ActivityEntry(LocalDate.of(2024, 1, 2), 2, 1, 1), days.get(1));
            assertEquals(new ActivityEntry(LocalDate.of(2024, 1, 10), 2, 0, 0), days.get(4));
        }

        @Test
        @DisplayName("Should aggregate activity per week starting on Monday")
        void testWeekly() {
            List<ActivityEntry> weeks = dated.activity(ActivityPeriod.WEEK, T0, end, null);
            assertEquals(List.of(
                    new ActivityEntry(LocalDate.of(2024, 1, 1), 2, 2, 1),
                    new ActivityEntry(LocalDate.of(2024, 1, 8), 3, 1, 0)), weeks);
        }

        @Test
        @DisplayName("Should restrict to one entity type and to the time range")
        void testFilters() {
            assertEquals(List.of(new ActivityEntry(LocalDate.of(2024, 1, 9), 1, 1, 0)),
                    dated.activity(ActivityPeriod.DAY, T0, end, EntityType.ORGANIZATION));
            assertEquals(LocalDate.of(2024, 1, 2),
                    dated.activity(ActivityPeriod.DAY, T0.plus(Duration.ofDays(1)), end, null).get(0).period());
        }
    }
}
