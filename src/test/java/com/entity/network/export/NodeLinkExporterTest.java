package com.entity.network.export;

import com.entity.network.api.GraphEdge;
import com.entity.network.api.GraphNode;
import com.entity.network.api.NetworkGraph;
import com.entity.network.cluster.Cluster;
import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.layout.Point;
import com.entity.network.snapshot.GraphSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static com.entity.network.TestGraphs.SCOPE;
import static com.entity.network.TestGraphs.T0;
import static com.entity.network.TestGraphs.edge;
import static com.entity.network.TestGraphs.entity;
import static com.entity.network.TestGraphs.snapshot;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NodeLinkExporter")
class NodeLinkExporterTest {

    private final NodeLinkExporter exporter = new NodeLinkExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    private static NetworkGraph sampleGraph() {
        GraphSnapshot snapshot = snapshot(
                List.of(entity("a"), entity("b", EntityType.ORGANIZATION), entity("c")),
                List.of(edge("a", "b", RelationshipType.FUNDS), edge("b", "c")));
        List<GraphNode> nodes = List.of(
                new GraphNode("a", "Name a", EntityType.PERSON, 1.5, -2.0, "cluster_0"),
                new GraphNode("b", "Name b", EntityType.ORGANIZATION, null, null, null),
                new GraphNode("c", "Name c", EntityType.PERSON, 0.0, 0.0, "cluster_0"));
        List<GraphEdge> edges = snapshot.relationships().stream().map(GraphEdge::of).toList();
        Cluster cluster = new Cluster("cluster_0", "Name a +1", "a", List.of("a", "c"),
                new Point(0.75, -1.0), EntityType.PERSON, Map.of(EntityType.PERSON, 2));
        return new NetworkGraph(SCOPE, nodes, edges, List.of(cluster), snapshot.stats(),
                false, true, List.of("clusters skipped: too large"), Map.of("snapshot", 3L), T0);
    }

    @Test
    @DisplayName("Should write nodes, omitting absent optional fields")
    void testNodes() throws Exception {
        JsonNode root = mapper.readTree(exporter.toJson(sampleGraph()));

        assertEquals(SCOPE.id(), root.get("scope").asText());
        assertEquals(T0.toString(), root.get("snapshotLoadedAt").asText());
        JsonNode nodes = root.get("nodes");
        assertEquals(3, nodes.size());
        assertEquals(1.5, nodes.get(0).get("x").asDouble());
        assertEquals("cluster_0", nodes.get(0).get("clusterId").asText());
        assertEquals("organization", nodes.get(1).get("type").asText());
        assertFalse(nodes.get(1).has("x"));
        assertFalse(nodes.get(1).has("clusterId"));
    }

    @Test
    @DisplayName("Should write edges with lowercase type labels")
    void testEdges() throws Exception {
        JsonNode edges = mapper.readTree(exporter.toJson(sampleGraph())).get("edges");
        assertEquals(2, edges.size());
        boolean sawFunds = false;
        for (JsonNode edge : edges) {
            if (edge.get("type").asText().equals("funds")) {
                sawFunds = true;
                assertEquals("a", edge.get("source").asText());
                assertEquals("b", edge.get("target").asText());
                assertEquals(1.0, edge.get("weight").asDouble());
                assertEquals(0.5, edge.get("confidence").asDouble());
            }
        }
        assertTrue(sawFunds);
    }

    @Test
    @DisplayName("Should write clusters, stats, warnings and timings")
    void testClustersAndStats() throws Exception {
        JsonNode root = mapper.readTree(exporter.toJson(sampleGraph()));

        JsonNode cluster = root.get("clusters").get(0);
        assertEquals("Name a +1", cluster.get("label").asText());
        assertEquals(2, cluster.get("size").asInt());
        assertEquals("person", cluster.get("dominantType").asText());
        assertEquals(0.75, cluster.get("centroid").get("x").asDouble());
        assertEquals(2, cluster.get("memberIds").size());

        JsonNode stats = root.get("stats");
        assertEquals(3, stats.get("nodeCount").asInt());
        assertEquals(2, stats.get("edgeCount").asInt());
        assertEquals(1, stats.get("relationshipTypes").get("funds").asInt());

        assertTrue(root.get("layoutTruncated").asBoolean());
        assertFalse(root.get("layoutApproximate").asBoolean());
        assertEquals("clusters skipped: too large", root.get("warnings").get(0).asText());
        assertEquals(3, root.get("timingsMs").get("snapshot").asLong());
    }

    @Test
    @DisplayName("Writer output matches the string form")
    void testWriter() throws Exception {
        NetworkGraph graph = sampleGraph();
        StringWriter writer = new StringWriter();
        exporter.write(graph, writer);
        assertEquals(mapper.readTree(exporter.toJson(graph)), mapper.readTree(writer.toString()));
    }
}
