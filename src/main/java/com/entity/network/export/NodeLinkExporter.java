package com.entity.network.export;

import com.entity.network.api.GraphEdge;
import com.entity.network.api.GraphNode;
import com.entity.network.api.NetworkGraph;
import com.entity.network.cluster.Cluster;
import com.entity.network.core.exception.NetworkAnalyticsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Writes a {@link NetworkGraph} as node-link JSON for the visualization client.
 *
 * <pre>
 * {"scope": "...", "nodes": [{"id", "label", "type", "x", "y", "clusterId"}],
 *  "edges": [{"source", "target", "type", "weight", "confidence"}],
 *  "clusters": [{"id", "label", "memberIds", "centroid", "size", "dominantType"}],
 *  "stats": {...}, "warnings": [...], "timingsMs": {...}}
 * </pre>
 * Optional node fields are omitted when absent. Types are written as lowercase labels.
 */
public class NodeLinkExporter {
    private static final Logger log = LoggerFactory.getLogger(NodeLinkExporter.class);

    private final ObjectMapper objectMapper;

    public NodeLinkExporter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public NodeLinkExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toTree(NetworkGraph graph) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("scope", graph.scope().id());
        root.put("snapshotLoadedAt", graph.snapshotLoadedAt().toString());

        ArrayNode nodes = root.putArray("nodes");
        for (GraphNode node : graph.nodes()) {
            ObjectNode json = nodes.addObject()
                    .put("id", node.id())
                    .put("label", node.label())
                    .put("type", node.type().name().toLowerCase());
            if (node.hasPosition()) {
                json.put("x", node.x());
                json.put("y", node.y());
            }
            if (node.clusterId() != null) {
                json.put("clusterId", node.clusterId());
            }
        }

        ArrayNode edges = root.putArray("edges");
        for (GraphEdge edge : graph.edges()) {
            edges.addObject()
                    .put("source", edge.source())
                    .put("target", edge.target())
                    .put("type", edge.type().getLabel())
                    .put("weight", edge.weight())
                    .put("confidence", edge.confidence());
        }

        ArrayNode clusters = root.putArray("clusters");
        for (Cluster cluster : graph.clusters()) {
            ObjectNode json = clusters.addObject()
                    .put("id", cluster.id())
                    .put("label", cluster.label())
                    .put("representative", cluster.representative())
                    .put("size", cluster.size())
                    .put("dominantType", cluster.dominantType().name().toLowerCase());
            ArrayNode members = json.putArray("memberIds");
            cluster.members().forEach(members::add);
            json.putObject("centroid")
                    .put("x", cluster.centroid().x())
                    .put("y", cluster.centroid().y());
        }

        ObjectNode stats = root.putObject("stats")
                .put("nodeCount", graph.stats().nodeCount())
                .put("edgeCount", graph.stats().edgeCount())
                .put("relationshipCount", graph.stats().relationshipCount())
                .put("density", graph.stats().density())
                .put("componentCount", graph.stats().componentCount())
                .put("averageDegree", graph.stats().averageDegree());
        ObjectNode relationshipTypes = stats.putObject("relationshipTypes");
        graph.stats().relationshipTypes().forEach((type, count) -> relationshipTypes.put(type.getLabel(), count));

        root.put("layoutApproximate", graph.layoutApproximate());
        root.put("layoutTruncated", graph.layoutTruncated());
        ArrayNode warnings = root.putArray("warnings");
        graph.warnings().forEach(warnings::add);
        ObjectNode timings = root.putObject("timingsMs");
        for (Map.Entry<String, Long> timing : graph.timingsMs().entrySet()) {
            timings.put(timing.getKey(), timing.getValue());
        }
        return root;
    }

    public String toJson(NetworkGraph graph) {
        try {
            return objectMapper.writeValueAsString(toTree(graph));
        } catch (JsonProcessingException e) {
            throw new NetworkAnalyticsException("Failed to serialize graph for scope " + graph.scope(), e);
        }
    }

    public void write(NetworkGraph graph, Writer writer) {
        try {
            objectMapper.writeValue(writer, toTree(graph));
            log.debug("export.written scope={} nodes={} edges={}",
                    graph.scope(), graph.nodes().size(), graph.edges().size());
        } catch (IOException e) {
            throw new NetworkAnalyticsException("Failed to write graph for scope " + graph.scope(), e);
        }
    }
}
