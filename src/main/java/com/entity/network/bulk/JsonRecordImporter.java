package com.entity.network.bulk;

import com.entity.network.cache.MutationListener;
import com.entity.network.core.exception.NetworkAnalyticsException;
import com.entity.network.core.exception.StoreUnavailableException;
import com.entity.network.core.model.ContentItem;
import com.entity.network.core.model.Entity;
import com.entity.network.core.model.EntityMetadata;
import com.entity.network.core.model.EntityType;
import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipType;
import com.entity.network.core.model.Scope;
import com.entity.network.store.GraphStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * JSON Lines importer for entities, relationships and content items.
 *
 * <p>One JSON object per line, discriminated by {@code kind}:</p>
 * <pre>
 * {"kind": "entity", "id": "e1", "name": "Acme Corp", "type": "organization",
 *  "aliases": ["Acme"], "metadata": {"country": "US"}}
 * {"kind": "relationship", "source": "e1", "target": "e2", "type": "funds",
 *  "confidence": 0.8, "weight": 2, "evidence": ["n1"]}
 * {"kind": "content", "id": "n1", "entities": ["e1", "e2"], "text": "...",
 *  "timestamp": "2024-03-01T10:00:00Z"}
 * </pre>
 *
 * <p>Entities are written before relationships so that a relationship may refer to an
 * entity defined later in the file. Bad records are skipped and reported; the import
 * stops if the store becomes unavailable. Listeners are notified once when at least one
 * write was committed.</p>
 */
public class JsonRecordImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonRecordImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final GraphStore store;
    private final ObjectMapper objectMapper;
    private final List<MutationListener> listeners = new CopyOnWriteArrayList<>();

    public JsonRecordImporter(GraphStore store) {
        this(store, new ObjectMapper());
    }

    public JsonRecordImporter(GraphStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public void addMutationListener(MutationListener listener) {
        listeners.add(listener);
    }

    private record Line<T>(long number, T value) {}

    public ImportResult importRecords(Scope scope, InputStream input, ProgressCallback callback) {
        return importRecords(scope, new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importRecords(Scope scope, Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();
        List<Line<Entity>> entities = new ArrayList<>();
        List<Line<Relationship>> relationships = new ArrayList<>();
        List<ContentItem> contentItems = new ArrayList<>();
        long totalRecords = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String raw;
            long lineNumber = 0;
            while ((raw = br.readLine()) != null) {
                lineNumber++;
                String line = raw.trim();
                if (line.isEmpty()) {
                    continue;
                }
                totalRecords++;
                String kind = "unknown";
                try {
                    JsonNode node = objectMapper.readTree(line);
                    kind = text(node, "kind", "unknown");
                    switch (kind) {
                        case "entity" -> entities.add(new Line<>(lineNumber, toEntity(node)));
                        case "relationship" -> relationships.add(new Line<>(lineNumber, toRelationship(node)));
                        case "content" -> contentItems.add(toContentItem(node));
                        default -> throw new IllegalArgumentException("unknown record kind '" + kind + "'");
                    }
                } catch (JsonProcessingException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, kind, "malformed JSON: " + e.getOriginalMessage()));
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, kind, e.getMessage()));
                    log.warn("import.record.invalid line={} kind={} error={}", lineNumber, kind, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("import.failed scope={} error={}", scope, e.getMessage());
            errors.add(new ImportResult.ImportError(0, "io", "IO error: " + e.getMessage()));
        }

        long entitiesSaved = 0;
        long relationshipsSaved = 0;
        boolean aborted = false;
        long processed = 0;
        try {
            for (Line<Entity> line : entities) {
                store.saveEntity(scope, line.value());
                entitiesSaved++;
                reportProgress(cb, ++processed, entities.size() + relationships.size());
            }
            for (Line<Relationship> line : relationships) {
                try {
                    store.saveRelationship(scope, line.value());
                    relationshipsSaved++;
                } catch (StoreUnavailableException e) {
                    throw e;
                } catch (NetworkAnalyticsException e) {
                    errors.add(new ImportResult.ImportError(line.number(), "relationship", e.getMessage()));
                    log.warn("import.relationship.rejected line={} error={}", line.number(), e.getMessage());
                }
                reportProgress(cb, ++processed, entities.size() + relationships.size());
            }
        } catch (StoreUnavailableException e) {
            aborted = true;
            errors.add(new ImportResult.ImportError(0, "store", e.getMessage()));
            log.error("import.aborted scope={} committed={} error={}",
                    scope, entitiesSaved + relationshipsSaved, e.getMessage());
        } finally {
            if (entitiesSaved + relationshipsSaved > 0) {
                listeners.forEach(listener -> listener.onMutation(scope));
            }
        }

        ImportResult result = new ImportResult(totalRecords, entitiesSaved, relationshipsSaved,
                contentItems, aborted, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed scope={} result={}", scope, result);
        return result;
    }

    private static void reportProgress(ProgressCallback cb, long processed, long total) {
        if (processed % PROGRESS_INTERVAL == 0) {
            cb.onProgress(processed, total, "Wrote " + processed + " records");
        }
    }

    private Entity toEntity(JsonNode node) {
        Entity.Builder builder = Entity.builder()
                .name(required(node, "name"))
                .type(EntityType.fromLabel(text(node, "type", "other")));
        String id = text(node, "id", null);
        if (id != null) {
            builder.id(id);
        }
        builder.aliases(strings(node, "aliases"));
        JsonNode metadata = node.get("metadata");
        if (metadata != null && metadata.isObject()) {
            Map<String, String> raw = new LinkedHashMap<>();
            metadata.fields().forEachRemaining(field -> raw.put(field.getKey(), field.getValue().asText()));
            builder.metadata(EntityMetadata.fromStorage(raw));
        }
        builder.firstSeen(instant(node, "firstSeen"));
        builder.lastSeen(instant(node, "lastSeen"));
        return builder.build();
    }

    private Relationship toRelationship(JsonNode node) {
        Relationship.Builder builder = Relationship.builder()
                .sourceEntityId(required(node, "source"))
                .targetEntityId(required(node, "target"))
                .type(RelationshipType.fromLabel(text(node, "type", "associated_with")))
                .confidence(node.path("confidence").asDouble(0.5))
                .weight(node.path("weight").asDouble(1.0))
                .firstObserved(instant(node, "firstObserved"))
                .lastObserved(instant(node, "lastObserved"))
                .evidenceIds(strings(node, "evidence"));
        if (node.has("observationCount")) {
            builder.observationCount(node.get("observationCount").asInt());
        }
        return builder.build();
    }

    private ContentItem toContentItem(JsonNode node) {
        Instant timestamp = instant(node, "timestamp");
        if (timestamp == null) {
            throw new IllegalArgumentException("content record requires 'timestamp'");
        }
        return new ContentItem(required(node, "id"), strings(node, "entities"),
                text(node, "text", ""), timestamp);
    }

    private static String required(JsonNode node, String field) {
        String value = text(node, field, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing required field '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field, null);
        return value != null ? Instant.parse(value) : null;
    }

    private static Set<String> strings(JsonNode node, String field) {
        Set<String> values = new LinkedHashSet<>();
        JsonNode array = node.get(field);
        if (array != null && array.isArray()) {
            array.forEach(element -> values.add(element.asText()));
        }
        return values;
    }
}
