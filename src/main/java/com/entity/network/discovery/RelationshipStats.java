package com.entity.network.discovery;

import com.entity.network.core.model.Relationship;
import com.entity.network.core.model.RelationshipType;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relationship counts of a scope.
 *
 * @param total  all relationships
 * @param recent relationships first observed at or after the recency cutoff
 * @param byType count per type, most frequent first; absent types are omitted
 */
public record RelationshipStats(int total, int recent, Map<RelationshipType, Integer> byType) {

    public RelationshipStats {
        byType = Collections.unmodifiableMap(new LinkedHashMap<>(byType));
    }

    public static RelationshipStats of(Collection<Relationship> relationships, Instant recentCutoff) {
        Map<RelationshipType, Integer> counts = new EnumMap<>(RelationshipType.class);
        int recent = 0;
        for (Relationship relationship : relationships) {
            counts.merge(relationship.getType(), 1, Integer::sum);
            if (!relationship.getFirstObserved().isBefore(recentCutoff)) {
                recent++;
            }
        }
        Map<RelationshipType, Integer> ordered = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<RelationshipType, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> ordered.put(e.getKey(), e.getValue()));
        return new RelationshipStats(relationships.size(), recent, ordered);
    }

    /**
     * Every type a relationship can have.
     */
    public List<RelationshipType> availableTypes() {
        return List.of(RelationshipType.values());
    }
}
