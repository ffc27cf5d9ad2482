package com.entity.network.core.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A piece of source content (article, document, post) and the entities it mentions.
 * Used as co-occurrence evidence for relationship discovery.
 *
 * @param id         content identifier, also recorded as relationship evidence
 * @param entityIds  ids of the entities mentioned in the content
 * @param text       the content text, scanned for relationship keywords
 * @param timestamp  when the content was published or collected
 */
public record ContentItem(String id, Set<String> entityIds, String text, Instant timestamp) {

    public ContentItem {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        entityIds = entityIds != null ? Set.copyOf(new LinkedHashSet<>(entityIds)) : Set.of();
        text = text != null ? text : "";
    }
}
