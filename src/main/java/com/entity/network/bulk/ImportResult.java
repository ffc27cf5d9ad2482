package com.entity.network.bulk;

import com.entity.network.core.model.ContentItem;

import java.util.List;

/**
 * Result of a JSON Lines import.
 *
 * @param totalRecords        non-blank lines read
 * @param entitiesSaved       entities written to the store
 * @param relationshipsSaved  relationships written to the store
 * @param contentItems        content records parsed, ready for discovery; content is not stored
 * @param aborted             the import stopped early because the store became unavailable
 * @param errors              records that were skipped
 */
public record ImportResult(
        long totalRecords,
        long entitiesSaved,
        long relationshipsSaved,
        List<ContentItem> contentItems,
        boolean aborted,
        List<ImportError> errors
) {
    public ImportResult {
        contentItems = contentItems != null ? List.copyOf(contentItems) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long committedCount() {
        return entitiesSaved + relationshipsSaved;
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param lineNumber 1-based line in the input, 0 for errors not tied to a line
     */
    public record ImportError(long lineNumber, String kind, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", entities=" + entitiesSaved +
                ", relationships=" + relationshipsSaved +
                ", contentItems=" + contentItems.size() +
                ", aborted=" + aborted +
                ", errors=" + errors.size() + '}';
    }
}
