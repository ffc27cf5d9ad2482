package com.entity.network.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Typed, weighted relationship between two entities of the same scope.
 *
 * Identity is the {@link RelationshipKey}: at most one relationship per
 * (source, target, type). Re-observation produces an updated copy carrying the
 * union of supporting evidence, see {@link #reobserve(Relationship)}.
 */
public final class Relationship {

    private final String sourceEntityId;
    private final String targetEntityId;
    private final RelationshipType type;
    private final double confidence;
    private final double weight;
    private final Instant firstObserved;
    private final Instant lastObserved;
    private final int observationCount;
    private final Set<String> evidenceIds;

    private Relationship(Builder builder) {
        this.sourceEntityId = Objects.requireNonNull(builder.sourceEntityId, "sourceEntityId is required");
        this.targetEntityId = Objects.requireNonNull(builder.targetEntityId, "targetEntityId is required");
        this.type = builder.type != null ? builder.type : RelationshipType.ASSOCIATED_WITH;
        if (builder.confidence < 0.0 || builder.confidence > 1.0 || Double.isNaN(builder.confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + builder.confidence);
        }
        if (!(builder.weight > 0.0) || Double.isInfinite(builder.weight)) {
            throw new IllegalArgumentException("weight must be positive, got " + builder.weight);
        }
        this.confidence = builder.confidence;
        this.weight = builder.weight;
        this.evidenceIds = builder.evidenceIds != null
                ? Collections.unmodifiableSet(new TreeSet<>(builder.evidenceIds))
                : Set.of();
        this.firstObserved = builder.firstObserved != null ? builder.firstObserved : Instant.now();
        this.lastObserved = builder.lastObserved != null ? builder.lastObserved : this.firstObserved;
        this.observationCount = builder.observationCount > 0
                ? builder.observationCount
                : Math.max(1, evidenceIds.size());
    }

    public String getSourceEntityId() {
        return sourceEntityId;
    }

    public String getTargetEntityId() {
        return targetEntityId;
    }

    public RelationshipType getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getWeight() {
        return weight;
    }

    public Instant getFirstObserved() {
        return firstObserved;
    }

    public Instant getLastObserved() {
        return lastObserved;
    }

    public int getObservationCount() {
        return observationCount;
    }

    public Set<String> getEvidenceIds() {
        return evidenceIds;
    }

    public RelationshipKey key() {
        return new RelationshipKey(sourceEntityId, targetEntityId, type);
    }

    public boolean isSelfLoop() {
        return sourceEntityId.equals(targetEntityId);
    }

    /**
     * Returns the endpoint opposite to the given entity.
     */
    public String otherEnd(String entityId) {
        return sourceEntityId.equals(entityId) ? targetEntityId : sourceEntityId;
    }

    /**
     * Folds a new observation of the same pair into this relationship. Observation
     * counts and weights add up, except that observations backed by evidence this
     * relationship already holds are counted once. Confidence keeps the higher value
     * and the observation window widens. Identity stays that of this relationship.
     *
     * <p>An observation whose evidence is entirely known already is a replay and
     * leaves this relationship unchanged.</p>
     */
    public Relationship reobserve(Relationship observed) {
        Set<String> evidence = new TreeSet<>(evidenceIds);
        int shared = 0;
        for (String id : observed.evidenceIds) {
            if (!evidence.add(id)) {
                shared++;
            }
        }
        if (!observed.evidenceIds.isEmpty() && shared == observed.evidenceIds.size()) {
            return this;
        }
        int observations = Math.max(1, observationCount + observed.observationCount - shared);
        return toBuilder()
                .confidence(Math.max(confidence, observed.confidence))
                .weight(weight + observed.weight)
                .firstObserved(observed.firstObserved.isBefore(firstObserved) ? observed.firstObserved : firstObserved)
                .lastObserved(observed.lastObserved.isAfter(lastObserved) ? observed.lastObserved : lastObserved)
                .observationCount(observations)
                .evidenceIds(evidence)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .sourceEntityId(sourceEntityId)
                .targetEntityId(targetEntityId)
                .type(type)
                .confidence(confidence)
                .weight(weight)
                .firstObserved(firstObserved)
                .lastObserved(lastObserved)
                .observationCount(observationCount)
                .evidenceIds(evidenceIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Double.compare(that.confidence, confidence) == 0
                && Double.compare(that.weight, weight) == 0
                && observationCount == that.observationCount
                && sourceEntityId.equals(that.sourceEntityId)
                && targetEntityId.equals(that.targetEntityId)
                && type == that.type
                && Objects.equals(firstObserved, that.firstObserved)
                && Objects.equals(lastObserved, that.lastObserved)
                && evidenceIds.equals(that.evidenceIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceEntityId, targetEntityId, type);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "source='" + sourceEntityId + '\'' +
                ", target='" + targetEntityId + '\'' +
                ", type=" + type +
                ", weight=" + weight +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceEntityId;
        private String targetEntityId;
        private RelationshipType type;
        private double confidence = 0.5;
        private double weight = 1.0;
        private Instant firstObserved;
        private Instant lastObserved;
        private int observationCount;
        private Set<String> evidenceIds;

        public Builder sourceEntityId(String sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityId(String targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder type(RelationshipType type) {
            this.type = type;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder firstObserved(Instant firstObserved) {
            this.firstObserved = firstObserved;
            return this;
        }

        public Builder lastObserved(Instant lastObserved) {
            this.lastObserved = lastObserved;
            return this;
        }

        public Builder observationCount(int observationCount) {
            this.observationCount = observationCount;
            return this;
        }

        public Builder evidenceIds(Set<String> evidenceIds) {
            this.evidenceIds = evidenceIds != null ? new TreeSet<>(evidenceIds) : null;
            return this;
        }

        public Builder evidence(String evidenceId) {
            if (this.evidenceIds == null) {
                this.evidenceIds = new TreeSet<>();
            }
            this.evidenceIds.add(evidenceId);
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
