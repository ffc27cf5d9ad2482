package com.entity.network.snapshot;

import java.time.LocalDate;

/**
 * Activity of one timeline bucket.
 *
 * @param period           first day of the bucket
 * @param activeEntities   distinct entities seen, or touched by a relationship observed, in the bucket
 * @param newEntities      entities first seen in the bucket
 * @param newRelationships relationships first observed in the bucket
 */
public record ActivityEntry(LocalDate period, int activeEntities, int newEntities, int newRelationships) {
}
