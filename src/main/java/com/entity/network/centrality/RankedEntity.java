package com.entity.network.centrality;

public record RankedEntity(String entityId, double score) {
}
