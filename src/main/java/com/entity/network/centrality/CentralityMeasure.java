package com.entity.network.centrality;

public enum CentralityMeasure {
    DEGREE,
    BETWEENNESS,
    IMPORTANCE
}
