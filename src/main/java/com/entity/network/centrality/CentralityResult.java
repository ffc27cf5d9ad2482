package com.entity.network.centrality;

import java.util.List;

/**
 * Entities ranked by a centrality measure, highest score first, ties by id.
 *
 * @param approximate true if the scores were estimated from a sample
 * @param truncated   true if an iterative computation stopped before converging
 */
public record CentralityResult(
        CentralityMeasure measure,
        List<RankedEntity> rankings,
        boolean approximate,
        boolean truncated
) {
    public CentralityResult {
        rankings = List.copyOf(rankings);
    }
}
