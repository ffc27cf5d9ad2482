package com.entity.network.cluster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ClusterSizing")
class ClusterSizingTest {

    @Test
    @DisplayName("Graphs up to the threshold use Louvain")
    void testSmallGraphs() {
        ClusterConfig config = ClusterConfig.defaults();
        assertEquals(ClusterAlgorithm.LOUVAIN, ClusterSizing.choose(0, config));
        assertEquals(ClusterAlgorithm.LOUVAIN, ClusterSizing.choose(config.refinementThreshold(), config));
    }

    @Test
    @DisplayName("Larger graphs use label propagation")
    void testLargeGraphs() {
        ClusterConfig config = ClusterConfig.defaults().withRefinementThreshold(10);
        assertEquals(ClusterAlgorithm.LABEL_PROPAGATION, ClusterSizing.choose(11, config));
    }
}
