package com.entity.network.cluster;

/**
 * Assignment of every snapshot node to a community numbered {@code 0..count-1}.
 *
 * @param truncated true if the algorithm stopped on its budget rather than converging
 */
public record Partition(int[] communityOf, int count, boolean truncated) {
}
