package com.quintstore.jena.store;

/**
 * Row counts derived from the quint table.
 *
 * @param totalCount number of stored quints
 * @param vectorCount number of quints carrying a vector
 * @param graphCount number of distinct graphs
 */
public record StoreStats(long totalCount, long vectorCount, long graphCount) {
}
