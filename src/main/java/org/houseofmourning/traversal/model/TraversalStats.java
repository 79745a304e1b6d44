package org.houseofmourning.traversal.model;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Engine-wide snapshot.
 *
 * @param state lifecycle state name
 * @param totalClustersShown clusters emitted since start (or the last traversal reset)
 * @param currentFocusId focus of the current cluster, {@code null} for a placeholder
 * @param nextFocusId pre-selected next focus, {@code null} for a placeholder
 * @param workingSetSize current working set size
 * @param priorityMemberCount working set members still awaiting their first featured appearance
 * @param estimatedQueueWaitMs rough time until the last queued message reaches the working set
 * @param pool pool manager snapshot
 */
@ValueObject
public record TraversalStats(
    String state,
    long totalClustersShown,
    Long currentFocusId,
    Long nextFocusId,
    int workingSetSize,
    int priorityMemberCount,
    long estimatedQueueWaitMs,
    PoolStats pool) {}
