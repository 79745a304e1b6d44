package org.houseofmourning.traversal.model;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Snapshot of pool manager state.
 *
 * @param historicalCursor next id the backward scan reads, or {@code null} once exhausted
 * @param watermark highest id ever observed
 * @param queueDepth messages waiting in the priority queue
 * @param queueCapacity configured priority queue bound
 * @param droppedOnOverflow total messages dropped from the queue since start
 * @param recycleCount how often the historical cursor wrapped back to the newest message
 */
@ValueObject
public record PoolStats(
    Long historicalCursor,
    long watermark,
    int queueDepth,
    int queueCapacity,
    long droppedOnOverflow,
    long recycleCount) {}
