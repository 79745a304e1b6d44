package org.houseofmourning.traversal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Traversal engine configuration.
 *
 * <p>Example YAML:
 * <pre>
 * traversal:
 *   working-set-size: 400
 *   cluster-size: 20
 *   cluster-duration-ms: 8000
 *   polling-interval-ms: 5000
 *   priority-queue-max-size: 200
 *   similarity:
 *     temporal-weight: 0.6
 *     length-weight: 0.2
 * </pre>
 */
@ConfigurationProperties(prefix = "traversal")
public record TraversalProperties(
    /** Fixed size of the in-memory working set. Default: 400. */
    Integer workingSetSize,

    /** Messages per cluster, focus included. Default: 20. */
    Integer clusterSize,

    /** Time between cycles. Default: 8000ms. */
    Long clusterDurationMs,

    /** Time between above-watermark polls. Default: 5000ms. */
    Long pollingIntervalMs,

    /** Priority queue bound; overflow drops the lowest ids. Default: 200. */
    Integer priorityQueueMaxSize,

    /** Period of the stats log line. {@code 0} disables it. Default: 60000ms. */
    Long statsLogIntervalMs,

    Similarity similarity
) {

  public static final int DEFAULT_WORKING_SET_SIZE = 400;
  public static final int DEFAULT_CLUSTER_SIZE = 20;
  public static final long DEFAULT_CLUSTER_DURATION_MS = 8_000;
  public static final long DEFAULT_POLLING_INTERVAL_MS = 5_000;
  public static final int DEFAULT_PRIORITY_QUEUE_MAX_SIZE = 200;
  public static final long DEFAULT_STATS_LOG_INTERVAL_MS = 60_000;

  /**
   * Weights of the similarity terms.
   *
   * <p>{@code semanticWeight} is reserved for a future embedding-based term and currently scores
   * nothing. The three weights must sum to 1.0.
   */
  public record Similarity(Double temporalWeight, Double lengthWeight, Double semanticWeight) {

    private static final double EPSILON = 1e-9;

    public Similarity {
      if (temporalWeight == null) temporalWeight = 0.6;
      if (lengthWeight == null) lengthWeight = 0.2;
      if (semanticWeight == null) semanticWeight = Math.max(0.0, 1.0 - temporalWeight - lengthWeight);

      requireUnit("traversal.similarity.temporal-weight", temporalWeight);
      requireUnit("traversal.similarity.length-weight", lengthWeight);
      requireUnit("traversal.similarity.semantic-weight", semanticWeight);

      double sum = temporalWeight + lengthWeight + semanticWeight;
      if (Math.abs(sum - 1.0) > EPSILON) {
        throw new IllegalArgumentException(
            "traversal.similarity weights must sum to 1.0 but sum to " + sum);
      }
    }

    public static Similarity defaults() {
      return new Similarity(null, null, null);
    }

    private static void requireUnit(String key, double value) {
      if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
        throw new IllegalArgumentException(key + " must be within [0, 1]: " + value);
      }
    }
  }

  public TraversalProperties {
    if (workingSetSize == null) workingSetSize = DEFAULT_WORKING_SET_SIZE;
    if (clusterSize == null) clusterSize = DEFAULT_CLUSTER_SIZE;
    if (clusterDurationMs == null) clusterDurationMs = DEFAULT_CLUSTER_DURATION_MS;
    if (pollingIntervalMs == null) pollingIntervalMs = DEFAULT_POLLING_INTERVAL_MS;
    if (priorityQueueMaxSize == null) priorityQueueMaxSize = DEFAULT_PRIORITY_QUEUE_MAX_SIZE;
    if (statsLogIntervalMs == null) statsLogIntervalMs = DEFAULT_STATS_LOG_INTERVAL_MS;
    if (similarity == null) similarity = Similarity.defaults();

    if (workingSetSize < 1 || workingSetSize > 100_000) {
      throw new IllegalArgumentException(
          "traversal.working-set-size must be within [1, 100000]: " + workingSetSize);
    }
    if (clusterSize < 2 || clusterSize > 1_000) {
      throw new IllegalArgumentException(
          "traversal.cluster-size must be within [2, 1000]: " + clusterSize);
    }
    if (clusterSize > workingSetSize) {
      throw new IllegalArgumentException(
          "traversal.cluster-size (" + clusterSize + ") exceeds working-set-size (" + workingSetSize + ")");
    }
    if (clusterDurationMs < 100) {
      throw new IllegalArgumentException(
          "traversal.cluster-duration-ms must be at least 100: " + clusterDurationMs);
    }
    if (pollingIntervalMs < 100) {
      throw new IllegalArgumentException(
          "traversal.polling-interval-ms must be at least 100: " + pollingIntervalMs);
    }
    if (priorityQueueMaxSize < 1 || priorityQueueMaxSize > 100_000) {
      throw new IllegalArgumentException(
          "traversal.priority-queue-max-size must be within [1, 100000]: " + priorityQueueMaxSize);
    }
    if (statsLogIntervalMs < 0) statsLogIntervalMs = 0L;
  }

  public static TraversalProperties defaults() {
    return new TraversalProperties(null, null, null, null, null, null, null);
  }

  /** Related slots per cluster (focus excluded). */
  public int relatedSlots() {
    return clusterSize - 1;
  }
}
