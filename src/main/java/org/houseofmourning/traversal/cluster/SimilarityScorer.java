package org.houseofmourning.traversal.cluster;

import java.time.Duration;
import java.util.Objects;
import org.houseofmourning.traversal.config.TraversalProperties;
import org.houseofmourning.traversal.model.Message;

/**
 * Lightweight recency + length similarity.
 *
 * <pre>
 * score = temporalWeight * max(0, 1 - |dt| / 30 days)
 *       + lengthWeight   * (1 - |len(a) - len(b)| / 280)
 *       + semanticWeight * semantic(a, b)
 * </pre>
 */
public final class SimilarityScorer {

  static final long TEMPORAL_HORIZON_MS = Duration.ofDays(30).toMillis();
  static final int MAX_CONTENT_LENGTH = 280;

  private final double temporalWeight;
  private final double lengthWeight;
  private final double semanticWeight;
  private final SemanticSimilarity semantic;

  public SimilarityScorer(TraversalProperties.Similarity weights) {
    this(weights, SemanticSimilarity.NONE);
  }

  public SimilarityScorer(TraversalProperties.Similarity weights, SemanticSimilarity semantic) {
    TraversalProperties.Similarity w =
        Objects.requireNonNullElseGet(weights, TraversalProperties.Similarity::defaults);
    this.temporalWeight = w.temporalWeight();
    this.lengthWeight = w.lengthWeight();
    this.semanticWeight = w.semanticWeight();
    this.semantic = Objects.requireNonNull(semantic, "semantic");
  }

  public double score(Message a, Message b) {
    double s = temporalWeight * temporalProximity(a, b) + lengthWeight * lengthSimilarity(a, b);
    if (semanticWeight > 0) {
      s += semanticWeight * clampUnit(semantic.similarity(a, b));
    }
    return s;
  }

  static double temporalProximity(Message a, Message b) {
    long dt = Math.abs(a.createdAt().toEpochMilli() - b.createdAt().toEpochMilli());
    return Math.max(0.0, 1.0 - (double) dt / TEMPORAL_HORIZON_MS);
  }

  static double lengthSimilarity(Message a, Message b) {
    int diff = Math.abs(a.length() - b.length());
    return clampUnit(1.0 - (double) diff / MAX_CONTENT_LENGTH);
  }

  private static double clampUnit(double v) {
    if (Double.isNaN(v)) return 0.0;
    return Math.max(0.0, Math.min(1.0, v));
  }
}
