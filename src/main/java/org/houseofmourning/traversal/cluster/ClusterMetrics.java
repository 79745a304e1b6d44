package org.houseofmourning.traversal.cluster;

import java.util.ArrayList;
import java.util.List;
import org.houseofmourning.traversal.model.ClusterStats;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.model.MessageCluster;
import org.houseofmourning.traversal.model.RelatedMessage;

/** Diagnostic measures of a cluster. */
public final class ClusterMetrics {

  private static final double LENGTH_STDDEV_FOR_MAX_DIVERSITY = 100.0;

  private ClusterMetrics() {}

  /**
   * Mean of temporal spread (relative to 30 days) and length standard deviation (relative to 100
   * characters), each capped at 1. Zero for fewer than two messages.
   */
  public static double diversity(List<Message> messages) {
    if (messages == null || messages.size() < 2) return 0.0;

    long min = Long.MAX_VALUE;
    long max = Long.MIN_VALUE;
    double sum = 0;
    for (Message m : messages) {
      long t = m.createdAt().toEpochMilli();
      min = Math.min(min, t);
      max = Math.max(max, t);
      sum += m.length();
    }
    double temporal = Math.min(1.0, (double) (max - min) / SimilarityScorer.TEMPORAL_HORIZON_MS);

    double mean = sum / messages.size();
    double variance = 0;
    for (Message m : messages) {
      double d = m.length() - mean;
      variance += d * d;
    }
    variance /= messages.size();
    double length = Math.min(1.0, Math.sqrt(variance) / LENGTH_STDDEV_FOR_MAX_DIVERSITY);

    return (temporal + length) / 2.0;
  }

  public static ClusterStats summarize(MessageCluster cluster) {
    if (cluster == null || cluster.isPlaceholder()) return ClusterStats.empty();

    List<Message> all = new ArrayList<>(cluster.related().size() + 1);
    all.add(cluster.focus());
    double sum = 0;
    double min = Double.MAX_VALUE;
    double max = 0;
    for (RelatedMessage r : cluster.related()) {
      all.add(r.message());
      sum += r.similarity();
      min = Math.min(min, r.similarity());
      max = Math.max(max, r.similarity());
    }
    int n = cluster.related().size();
    return new ClusterStats(
        all.size(), n == 0 ? 0 : sum / n, n == 0 ? 0 : min, n == 0 ? 0 : max, diversity(all));
  }
}
