package org.houseofmourning.traversal.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** Descriptive numbers for one cluster; used for diagnostics only. */
@ValueObject
public record ClusterStats(
    int totalMessages,
    double avgSimilarity,
    double minSimilarity,
    double maxSimilarity,
    double diversity) {

  public static ClusterStats empty() {
    return new ClusterStats(0, 0, 0, 0, 0);
  }
}
