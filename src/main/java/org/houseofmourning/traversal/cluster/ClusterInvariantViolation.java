package org.houseofmourning.traversal.cluster;

/** A selected cluster broke one of its structural guarantees. Always a programming error. */
public class ClusterInvariantViolation extends IllegalStateException {

  public ClusterInvariantViolation(String message) {
    super(message);
  }
}
