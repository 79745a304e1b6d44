package org.houseofmourning.traversal.traversal;

import java.time.Instant;
import org.houseofmourning.traversal.model.MessageCluster;
import org.houseofmourning.traversal.model.WorkingSetChange;

/** Events published by {@link TraversalCoordinator#events()}. */
public sealed interface TraversalEvent permits
    TraversalEvent.ClusterChanged,
    TraversalEvent.WorkingSetChanged {

  Instant at();

  /** A new cluster became current. */
  record ClusterChanged(Instant at, MessageCluster cluster) implements TraversalEvent {}

  /** Working set membership changed. Emitted before the cluster selected from the new set. */
  record WorkingSetChanged(Instant at, WorkingSetChange change) implements TraversalEvent {}
}
