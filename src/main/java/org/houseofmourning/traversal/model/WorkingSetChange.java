package org.houseofmourning.traversal.model;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/** Membership delta of the working set, as seen by the renderer. */
@ValueObject
public record WorkingSetChange(List<Long> removedIds, List<Message> added, Reason reason) {

  public enum Reason {
    INITIALIZATION,
    CYCLE
  }

  public WorkingSetChange {
    removedIds = removedIds == null ? List.of() : List.copyOf(removedIds);
    added = added == null ? List.of() : List.copyOf(added);
    if (reason == null) reason = Reason.CYCLE;
  }

  public boolean isEmpty() {
    return removedIds.isEmpty() && added.isEmpty();
  }
}
