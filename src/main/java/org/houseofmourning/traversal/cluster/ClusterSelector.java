package org.houseofmourning.traversal.cluster;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.houseofmourning.traversal.config.TraversalProperties;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.model.MessageCluster;
import org.houseofmourning.traversal.model.RelatedMessage;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Picks focus, related and next from a working-set snapshot.
 *
 * <p>Guarantees for every non-placeholder cluster:
 * <ul>
 *   <li>focus is the previous cluster's next whenever that message is still in the set</li>
 *   <li>the previous focus, if still in the set, is among the related messages</li>
 *   <li>the oldest waiting priority member that is not the focus is among the related messages</li>
 *   <li>next is a related priority member if one exists, otherwise the best-scored related
 *       message other than the previous focus</li>
 * </ul>
 *
 * <p>Selection is deterministic: ties break on ascending id.
 */
@Component
@ApplicationLayer
public class ClusterSelector {

  private static final Logger log = LoggerFactory.getLogger(ClusterSelector.class);

  private static final double CONTINUITY_SIMILARITY = 1.0;

  private static final Comparator<RelatedMessage> BY_SIMILARITY =
      Comparator.comparingDouble(RelatedMessage::similarity)
          .reversed()
          .thenComparingLong(RelatedMessage::id);

  private final SimilarityScorer scorer;
  private final int relatedSlots;
  private final long durationMs;
  private final Clock clock;

  @Autowired
  public ClusterSelector(TraversalProperties props) {
    this(props, new SimilarityScorer(props.similarity()), Clock.systemUTC());
  }

  public ClusterSelector(TraversalProperties props, SimilarityScorer scorer, Clock clock) {
    Objects.requireNonNull(props, "props");
    this.scorer = Objects.requireNonNull(scorer, "scorer");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.relatedSlots = props.relatedSlots();
    this.durationMs = props.clusterDurationMs();
  }

  public int relatedSlots() {
    return relatedSlots;
  }

  /** Selects the next cluster; the shown counter advances from {@code previous}. */
  public MessageCluster select(
      Collection<Message> members, Set<Long> priorityIds, MessageCluster previous) {
    long shown = previous == null ? 1 : previous.totalShown() + 1;
    return select(members, priorityIds, previous, shown);
  }

  public MessageCluster select(
      Collection<Message> members,
      Set<Long> priorityIds,
      MessageCluster previous,
      long totalShown) {
    if (members == null || members.isEmpty()) {
      return MessageCluster.placeholder(durationMs, totalShown, clock.instant());
    }
    Set<Long> priority = priorityIds == null ? Set.of() : priorityIds;

    TreeMap<Long, Message> byId = new TreeMap<>();
    for (Message m : members) byId.put(m.id(), m);

    Message focus = chooseFocus(byId, priority, previous);
    final Long previousFocusId = continuityId(byId, previous, focus.id());

    Long reservedId = oldestWaitingPriority(byId, priority, focus.id(), previousFocusId);

    List<RelatedMessage> candidates = new ArrayList<>(byId.size() - 1);
    for (Message m : byId.values()) {
      if (m.id() == focus.id()) continue;
      candidates.add(new RelatedMessage(m, scorer.score(focus, m)));
    }
    // Younger priority members wait for their turn so reservations stay in id order.
    final Long reserved = reservedId;
    candidates.sort(
        Comparator.<RelatedMessage>comparingInt(
                r -> isDeferred(r.id(), priority, reserved) ? 1 : 0)
            .thenComparing(BY_SIMILARITY));

    List<RelatedMessage> related =
        new ArrayList<>(candidates.subList(0, Math.min(relatedSlots, candidates.size())));

    if (reservedId != null && !containsId(related, reservedId)) {
      Message m = byId.get(reservedId);
      place(related, new RelatedMessage(m, scorer.score(focus, m)), previousFocusId);
    }
    if (previousFocusId != null && !containsId(related, previousFocusId)) {
      place(related, new RelatedMessage(byId.get(previousFocusId), CONTINUITY_SIMILARITY), reservedId);
    } else if (previousFocusId != null) {
      related.replaceAll(
          r -> r.id() == previousFocusId
              ? new RelatedMessage(r.message(), CONTINUITY_SIMILARITY)
              : r);
    }
    related.sort(BY_SIMILARITY);

    Message next = chooseNext(focus, related, priority, previousFocusId);
    MessageCluster cluster =
        new MessageCluster(focus, related, next, durationMs, totalShown, clock.instant());
    validate(cluster, byId.size());
    return cluster;
  }

  /**
   * Checks the structural guarantees of a cluster drawn from {@code memberCount} messages.
   *
   * @throws ClusterInvariantViolation when any of them is broken
   */
  public void validate(MessageCluster cluster, int memberCount) {
    if (cluster.isPlaceholder()) {
      if (memberCount > 0) {
        throw new ClusterInvariantViolation(
            "placeholder selected from " + memberCount + " members");
      }
      return;
    }
    long focusId = cluster.focus().id();
    Set<Long> seen = new HashSet<>();
    for (RelatedMessage r : cluster.related()) {
      if (r.id() == focusId) {
        throw new ClusterInvariantViolation("focus " + focusId + " is also related");
      }
      if (!seen.add(r.id())) {
        throw new ClusterInvariantViolation("duplicate related id " + r.id());
      }
    }
    int expected = Math.min(relatedSlots, Math.max(0, memberCount - 1));
    int actual = cluster.related().size();
    if (actual < expected || actual > relatedSlots) {
      throw new ClusterInvariantViolation(
          "related count " + actual + " outside [" + expected + ", " + relatedSlots + "]");
    }
    Long nextId = cluster.nextId();
    if (nextId == null) {
      throw new ClusterInvariantViolation("cluster around " + focusId + " has no next");
    }
    boolean nextInCluster = nextId == focusId ? actual == 0 : seen.contains(nextId);
    if (!nextInCluster) {
      throw new ClusterInvariantViolation(
          "next " + nextId + " is not drawn from the cluster around " + focusId);
    }
  }

  private static Message chooseFocus(
      TreeMap<Long, Message> byId, Set<Long> priority, MessageCluster previous) {
    if (previous != null) {
      Long carried = previous.nextId();
      if (carried != null) {
        Message m = byId.get(carried);
        if (m != null) return m;
        log.debug("[traversal] previous next {} left the working set; choosing a new focus", carried);
      }
    }
    for (Map.Entry<Long, Message> e : byId.entrySet()) {
      if (priority.contains(e.getKey())) return e.getValue();
    }
    return byId.firstEntry().getValue();
  }

  private static Long continuityId(
      TreeMap<Long, Message> byId, MessageCluster previous, long focusId) {
    if (previous == null || previous.isPlaceholder()) return null;
    long id = previous.focusId();
    if (id == focusId || !byId.containsKey(id)) return null;
    return id;
  }

  private static Long oldestWaitingPriority(
      TreeMap<Long, Message> byId, Set<Long> priority, long focusId, Long previousFocusId) {
    Long best = null;
    for (Long id : priority) {
      if (id == focusId || id.equals(previousFocusId) || !byId.containsKey(id)) continue;
      if (best == null || id < best) best = id;
    }
    return best;
  }

  private static boolean isDeferred(long id, Set<Long> priority, Long reservedId) {
    return priority.contains(id) && (reservedId == null || id != reservedId);
  }

  /**
   * Adds {@code entry}, evicting the lowest-scored entry other than {@code keepId} when full. If
   * only {@code keepId} remains it is evicted; continuity outranks the reservation.
   */
  private void place(List<RelatedMessage> related, RelatedMessage entry, Long keepId) {
    if (related.size() < relatedSlots) {
      related.add(entry);
      return;
    }
    related.sort(BY_SIMILARITY);
    int victim = -1;
    for (int i = related.size() - 1; i >= 0; i--) {
      if (keepId == null || related.get(i).id() != keepId) {
        victim = i;
        break;
      }
    }
    if (victim < 0) victim = related.size() - 1;
    related.set(victim, entry);
  }

  private static Message chooseNext(
      Message focus, List<RelatedMessage> related, Set<Long> priority, Long previousFocusId) {
    if (related.isEmpty()) return focus;

    RelatedMessage oldestPriority = null;
    for (RelatedMessage r : related) {
      if (!priority.contains(r.id()) || isSame(r.id(), previousFocusId)) continue;
      if (oldestPriority == null || r.id() < oldestPriority.id()) oldestPriority = r;
    }
    if (oldestPriority != null) return oldestPriority.message();

    // related is sorted best-first
    for (RelatedMessage r : related) {
      if (!isSame(r.id(), previousFocusId)) return r.message();
    }
    return related.get(0).message();
  }

  private static boolean isSame(long id, Long other) {
    return other != null && other == id;
  }

  private static boolean containsId(List<RelatedMessage> related, long id) {
    for (RelatedMessage r : related) {
      if (r.id() == id) return true;
    }
    return false;
  }
}
