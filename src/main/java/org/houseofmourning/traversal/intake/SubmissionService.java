package org.houseofmourning.traversal.intake;

import java.util.Objects;
import org.houseofmourning.traversal.config.IntakeProperties;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.store.MessageStore;
import org.houseofmourning.traversal.store.StoreUnavailableException;
import org.houseofmourning.traversal.traversal.TraversalCoordinator;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Inbound {@code submit(content)} call.
 *
 * <p>Stores the message, then hands visible messages to the coordinator so they skip the historical
 * scan. Unapproved messages wait for moderation and are found by the regular poll once approved.
 */
@Service
@ApplicationLayer
public class SubmissionService {
  private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

  private final MessageStore store;
  private final TraversalCoordinator coordinator;
  private final IntakeProperties props;

  public SubmissionService(
      MessageStore store, TraversalCoordinator coordinator, IntakeProperties props) {
    this.store = Objects.requireNonNull(store, "store");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.props = Objects.requireNonNullElseGet(props, IntakeProperties::defaults);
  }

  /**
   * @return the stored message
   * @throws SubmissionRejectedException if the trimmed content is empty or too long
   * @throws StoreUnavailableException if the message could not be stored
   */
  public Message submit(String content) {
    String text = content == null ? "" : content.trim();
    if (text.isEmpty()) {
      throw new SubmissionRejectedException("Message must not be empty");
    }
    if (text.length() > props.maxLength()) {
      throw new SubmissionRejectedException(
          "Message is " + text.length() + " characters; the limit is " + props.maxLength());
    }

    Message stored = store.insert(text, props.autoApprove());
    if (stored.isVisible()) {
      boolean queued = coordinator.submit(stored);
      log.info("[traversal] Accepted submission {} (priority={})", stored.id(), queued);
    } else {
      log.info("[traversal] Accepted submission {} pending approval", stored.id());
    }
    return stored;
  }
}
