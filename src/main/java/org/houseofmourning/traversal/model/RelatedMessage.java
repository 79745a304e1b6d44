package org.houseofmourning.traversal.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A companion of the focus message, with its similarity score to the focus. */
@ValueObject
public record RelatedMessage(Message message, double similarity) {

  public RelatedMessage {
    message = Objects.requireNonNull(message, "message");
  }

  public long id() {
    return message.id();
  }
}
