package org.houseofmourning.traversal.intake;

/** A submission failed content validation and was not stored. */
public class SubmissionRejectedException extends IllegalArgumentException {

  public SubmissionRejectedException(String message) {
    super(message);
  }
}
