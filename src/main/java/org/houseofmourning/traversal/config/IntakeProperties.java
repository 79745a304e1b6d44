package org.houseofmourning.traversal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Submission intake settings. */
@ConfigurationProperties(prefix = "traversal.intake")
public record IntakeProperties(
    /** If true (default), new submissions are visible immediately without moderation. */
    Boolean autoApprove,

    /** Maximum content length after trimming. Default and upper bound: 280. */
    Integer maxLength
) {

  public static final int HARD_MAX_LENGTH = 280;

  public IntakeProperties {
    if (autoApprove == null) autoApprove = Boolean.TRUE;
    if (maxLength == null || maxLength <= 0 || maxLength > HARD_MAX_LENGTH) {
      maxLength = HARD_MAX_LENGTH;
    }
  }

  public static IntakeProperties defaults() {
    return new IntakeProperties(null, null);
  }
}
