package org.houseofmourning.traversal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Message store connection and retry settings.
 *
 * <p>Defaults to a file-based HSQLDB under {@code ./data}. Point {@code jdbcUrl} elsewhere to
 * share the table with the intake service.
 */
@ConfigurationProperties(prefix = "traversal.store")
public record StoreProperties(
    String jdbcUrl,
    String driverClassName,
    String username,
    String password,
    Integer maximumPoolSize,
    Retry retry
) {

  /**
   * Capped exponential backoff for store reads.
   *
   * <p>Attempt {@code n} (1-based) waits {@code initialDelayMs * multiplier^(n-1)} before the next
   * try, capped at {@code maxDelayMs}. After {@code maxAttempts} the read gives up.
   */
  public record Retry(Long initialDelayMs, Double multiplier, Long maxDelayMs, Integer maxAttempts) {
    public Retry {
      if (initialDelayMs == null || initialDelayMs < 0) initialDelayMs = 200L;
      if (multiplier == null || multiplier < 1.0) multiplier = 2.0;
      if (maxDelayMs == null || maxDelayMs < 0) maxDelayMs = 3_200L;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (maxAttempts == null || maxAttempts < 1) maxAttempts = 5;
    }

    public static Retry defaults() {
      return new Retry(null, null, null, null);
    }

    /** Delay after the given failed attempt (1-based). */
    public long delayAfterAttempt(int attempt) {
      double raw = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt - 1));
      return (long) Math.min(raw, (double) maxDelayMs);
    }
  }

  public StoreProperties {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      jdbcUrl = "jdbc:hsqldb:file:./data/grief-messages;hsqldb.tx=mvcc";
    }
    if (driverClassName == null || driverClassName.isBlank()) {
      driverClassName = "org.hsqldb.jdbc.JDBCDriver";
    }
    if (username == null) username = "SA";
    if (password == null) password = "";
    if (maximumPoolSize == null || maximumPoolSize < 1) maximumPoolSize = 4;
    if (retry == null) retry = Retry.defaults();
  }
}
