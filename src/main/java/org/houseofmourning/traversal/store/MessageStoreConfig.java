package org.houseofmourning.traversal.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.houseofmourning.traversal.config.StoreProperties;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Message store wiring.
 *
 * <p>Builds a small HikariCP pool over the configured JDBC URL (file-based HSQLDB by default) and
 * runs the Flyway migrations before the store is handed out.
 */
@Configuration
@InfrastructureLayer
public class MessageStoreConfig {

  private static final Logger log = LoggerFactory.getLogger(MessageStoreConfig.class);

  @Bean(name = "messageDataSource", destroyMethod = "close")
  public DataSource messageDataSource(StoreProperties props) {
    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName("traversal-messages");
    cfg.setDriverClassName(props.driverClassName());
    cfg.setJdbcUrl(props.jdbcUrl());
    cfg.setUsername(props.username());
    cfg.setPassword(props.password());

    // Engine reads are serialized; a handful of connections covers intake writes as well.
    cfg.setMaximumPoolSize(props.maximumPoolSize());
    cfg.setMinimumIdle(1);
    cfg.setConnectionTimeout(5_000);
    cfg.setValidationTimeout(5_000);
    cfg.setIdleTimeout(60_000);

    log.info("[traversal] Message store at {}", props.jdbcUrl());
    return new HikariDataSource(cfg);
  }

  @Bean(initMethod = "migrate", name = "messageFlyway")
  public Flyway messageFlyway(@Qualifier("messageDataSource") DataSource dataSource) {
    return Flyway.configure()
        .dataSource(dataSource)
        .locations("classpath:db/migration/messages")
        .load();
  }

  @Bean(name = "messageJdbcTemplate")
  public JdbcTemplate messageJdbcTemplate(@Qualifier("messageDataSource") DataSource dataSource) {
    return new JdbcTemplate(dataSource);
  }

  @Bean
  public MessageStore messageStore(
      @Qualifier("messageJdbcTemplate") JdbcTemplate jdbc,
      @Qualifier("messageFlyway") Flyway flyway,
      StoreProperties props) {
    // Depending on the Flyway bean orders migrate() before the first read.
    if (flyway == null) {
      throw new IllegalStateException("messageFlyway bean missing (migrations must run first)");
    }
    return new RetryingMessageStore(new MessageRepository(jdbc), props.retry());
  }
}
