package org.houseofmourning.traversal.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.houseofmourning.traversal.model.Message;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/** JDBC access to the {@code messages} table. */
@InfrastructureLayer
public class MessageRepository implements MessageStore {

  private static final String VISIBLE = "approved = TRUE AND deleted_at_ms IS NULL";

  private static final String INSERT_SQL =
      """
      INSERT INTO messages(content, created_at_ms, approved)
      VALUES (?,?,?)
      """;

  private static final String SELECT_BY_ID_SQL =
      """
      SELECT id, content, created_at_ms, approved, deleted_at_ms
        FROM messages
       WHERE id = ?
      """;

  // Backward scan for historical filler. Newest-first within the page.
  private static final String SELECT_RANGE_BACKWARD_SQL =
      """
      SELECT id, content, created_at_ms, approved, deleted_at_ms
        FROM messages
       WHERE id <= ?
         AND id <= ?
         AND %s
    ORDER BY id DESC
       LIMIT ?
      """
          .formatted(VISIBLE);

  private static final String SELECT_ABOVE_SQL =
      """
      SELECT id, content, created_at_ms, approved, deleted_at_ms
        FROM messages
       WHERE id > ?
         AND %s
    ORDER BY id ASC
      """
          .formatted(VISIBLE);

  private static final String SELECT_MAX_ID_SQL =
      """
      SELECT MAX(id)
        FROM messages
       WHERE %s
      """
          .formatted(VISIBLE);

  private static final String SELECT_COUNT_SQL =
      """
      SELECT COUNT(*)
        FROM messages
       WHERE %s
      """
          .formatted(VISIBLE);

  private static final RowMapper<Message> ROW_MAPPER =
      (rs, rowNum) ->
          new Message(
              rs.getLong("id"),
              rs.getString("content"),
              Instant.ofEpochMilli(rs.getLong("created_at_ms")),
              rs.getBoolean("approved"),
              nullableInstant(rs, "deleted_at_ms"));

  private final JdbcTemplate jdbc;
  private final Clock clock;

  public MessageRepository(JdbcTemplate jdbc) {
    this(jdbc, Clock.systemUTC());
  }

  public MessageRepository(JdbcTemplate jdbc, Clock clock) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<Message> rangeBackward(long fromId, int limit, long ceilingId) {
    if (limit <= 0) return List.of();
    return jdbc.query(SELECT_RANGE_BACKWARD_SQL, ROW_MAPPER, fromId, ceilingId, limit);
  }

  @Override
  public List<Message> above(long watermarkId) {
    return jdbc.query(SELECT_ABOVE_SQL, ROW_MAPPER, watermarkId);
  }

  @Override
  public long maxId() {
    Long max = jdbc.queryForObject(SELECT_MAX_ID_SQL, Long.class);
    return max == null ? 0L : max;
  }

  @Override
  public long countVisible() {
    Long n = jdbc.queryForObject(SELECT_COUNT_SQL, Long.class);
    return n == null ? 0L : n;
  }

  @Override
  public Message insert(String content, boolean approved) {
    Objects.requireNonNull(content, "content");
    long createdAtMs = clock.millis();

    KeyHolder keys = new GeneratedKeyHolder();
    jdbc.update(
        con -> {
          PreparedStatement ps = con.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS);
          ps.setString(1, content);
          ps.setLong(2, createdAtMs);
          ps.setBoolean(3, approved);
          return ps;
        },
        keys);

    Number key = keys.getKey();
    if (key == null) {
      throw new DataRetrievalFailureException("Insert into messages returned no generated id");
    }

    List<Message> rows = jdbc.query(SELECT_BY_ID_SQL, ROW_MAPPER, key.longValue());
    if (rows.isEmpty()) {
      throw new DataRetrievalFailureException("Inserted message " + key + " could not be read back");
    }
    return rows.get(0);
  }

  private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
    long v = rs.getLong(column);
    return rs.wasNull() ? null : Instant.ofEpochMilli(v);
  }
}
