/*
 * どこで: Survey データアクセス
 * 何を: occurrences テーブルの登録/検索/削除を担う
 * なぜ: 参加時に確定した送信予定を再起動後も保持し、発火時に宛先を引き直すため
 */
package com.example.survey.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.example.survey.model.OccurrenceKey;
import com.example.survey.model.ScheduledSlot;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OccurrenceRepository {

  private static final String INSERT_SQL =
      """
      INSERT INTO occurrences (
        recipient_id,
        scheduled_at,
        kind,
        cohort,
        distribution_index,
        created_at
      ) VALUES (
        :recipientId,
        :scheduledAt,
        :kind,
        :cohort,
        :distributionIndex,
        now()
      )
      ON CONFLICT (recipient_id, scheduled_at, kind) DO NOTHING
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // 同じキーが既にあれば何もしない。登録できたかどうかを返す
  public boolean insert(Occurrence occurrence) {
    return jdbcTemplate.update(INSERT_SQL, toParams(occurrence)) > 0;
  }

  public int insertAll(List<Occurrence> occurrences) {
    if (occurrences.isEmpty()) {
      return 0;
    }
    final MapSqlParameterSource[] batch =
        occurrences.stream().map(this::toParams).toArray(MapSqlParameterSource[]::new);
    int inserted = 0;
    for (int count : jdbcTemplate.batchUpdate(INSERT_SQL, batch)) {
      // ドライバによっては件数不明(SUCCESS_NO_INFO = -2)を返すため、負数は 1 件として数える
      inserted += count == 0 ? 0 : 1;
    }
    return inserted;
  }

  public boolean delete(OccurrenceKey key) {
    final String sql =
        """
        DELETE FROM occurrences
        WHERE recipient_id = :recipientId
          AND scheduled_at = :scheduledAt
          AND kind = :kind
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", key.recipientId())
            .addValue("scheduledAt", toTimestamp(key.timestamp()))
            .addValue("kind", key.kind().name());
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<Occurrence> findByTimestampAndKind(Instant timestamp, NotificationKind kind) {
    final String sql =
        """
        SELECT recipient_id, scheduled_at, kind, cohort, distribution_index
        FROM occurrences
        WHERE scheduled_at = :scheduledAt
          AND kind = :kind
        ORDER BY recipient_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduledAt", toTimestamp(timestamp))
            .addValue("kind", kind.name());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<Occurrence> findByRecipientId(String recipientId) {
    final String sql =
        """
        SELECT recipient_id, scheduled_at, kind, cohort, distribution_index
        FROM occurrences
        WHERE recipient_id = :recipientId
        ORDER BY scheduled_at, kind
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<Occurrence> findOne(OccurrenceKey key) {
    final String sql =
        """
        SELECT recipient_id, scheduled_at, kind, cohort, distribution_index
        FROM occurrences
        WHERE recipient_id = :recipientId
          AND scheduled_at = :scheduledAt
          AND kind = :kind
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", key.recipientId())
            .addValue("scheduledAt", toTimestamp(key.timestamp()))
            .addValue("kind", key.kind().name());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ScheduledSlot> findDistinctSlots() {
    final String sql =
        """
        SELECT DISTINCT scheduled_at, kind
        FROM occurrences
        ORDER BY scheduled_at, kind
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new ScheduledSlot(
                toInstant(rs.getTimestamp("scheduled_at")),
                NotificationKind.valueOf(rs.getString("kind"))));
  }

  public boolean existsByRecipientId(String recipientId) {
    final String sql =
        """
        SELECT EXISTS (SELECT 1 FROM occurrences WHERE recipient_id = :recipientId)
        """;
    final Boolean exists =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("recipientId", recipientId), Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  public OptionalInt findCohort(String recipientId) {
    final String sql =
        """
        SELECT cohort
        FROM occurrences
        WHERE recipient_id = :recipientId
        LIMIT 1
        """;
    final List<Integer> cohorts =
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("recipientId", recipientId), Integer.class);
    return cohorts.isEmpty() ? OptionalInt.empty() : OptionalInt.of(cohorts.get(0));
  }

  public int deleteByRecipientId(String recipientId) {
    final String sql =
        """
        DELETE FROM occurrences
        WHERE recipient_id = :recipientId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("recipientId", recipientId));
  }

  public int deleteAll() {
    return jdbcTemplate.update("DELETE FROM occurrences", new MapSqlParameterSource());
  }

  private MapSqlParameterSource toParams(Occurrence occurrence) {
    return new MapSqlParameterSource()
        .addValue("recipientId", occurrence.recipientId())
        .addValue("scheduledAt", toTimestamp(occurrence.timestamp()))
        .addValue("kind", occurrence.kind().name())
        .addValue("cohort", occurrence.cohort())
        .addValue("distributionIndex", occurrence.distributionIndex());
  }

  private Occurrence mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Occurrence(
        rs.getString("recipient_id"),
        toInstant(rs.getTimestamp("scheduled_at")),
        NotificationKind.valueOf(rs.getString("kind")),
        rs.getInt("cohort"),
        rs.getInt("distribution_index"));
  }
}
