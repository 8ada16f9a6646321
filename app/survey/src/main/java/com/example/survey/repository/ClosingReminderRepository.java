/*
 * どこで: Survey データアクセス
 * 何を: closing_reminders の登録/取り出し/削除を行う
 * なぜ: CLOSING 送信から一定時間後の回答確認を、発火時刻単位でまとめて処理するため
 */
package com.example.survey.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.survey.model.ClosingReminder;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ClosingReminderRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(ClosingReminder reminder) {
    final String sql =
        """
        INSERT INTO closing_reminders (recipient_id, survey_at, remind_at)
        VALUES (:recipientId, :surveyAt, :remindAt)
        ON CONFLICT (recipient_id, survey_at) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", reminder.recipientId())
            .addValue("surveyAt", toTimestamp(reminder.surveyAt()))
            .addValue("remindAt", toTimestamp(reminder.remindAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<ClosingReminder> takeDue(Instant now) {
    final String sql =
        """
        DELETE FROM closing_reminders
        WHERE remind_at <= :now
        RETURNING recipient_id, survey_at, remind_at
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), this::mapRow);
  }

  public int deleteByRecipientId(String recipientId) {
    final String sql =
        """
        DELETE FROM closing_reminders
        WHERE recipient_id = :recipientId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("recipientId", recipientId));
  }

  private ClosingReminder mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ClosingReminder(
        rs.getString("recipient_id"),
        toInstant(rs.getTimestamp("survey_at")),
        toInstant(rs.getTimestamp("remind_at")));
  }
}
