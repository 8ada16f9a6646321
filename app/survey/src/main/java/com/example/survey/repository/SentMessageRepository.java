/*
 * どこで: Survey データアクセス
 * 何を: sent_messages(送信済みリンクのメッセージ id)の登録/取り出し/削除を行う
 * なぜ: 古いリンクを後から消す運用と、保持期間による掃除を支えるため
 */
package com.example.survey.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.survey.model.NotificationKind;
import com.example.survey.model.SentMessage;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SentMessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(SentMessage message) {
    final String sql =
        """
        INSERT INTO sent_messages (recipient_id, message_id, kind, sent_at, delete_after)
        VALUES (:recipientId, :messageId, :kind, :sentAt, :deleteAfter)
        ON CONFLICT (recipient_id, message_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", message.recipientId())
            .addValue("messageId", message.messageId())
            .addValue("kind", message.kind().name())
            .addValue("sentAt", toTimestamp(message.sentAt()))
            .addValue("deleteAfter", toTimestamp(message.deleteAfter()));
    jdbcTemplate.update(sql, params);
  }

  // 取り出しと削除を 1 文で行い、同じメッセージを二重に消しに行かないようにする
  public List<SentMessage> takeByRecipientsAndKind(
      Collection<String> recipientIds, NotificationKind kind) {
    if (recipientIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        DELETE FROM sent_messages
        WHERE recipient_id IN (:recipientIds)
          AND kind = :kind
        RETURNING recipient_id, message_id, kind, sent_at, delete_after
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientIds", recipientIds)
            .addValue("kind", kind.name());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<SentMessage> takeByKind(NotificationKind kind) {
    final String sql =
        """
        DELETE FROM sent_messages
        WHERE kind = :kind
        RETURNING recipient_id, message_id, kind, sent_at, delete_after
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("kind", kind.name()), this::mapRow);
  }

  public List<SentMessage> takeDue(Instant now) {
    final String sql =
        """
        DELETE FROM sent_messages
        WHERE delete_after IS NOT NULL
          AND delete_after <= :now
        RETURNING recipient_id, message_id, kind, sent_at, delete_after
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), this::mapRow);
  }

  public List<SentMessage> findByRecipientId(String recipientId) {
    final String sql =
        """
        SELECT recipient_id, message_id, kind, sent_at, delete_after
        FROM sent_messages
        WHERE recipient_id = :recipientId
        ORDER BY sent_at
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("recipientId", recipientId), this::mapRow);
  }

  public int deleteByRecipientId(String recipientId) {
    final String sql =
        """
        DELETE FROM sent_messages
        WHERE recipient_id = :recipientId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("recipientId", recipientId));
  }

  // 削除予定のない(期限なし)行だけを保持期間で掃除する
  public int deleteUntrackedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM sent_messages
        WHERE delete_after IS NULL
          AND sent_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private SentMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SentMessage(
        rs.getString("recipient_id"),
        rs.getString("message_id"),
        NotificationKind.valueOf(rs.getString("kind")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("delete_after")));
  }
}
