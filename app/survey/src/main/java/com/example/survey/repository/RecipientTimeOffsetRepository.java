/*
 * どこで: Survey データアクセス
 * 何を: recipient_time_offsets の登録/取得を行う
 * なぜ: 参加時に算出した時差補正を、再参加時の上書きと削除も含めて保持するため
 */
package com.example.survey.repository;

import com.example.survey.model.RecipientTimeOffset;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientTimeOffsetRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsert(RecipientTimeOffset offset) {
    final String sql =
        """
        INSERT INTO recipient_time_offsets (recipient_id, offset_seconds, updated_at)
        VALUES (:recipientId, :offsetSeconds, now())
        ON CONFLICT (recipient_id)
        DO UPDATE SET offset_seconds = EXCLUDED.offset_seconds,
                      updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", offset.recipientId())
            .addValue("offsetSeconds", offset.offsetSeconds());
    jdbcTemplate.update(sql, params);
  }

  // 未登録の参加者は補正なしとして扱う
  public RecipientTimeOffset find(String recipientId) {
    final String sql =
        """
        SELECT offset_seconds
        FROM recipient_time_offsets
        WHERE recipient_id = :recipientId
        """;
    final List<Long> offsets =
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("recipientId", recipientId), Long.class);
    return offsets.isEmpty()
        ? RecipientTimeOffset.none(recipientId)
        : new RecipientTimeOffset(recipientId, offsets.get(0));
  }

  public int delete(String recipientId) {
    final String sql =
        """
        DELETE FROM recipient_time_offsets
        WHERE recipient_id = :recipientId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("recipientId", recipientId));
  }
}
