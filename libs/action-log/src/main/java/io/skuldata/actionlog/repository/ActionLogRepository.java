/*
 * どこで: Action log データアクセス
 * 何を: action_logs の登録と検索を行う (更新・部分更新は提供しない)
 * なぜ: 監査ログを一度だけ書き込み、新しい順で読み出せるようにするため
 */
package io.skuldata.actionlog.repository;

import static io.skuldata.common.JdbcTimestampUtils.readInstant;
import static io.skuldata.common.JdbcTimestampUtils.toTimestamp;

import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActionLogQuery;
import io.skuldata.actionlog.model.ActionLogRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class ActionLogRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT log_id, actor_id, actor_tag, action, category, target_type, target_id,
             ip_address, user_agent, metadata::text AS metadata, occurred_at
      FROM action_logs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ActionLogRecord create(ActionLogRecord record) {
    final String sql =
        """
        INSERT INTO action_logs (
          log_id, actor_id, actor_tag, action, category, target_type, target_id,
          ip_address, user_agent, metadata, occurred_at
        ) VALUES (
          :logId, :actorId, :actorTag, :action, :category, :targetType, :targetId,
          :ipAddress, :userAgent, CAST(:metadata AS jsonb), :occurredAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("logId", record.logId())
            .addValue("actorId", record.actorId())
            .addValue("actorTag", record.actorTag())
            .addValue("action", record.action())
            .addValue("category", record.category().name())
            .addValue("targetType", record.targetType())
            .addValue("targetId", record.targetId())
            .addValue("ipAddress", record.ipAddress())
            .addValue("userAgent", record.userAgent())
            .addValue("metadata", record.metadataJson())
            .addValue("occurredAt", toTimestamp(record.occurredAt()));
    jdbcTemplate.update(sql, params);
    return record;
  }

  public Optional<ActionLogRecord> findById(UUID logId) {
    final String sql = SELECT_COLUMNS + " WHERE log_id = :logId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("logId", logId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ActionLogRecord> search(ActionLogQuery query, int limit, long offset) {
    return search(query, List.of(), limit, offset);
  }

  /**
   * @param searchActorIds キーワードに一致したアクター。キーワード指定時は操作名の一致と OR で結合する
   */
  public List<ActionLogRecord> search(
      ActionLogQuery query, List<Long> searchActorIds, int limit, long offset) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String direction = query.oldestFirst() ? "ASC" : "DESC";
    final String sql =
        SELECT_COLUMNS
            + buildWhere(query, searchActorIds, params)
            + " ORDER BY occurred_at "
            + direction
            + ", log_id "
            + direction
            + " LIMIT :limit OFFSET :offset";
    params.addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long count(ActionLogQuery query) {
    return count(query, List.of());
  }

  public long count(ActionLogQuery query, List<Long> searchActorIds) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql =
        "SELECT COUNT(*) FROM action_logs" + buildWhere(query, searchActorIds, params);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public List<String> findDistinctTargetTypes() {
    final String sql =
        """
        SELECT DISTINCT target_type
        FROM action_logs
        WHERE target_type IS NOT NULL
        ORDER BY target_type
        """;
    return jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), String.class);
  }

  private String buildWhere(
      ActionLogQuery query, List<Long> searchActorIds, MapSqlParameterSource params) {
    final StringBuilder where = new StringBuilder(" WHERE 1 = 1");
    if (query.category() != null) {
      where.append(" AND category = :category");
      params.addValue("category", query.category().name());
    }
    if (query.targetType() != null) {
      where.append(" AND target_type = :targetType");
      params.addValue("targetType", query.targetType());
    }
    if (query.targetId() != null) {
      where.append(" AND target_id = :targetId");
      params.addValue("targetId", query.targetId());
    }
    if (query.actorTag() != null) {
      where.append(" AND actor_tag = :actorTag");
      params.addValue("actorTag", query.actorTag());
    }
    if (query.actorId() != null) {
      where.append(" AND actor_id = :actorId");
      params.addValue("actorId", query.actorId());
    }
    if (query.from() != null) {
      where.append(" AND occurred_at >= :from");
      params.addValue("from", toTimestamp(query.from()));
    }
    if (query.to() != null) {
      where.append(" AND occurred_at < :to");
      params.addValue("to", toTimestamp(query.to()));
    }
    if (query.search() != null && !query.search().isBlank()) {
      if (searchActorIds.isEmpty()) {
        where.append(" AND LOWER(action) LIKE :search ESCAPE '\\'");
      } else {
        where.append(
            " AND (LOWER(action) LIKE :search ESCAPE '\\' OR actor_id IN (:searchActorIds))");
        params.addValue("searchActorIds", searchActorIds);
      }
      final String needle = query.search().trim().toLowerCase(Locale.ROOT);
      params.addValue("search", "%" + escapeLike(needle) + "%");
    }
    return where.toString();
  }

  private String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private ActionLogRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ActionLogRecord(
        rs.getObject("log_id", UUID.class),
        rs.getObject("actor_id", Long.class),
        rs.getObject("actor_tag", UUID.class),
        rs.getString("action"),
        ActionCategory.valueOf(rs.getString("category")),
        rs.getString("target_type"),
        rs.getObject("target_id", Long.class),
        rs.getString("ip_address"),
        rs.getString("user_agent"),
        rs.getString("metadata"),
        readInstant(rs, "occurred_at"));
  }
}
