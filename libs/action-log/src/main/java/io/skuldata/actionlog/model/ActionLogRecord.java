/*
 * どこで: Action log ドメインモデル
 * 何を: action_logs テーブル相当の不変レコード
 * なぜ: 「誰が・何を・どの対象に」行ったかを一度だけ書き込み、以後は読み取り専用で扱うため
 */
package io.skuldata.actionlog.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public record ActionLogRecord(
    UUID logId,
    Long actorId,
    UUID actorTag,
    String action,
    ActionCategory category,
    String targetType,
    Long targetId,
    String ipAddress,
    String userAgent,
    String metadataJson,
    Instant occurredAt) {

  /** アクターが存在しない (システム起因) 操作に使う固定タグ。 */
  public static final UUID SYSTEM_ACTOR_TAG = new UUID(0L, 0L);

  /** 自己記録ループを防ぐため、エンティティ監視の除外リストに必ず含める型タグ。 */
  public static final String TYPE_TAG = "ActionLog";

  public ActionLogRecord {
    Objects.requireNonNull(logId, "logId");
    Objects.requireNonNull(actorTag, "actorTag");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(occurredAt, "occurredAt");
    if ((targetType == null) != (targetId == null)) {
      throw new IllegalArgumentException(
          "targetType and targetId must be both present or both absent");
    }
    metadataJson = metadataJson == null ? "{}" : metadataJson;
  }

  public Optional<ActionTarget> target() {
    if (targetType == null) {
      return Optional.empty();
    }
    return Optional.of(new ActionTarget(targetType, targetId));
  }

  public boolean isSystemAction() {
    return actorId == null && SYSTEM_ACTOR_TAG.equals(actorTag);
  }
}
