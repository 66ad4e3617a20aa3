package io.skuldata.actionlog.model;

import java.time.Instant;
import java.util.UUID;

/**
 * action_logs の検索条件。null のフィールドは「条件なし」を意味する。
 *
 * @param from 範囲の開始 (含む)
 * @param to 範囲の終了 (含まない)
 * @param search action 文字列の部分一致 (大文字小文字を区別しない)
 * @param oldestFirst true のとき occurred_at 昇順、既定は新しい順
 */
public record ActionLogQuery(
    ActionCategory category,
    String targetType,
    Long targetId,
    UUID actorTag,
    Long actorId,
    Instant from,
    Instant to,
    String search,
    boolean oldestFirst) {

  public static ActionLogQuery all() {
    return new ActionLogQuery(null, null, null, null, null, null, null, null, false);
  }

  public ActionLogQuery withCategory(ActionCategory value) {
    return new ActionLogQuery(
        value, targetType, targetId, actorTag, actorId, from, to, search, oldestFirst);
  }

  public ActionLogQuery withTargetType(String value) {
    return new ActionLogQuery(
        category, value, targetId, actorTag, actorId, from, to, search, oldestFirst);
  }

  public ActionLogQuery withActorTag(UUID value) {
    return new ActionLogQuery(
        category, targetType, targetId, value, actorId, from, to, search, oldestFirst);
  }

  public ActionLogQuery withRange(Instant rangeFrom, Instant rangeTo) {
    return new ActionLogQuery(
        category, targetType, targetId, actorTag, actorId, rangeFrom, rangeTo, search, oldestFirst);
  }

  public ActionLogQuery withSearch(String value) {
    return new ActionLogQuery(
        category, targetType, targetId, actorTag, actorId, from, to, value, oldestFirst);
  }
}
