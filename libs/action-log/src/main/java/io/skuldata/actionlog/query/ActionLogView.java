package io.skuldata.actionlog.query;

import com.fasterxml.jackson.databind.JsonNode;
import io.skuldata.actionlog.model.ActionCategory;
import java.time.Instant;
import java.util.UUID;

/**
 * 参照用の action log。
 *
 * @param actorDetails アクターの現在のプロフィール。システム操作・削除済み・参照窓口なしなら null
 * @param affectedModel 対象の型タグ。対象なしなら null
 * @param affectedObject 対象の表示名。対象が削除済みなら {@link ActionLogQueryService#OBJECT_NOT_AVAILABLE}
 */
public record ActionLogView(
    UUID logId,
    Long actorId,
    UUID actorTag,
    ActorDetails actorDetails,
    String action,
    ActionCategory category,
    String categoryDisplay,
    String ipAddress,
    String userAgent,
    String affectedModel,
    Long targetId,
    String affectedObject,
    JsonNode metadata,
    Instant occurredAt,
    boolean systemAction) {}
