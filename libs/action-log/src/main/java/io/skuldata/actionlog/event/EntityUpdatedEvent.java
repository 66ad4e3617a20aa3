package io.skuldata.actionlog.event;

import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import io.skuldata.actionlog.model.ActorContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 更新後に発行する。
 *
 * @param entity 更新後のエンティティ
 * @param previousValues 更新前に取得した追跡フィールドの値 (null 値を含み得る)
 */
public record EntityUpdatedEvent(
    AuditableEntity entity, Map<String, Object> previousValues, ActorContext context)
    implements EntityChangeEvent {

  public EntityUpdatedEvent {
    Objects.requireNonNull(entity, "entity");
    previousValues =
        previousValues == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(previousValues));
    context = context == null ? ActorContext.anonymous() : context;
  }

  public static <T extends AuditableEntity & FieldTracking> EntityUpdatedEvent of(
      T before, T after, ActorContext context) {
    return new EntityUpdatedEvent(after, before.trackedValues(), context);
  }
}
