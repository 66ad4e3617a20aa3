package io.skuldata.actionlog.event;

import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import io.skuldata.actionlog.model.ActorContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 削除後に発行する。
 *
 * @param deletedValues 削除前に取得した値。削除後は対象を解決できないため発行側で詰める
 */
public record EntityDeletedEvent(
    AuditableEntity entity, Map<String, Object> deletedValues, ActorContext context)
    implements EntityChangeEvent {

  public EntityDeletedEvent {
    Objects.requireNonNull(entity, "entity");
    deletedValues =
        deletedValues == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(deletedValues));
    context = context == null ? ActorContext.anonymous() : context;
  }

  public static EntityDeletedEvent of(AuditableEntity entity, ActorContext context) {
    final Map<String, Object> values =
        entity instanceof FieldTracking tracking ? tracking.trackedValues() : Map.of();
    return new EntityDeletedEvent(entity, values, context);
  }
}
