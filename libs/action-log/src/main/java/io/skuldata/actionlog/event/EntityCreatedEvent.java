package io.skuldata.actionlog.event;

import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.model.ActorContext;
import java.util.Objects;

/** 永続化直後 (ID 採番済み) に発行する。 */
public record EntityCreatedEvent(AuditableEntity entity, ActorContext context)
    implements EntityChangeEvent {

  public EntityCreatedEvent {
    Objects.requireNonNull(entity, "entity");
    context = context == null ? ActorContext.anonymous() : context;
  }
}
