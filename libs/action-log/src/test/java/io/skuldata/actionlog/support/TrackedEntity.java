package io.skuldata.actionlog.support;

import io.skuldata.actionlog.capability.ActorAware;
import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** テスト用の汎用エンティティ。values のキー順が追跡フィールドの順になる。 */
public record TrackedEntity(
    String typeTag, Long id, Map<String, Object> values, AuditActor attachedActor)
    implements AuditableEntity, FieldTracking, ActorAware {

  public TrackedEntity {
    values = new LinkedHashMap<>(values);
  }

  public static TrackedEntity of(String typeTag, Long id, Map<String, Object> values) {
    return new TrackedEntity(typeTag, id, values, null);
  }

  public TrackedEntity withActor(AuditActor actor) {
    return new TrackedEntity(typeTag, id, values, actor);
  }

  @Override
  public Optional<Long> identity() {
    return Optional.ofNullable(id);
  }

  @Override
  public List<String> trackedFields() {
    return List.copyOf(values.keySet());
  }

  @Override
  public Map<String, Object> trackedValues() {
    return new LinkedHashMap<>(values);
  }

  @Override
  public Optional<AuditActor> currentActor() {
    return Optional.ofNullable(attachedActor);
  }
}
