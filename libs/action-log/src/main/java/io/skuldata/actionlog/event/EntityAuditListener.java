/*
 * どこで: Action log のエンティティ監視
 * 何を: 作成/更新/削除イベントを受けて CREATE/UPDATE/DELETE の監査ログを書き込む
 * なぜ: 各サービスが個別に記録処理を書かなくても、変更履歴が漏れなく残るようにするため
 */
package io.skuldata.actionlog.event;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.skuldata.actionlog.capability.ActorAware;
import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import io.skuldata.actionlog.config.ActionLogProperties;
import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActionLogRecord;
import io.skuldata.actionlog.model.ActorContext;
import io.skuldata.actionlog.service.ActionLogMetrics;
import io.skuldata.actionlog.service.ActionLogRecorder;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Spring 管理の共有コンポーネントを保持するだけで防御的コピーが不可能なため")
public class EntityAuditListener {

  static final List<String> NAME_LIKE_FIELDS =
      List.of("name", "title", "display_name", "first_name", "last_name", "code");

  private static final Logger logger = LoggerFactory.getLogger(EntityAuditListener.class);

  private final ActionLogRecorder recorder;
  private final ActionLogMetrics metrics;
  private final Set<String> excludedTypes;

  public EntityAuditListener(
      ActionLogRecorder recorder, ActionLogMetrics metrics, ActionLogProperties properties) {
    this.recorder = recorder;
    this.metrics = metrics;
    final Set<String> excluded = new HashSet<>(properties.observer().excludedTypes());
    // 自分自身の書き込みを監視すると無限に記録が連鎖する
    excluded.add(ActionLogRecord.TYPE_TAG);
    this.excludedTypes = Set.copyOf(excluded);
  }

  @EventListener
  public void onEntityChange(EntityChangeEvent event) {
    try {
      handle(event);
    } catch (RuntimeException ex) {
      logger.warn(
          "entity audit failed event={} type={}",
          event.getClass().getSimpleName(),
          event.entity().typeTag(),
          ex);
    }
  }

  private void handle(EntityChangeEvent event) {
    final AuditableEntity entity = event.entity();
    final String typeTag = entity.typeTag();
    if (excludedTypes.contains(typeTag)) {
      metrics.recordSkipped("excluded_type");
      return;
    }
    final Optional<AuditActor> actor = resolveActor(entity, event.context());
    if (actor.isEmpty()) {
      // システム操作は recordSystem を明示的に呼ぶ。ここで system 扱いにはしない
      metrics.recordSkipped("no_actor");
      logger.debug("entity audit skipped because no actor is attached type={}", typeTag);
      return;
    }
    if (event instanceof EntityCreatedEvent) {
      onCreated(entity, actor.get(), event.context());
    } else if (event instanceof EntityUpdatedEvent updated) {
      onUpdated(updated, actor.get());
    } else if (event instanceof EntityDeletedEvent deleted) {
      onDeleted(deleted, actor.get());
    }
  }

  private void onCreated(AuditableEntity entity, AuditActor actor, ActorContext context) {
    final Map<String, Object> metadata =
        entity instanceof FieldTracking tracking
            ? new LinkedHashMap<>(tracking.trackedValues())
            : new LinkedHashMap<>();
    recorder.recordAsync(
        actor,
        "Created " + entity.typeTag(),
        ActionCategory.CREATE,
        entity,
        metadata,
        context.requestDetails());
  }

  private void onUpdated(EntityUpdatedEvent event, AuditActor actor) {
    if (!(event.entity() instanceof FieldTracking tracking)) {
      metrics.recordSkipped("untracked_update");
      return;
    }
    final Map<String, Object> previous = event.previousValues();
    final Map<String, Object> current = tracking.trackedValues();
    final List<String> changed = new ArrayList<>();
    final Map<String, Object> oldValues = new LinkedHashMap<>();
    final Map<String, Object> newValues = new LinkedHashMap<>();
    for (String field : tracking.trackedFields()) {
      final Object before = previous.get(field);
      final Object after = current.get(field);
      if (!Objects.equals(before, after)) {
        changed.add(field);
        oldValues.put(field, before);
        newValues.put(field, after);
      }
    }
    if (changed.isEmpty()) {
      metrics.recordSkipped("no_change");
      logger.debug(
          "entity update skipped because no tracked field changed type={}",
          event.entity().typeTag());
      return;
    }
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("fields_changed", changed);
    metadata.put("old_values", oldValues);
    metadata.put("new_values", newValues);
    recorder.recordAsync(
        actor,
        "Updated " + event.entity().typeTag(),
        ActionCategory.UPDATE,
        event.entity(),
        metadata,
        event.context().requestDetails());
  }

  private void onDeleted(EntityDeletedEvent event, AuditActor actor) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    for (String field : NAME_LIKE_FIELDS) {
      final Object value = event.deletedValues().get(field);
      if (value != null) {
        metadata.put(field, value);
      }
    }
    recorder.recordAsync(
        actor,
        "Deleted " + event.entity().typeTag(),
        ActionCategory.DELETE,
        event.entity(),
        metadata,
        event.context().requestDetails());
  }

  // エンティティに添付されたアクターを、リクエスト文脈より優先する
  private Optional<AuditActor> resolveActor(AuditableEntity entity, ActorContext context) {
    if (entity instanceof ActorAware aware) {
      final Optional<AuditActor> attached = aware.currentActor();
      if (attached.isPresent()) {
        return attached;
      }
    }
    return context.findActor();
  }
}
