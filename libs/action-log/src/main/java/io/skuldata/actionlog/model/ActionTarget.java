/*
 * どこで: Action log ドメインモデル
 * 何を: 操作対象の (型タグ, ID) 参照を表す
 * なぜ: 任意のエンティティを弱参照として記録するため
 */
package io.skuldata.actionlog.model;

import io.skuldata.actionlog.capability.AuditableEntity;
import java.util.Objects;
import java.util.Optional;

/** 型タグは target_type 列の幅 ({@value #MAX_TYPE_TAG_LENGTH} 文字) で切り詰める。 */
public record ActionTarget(String typeTag, Long id) implements AuditableEntity {

  public static final int MAX_TYPE_TAG_LENGTH = 100;

  public ActionTarget {
    Objects.requireNonNull(typeTag, "typeTag");
    Objects.requireNonNull(id, "id");
    if (typeTag.isBlank()) {
      throw new IllegalArgumentException("typeTag must not be blank");
    }
    if (typeTag.length() > MAX_TYPE_TAG_LENGTH) {
      typeTag = typeTag.substring(0, MAX_TYPE_TAG_LENGTH);
    }
  }

  /** 未永続のエンティティは型タグだけを残さないよう空を返す。 */
  public static Optional<ActionTarget> of(AuditableEntity entity) {
    if (entity == null) {
      return Optional.empty();
    }
    if (entity instanceof ActionTarget target) {
      return Optional.of(target);
    }
    return entity.identity().map(id -> new ActionTarget(entity.typeTag(), id));
  }

  @Override
  public Optional<Long> identity() {
    return Optional.of(id);
  }
}
