/*
 * どこで: Action log の受け口となる能力インターフェース
 * 何を: 監査対象になり得るエンティティの最小契約を定義する
 * なぜ: エンティティの具体型を知らずに (型タグ, ID) で参照できるようにするため
 */
package io.skuldata.actionlog.capability;

import java.util.Optional;

public interface AuditableEntity {

  /** 永続化済みなら ID、未保存なら空。 */
  Optional<Long> identity();

  /** "Student" のような安定した型タグ。 */
  String typeTag();

  default String displayName() {
    return identity().map(id -> typeTag() + "#" + id).orElse(typeTag());
  }
}
