/*
 * どこで: School ドメインモデル
 * 何を: users テーブル相当のレコード。認証後は principal として SecurityContext に載る
 * なぜ: 監査ログのアクター (ID と不変タグ) をそのまま提供するため
 */
package io.skuldata.school.model;

import io.skuldata.actionlog.capability.AuditActor;
import java.util.Optional;
import java.util.UUID;

public record UserRecord(
    Long id,
    UUID userTag,
    String username,
    String email,
    String firstName,
    String lastName,
    UserRole role)
    implements AuditActor {

  @Override
  public Optional<Long> identity() {
    return Optional.ofNullable(id);
  }

  @Override
  public UUID stableTag() {
    return userTag;
  }

  @Override
  public String displayName() {
    return firstName + " " + lastName;
  }
}
