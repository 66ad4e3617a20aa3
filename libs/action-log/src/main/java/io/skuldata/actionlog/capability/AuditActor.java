package io.skuldata.actionlog.capability;

import java.util.Optional;
import java.util.UUID;

/** 操作の主体 (ユーザー) の契約。stableTag はアクター削除後も残る識別子として記録される。 */
public interface AuditActor {

  Optional<Long> identity();

  UUID stableTag();

  default String displayName() {
    return stableTag().toString();
  }
}
