package io.skuldata.actionlog.capability;

import java.util.Optional;

/** 呼び出し側がエンティティへ一時的に添付したアクター。リクエスト文脈より優先される。 */
public interface ActorAware {

  Optional<AuditActor> currentActor();
}
