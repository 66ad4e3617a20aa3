/*
 * どこで: Action log ドメインモデル
 * 何を: リクエスト単位の「現在のアクター」を明示的な値として運ぶ
 * なぜ: グローバル状態に頼らず、コントローラ → サービス → イベントへ引き回すため
 */
package io.skuldata.actionlog.model;

import io.skuldata.actionlog.capability.AuditActor;
import java.util.Optional;

/**
 * @param actor 認証済みアクター。匿名リクエストやリクエスト外では null
 */
public record ActorContext(AuditActor actor, RequestDetails requestDetails) {

  private static final ActorContext ANONYMOUS = new ActorContext(null, RequestDetails.none());

  public ActorContext {
    requestDetails = requestDetails == null ? RequestDetails.none() : requestDetails;
  }

  public static ActorContext anonymous() {
    return ANONYMOUS;
  }

  public static ActorContext of(AuditActor actor) {
    return new ActorContext(actor, RequestDetails.none());
  }

  public Optional<AuditActor> findActor() {
    return Optional.ofNullable(actor);
  }
}
