/*
 * どこで: Action log のエンティティ変更イベント
 * 何を: 作成/更新/削除イベントの共通型を定義する
 * なぜ: 監視リスナーが対象エンティティとアクターを型に依らず取り出せるようにするため
 */
package io.skuldata.actionlog.event;

import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.model.ActorContext;

public interface EntityChangeEvent {

  AuditableEntity entity();

  /** 発行元リクエストのアクター情報。リクエスト外なら {@link ActorContext#anonymous()}。 */
  ActorContext context();
}
