package io.skuldata.actionlog.query;

import java.util.List;
import java.util.Optional;

/**
 * アクターの参照窓口。ホストアプリが Bean として 1 つ登録する。
 *
 * <p>未登録ならアクター詳細は付かず、キーワード検索は操作名だけを対象にする。
 */
public interface ActionActorDirectory {

  /** 削除済みのアクターなら空を返す。 */
  Optional<ActorDetails> find(long actorId);

  /**
   * ユーザー名・メールアドレス・氏名のいずれかに語を含むアクターの ID。
   *
   * @param term 前後の空白を除いた検索語 (大文字小文字は区別しない)
   */
  List<Long> findIdsMatching(String term);
}
