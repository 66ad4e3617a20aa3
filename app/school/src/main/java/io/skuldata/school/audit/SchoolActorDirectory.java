/*
 * どこで: School の監査ログ連携
 * 何を: users テーブルをアクターの参照窓口として公開する
 * なぜ: ログ参照時に操作者のプロフィールを添え、氏名やメールアドレスでもログを検索できるようにするため
 */
package io.skuldata.school.audit;

import io.skuldata.actionlog.query.ActionActorDirectory;
import io.skuldata.actionlog.query.ActorDetails;
import io.skuldata.school.model.UserRecord;
import io.skuldata.school.repository.UserRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SchoolActorDirectory implements ActionActorDirectory {

  /** 広すぎる語で IN 句が膨らまないよう一致件数を抑える。 */
  static final int MAX_MATCHING_ACTORS = 500;

  private final UserRepository userRepository;

  @Override
  public Optional<ActorDetails> find(long actorId) {
    return userRepository.findById(actorId).map(SchoolActorDirectory::toDetails);
  }

  @Override
  public List<Long> findIdsMatching(String term) {
    return userRepository.findIdsMatching(term, MAX_MATCHING_ACTORS);
  }

  private static ActorDetails toDetails(UserRecord user) {
    return new ActorDetails(
        user.id(),
        user.userTag(),
        user.username(),
        user.email(),
        user.firstName(),
        user.lastName(),
        user.role().name());
  }
}
