/*
 * どこで: School API (監査ログ参照)
 * 何を: ActionLogView を API 契約の形へ変換する
 * なぜ: ライブラリの参照モデルと外部公開する JSON 形式を切り離すため
 */
package io.skuldata.school.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.skuldata.actionlog.query.ActionLogView;
import io.skuldata.actionlog.query.ActorDetails;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActionLogResponse(
    UUID logId,
    Long actorId,
    UUID actorTag,
    UserDetails userDetails,
    String action,
    String category,
    String categoryDisplay,
    String ipAddress,
    String userAgent,
    String affectedModel,
    Long targetId,
    String affectedObject,
    JsonNode metadata,
    Instant timestamp,
    boolean systemAction) {

  public static ActionLogResponse from(ActionLogView view) {
    return new ActionLogResponse(
        view.logId(),
        view.actorId(),
        view.actorTag(),
        view.actorDetails() == null ? null : UserDetails.from(view.actorDetails()),
        view.action(),
        view.category().name(),
        view.categoryDisplay(),
        view.ipAddress(),
        view.userAgent(),
        view.affectedModel(),
        view.targetId(),
        view.affectedObject(),
        view.metadata(),
        view.occurredAt(),
        view.systemAction());
  }

  /** 操作者の現在のプロフィール。システム操作や削除済みのアクターでは null になる。 */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record UserDetails(
      long id,
      UUID userTag,
      String username,
      String email,
      String firstName,
      String lastName,
      String role) {

    static UserDetails from(ActorDetails details) {
      return new UserDetails(
          details.id(),
          details.userTag(),
          details.username(),
          details.email(),
          details.firstName(),
          details.lastName(),
          details.role());
    }
  }
}
