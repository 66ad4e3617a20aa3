/*
 * どこで: Action log の Web 層
 * 何を: SecurityContext と HTTP ヘッダーから ActorContext を組み立てる
 * なぜ: コントローラがアクター情報を明示的な値としてサービス層へ渡せるようにするため
 */
package io.skuldata.actionlog.web;

import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.model.ActorContext;
import io.skuldata.actionlog.model.RequestDetails;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class ActorContextResolver {

  public ActorContext resolve(HttpServletRequest request) {
    return new ActorContext(currentActor().orElse(null), requestDetails(request));
  }

  /** 認証済みで、かつ principal が {@link AuditActor} の場合だけ値を返す。 */
  public Optional<AuditActor> currentActor() {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null || !authentication.isAuthenticated()) {
      return Optional.empty();
    }
    if (authentication.getPrincipal() instanceof AuditActor actor) {
      return Optional.of(actor);
    }
    return Optional.empty();
  }

  public RequestDetails requestDetails(HttpServletRequest request) {
    return new RequestDetails(
        ClientAddresses.resolveClientIp(request), request.getHeader("User-Agent"));
  }
}
