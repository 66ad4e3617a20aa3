package io.skuldata.actionlog.web;

import static org.assertj.core.api.Assertions.assertThat;

import io.skuldata.actionlog.model.ActorContext;
import io.skuldata.actionlog.model.RequestDetails;
import io.skuldata.actionlog.support.TestActor;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

class ActorContextResolverTest {

  private final ActorContextResolver resolver = new ActorContextResolver();

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void resolveCarriesAuthenticatedActorAndClientDetails() {
    final TestActor actor = TestActor.persisted(5L);
    SecurityContextHolder.getContext()
        .setAuthentication(new UsernamePasswordAuthenticationToken(actor, null, List.of()));
    final MockHttpServletRequest request = new MockHttpServletRequest();
    request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
    request.addHeader("User-Agent", "junit");

    final ActorContext context = resolver.resolve(request);

    assertThat(context.actor()).isEqualTo(actor);
    assertThat(context.requestDetails()).isEqualTo(new RequestDetails("203.0.113.7", "junit"));
  }

  @Test
  void resolveWithoutAuthenticationIsAnonymousButKeepsDetails() {
    final MockHttpServletRequest request = new MockHttpServletRequest();
    request.setRemoteAddr("10.0.0.9");

    final ActorContext context = resolver.resolve(request);

    assertThat(context.findActor()).isEmpty();
    assertThat(context.requestDetails().ipAddress()).isEqualTo("10.0.0.9");
  }
}
