package io.skuldata.school.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.skuldata.school.model.UserRecord;
import io.skuldata.school.model.UserRole;
import io.skuldata.school.repository.UserRepository;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class HeaderAuthenticationFilterTest {

  private static final UserRecord TEACHER =
      new UserRecord(
          2L,
          UUID.fromString("7b0c2f6e-1d5a-4c8e-9f3b-2a6d4e8c1f02"),
          "teacher",
          "teacher@school.local",
          "Grace",
          "Wanjiku",
          UserRole.TEACHER);

  @Mock private UserRepository userRepository;

  @AfterEach
  void cleanup() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void authenticatesKnownUserWithValidToken() throws Exception {
    when(userRepository.findById(2L)).thenReturn(Optional.of(TEACHER));
    final MockHttpServletRequest request = request("secret", "2");
    final MockFilterChain chain = new MockFilterChain();

    filter("secret").doFilter(request, new MockHttpServletResponse(), chain);

    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication).isNotNull();
    assertThat(authentication.getPrincipal()).isEqualTo(TEACHER);
    assertThat(authentication.getAuthorities())
        .extracting(Object::toString)
        .containsExactly("ROLE_TEACHER");
    assertThat(chain.getRequest()).isSameAs(request);
  }

  @Test
  void ignoresMalformedUserId() throws Exception {
    final MockFilterChain chain = new MockFilterChain();

    filter("secret").doFilter(request("secret", "abc"), new MockHttpServletResponse(), chain);

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(chain.getRequest()).isNotNull();
    verifyNoInteractions(userRepository);
  }

  @Test
  void ignoresUnknownUser() throws Exception {
    when(userRepository.findById(9L)).thenReturn(Optional.empty());

    filter("secret")
        .doFilter(request("secret", "9"), new MockHttpServletResponse(), new MockFilterChain());

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
  }

  @Test
  void neverAuthenticatesWhenTokenIsNotConfigured() throws Exception {
    filter("").doFilter(request("", "2"), new MockHttpServletResponse(), new MockFilterChain());

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    verifyNoInteractions(userRepository);
  }

  @Test
  void rejectsWrongToken() throws Exception {
    filter("secret")
        .doFilter(request("other", "2"), new MockHttpServletResponse(), new MockFilterChain());

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    verifyNoInteractions(userRepository);
  }

  private HeaderAuthenticationFilter filter(String token) {
    return new HeaderAuthenticationFilter(
        new SchoolAuthProperties(null, token, null), userRepository);
  }

  private static MockHttpServletRequest request(String token, String userId) {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/students");
    request.addHeader("X-Internal-Token", token);
    request.addHeader("X-User-Id", userId);
    return request;
  }
}
