package io.skuldata.school.config;

import io.skuldata.school.model.UserRecord;
import io.skuldata.school.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 前段のゲートウェイが付与する内部トークンとユーザー ID ヘッダーから認証を確立する。
 *
 * <p>principal は {@link UserRecord} そのもので、action-log 側からは AuditActor として見える。
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

  private final SchoolAuthProperties properties;
  private final UserRepository userRepository;

  public HeaderAuthenticationFilter(
      SchoolAuthProperties properties, UserRepository userRepository) {
    this.properties = properties;
    this.userRepository = userRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final Optional<UserRecord> user = resolveUser(request);
    if (user.isPresent()) {
      final UserRecord principal = user.get();
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              principal,
              "N/A",
              List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name())));
      logger.debug(
          "header authentication established for path={} user_id={} role={}",
          request.getRequestURI(),
          principal.id(),
          principal.role());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    }
    filterChain.doFilter(request, response);
  }

  private Optional<UserRecord> resolveUser(HttpServletRequest request) {
    if (!isValidToken(request.getHeader(properties.headerName()))) {
      return Optional.empty();
    }
    final String rawUserId = request.getHeader(properties.userIdHeaderName());
    if (rawUserId == null || rawUserId.isBlank()) {
      return Optional.empty();
    }
    final long userId;
    try {
      userId = Long.parseLong(rawUserId.trim());
    } catch (NumberFormatException ex) {
      logger.warn(
          "header authentication rejected: malformed {} on path={}",
          properties.userIdHeaderName(),
          request.getRequestURI());
      return Optional.empty();
    }
    final Optional<UserRecord> user = userRepository.findById(userId);
    if (user.isEmpty()) {
      logger.warn(
          "header authentication rejected: unknown user_id={} on path={}",
          userId,
          request.getRequestURI());
    }
    return user;
  }

  private boolean isValidToken(String actualToken) {
    return actualToken != null
        && !properties.token().isBlank()
        && actualToken.equals(properties.token());
  }
}
