/*
 * どこで: School アプリのセキュリティ設定
 * 何を: ヘッダー認証フィルタとロール別のアクセス制御を定義する
 * なぜ: 監査ログの参照を管理者に限定し、変更系 API を教職員だけに開放するため
 */
package io.skuldata.school.config;

import io.skuldata.school.repository.UserRepository;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties(SchoolAuthProperties.class)
public class SchoolSecurityConfig {

  private static final String ADMIN = "ADMIN";
  private static final String TEACHER = "TEACHER";

  @Bean
  HeaderAuthenticationFilter headerAuthenticationFilter(
      SchoolAuthProperties properties, UserRepository userRepository) {
    return new HeaderAuthenticationFilter(properties, userRepository);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, HeaderAuthenticationFilter headerAuthenticationFilter) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(headerAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info")
                    .permitAll()
                    .requestMatchers("/action-logs/**", "/action-logs")
                    .hasRole(ADMIN)
                    .requestMatchers(HttpMethod.POST, "/**")
                    .hasAnyRole(ADMIN, TEACHER)
                    .requestMatchers(HttpMethod.PUT, "/**")
                    .hasAnyRole(ADMIN, TEACHER)
                    .requestMatchers(HttpMethod.DELETE, "/**")
                    .hasAnyRole(ADMIN, TEACHER)
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
