/*
 * どこで: School Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ最優先で適用する
 * なぜ: 監査ログのインターセプタが完了処理を行う時点でも request_id が MDC に残っているようにするため
 */
package io.skuldata.school.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).order(Ordered.HIGHEST_PRECEDENCE);
  }
}
