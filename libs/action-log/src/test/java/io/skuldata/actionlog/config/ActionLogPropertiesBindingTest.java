/*
 * どこで: Action log 設定バインドのテスト
 * 何を: action-log.* の値と未設定時の既定値、ワーカープールへの反映を検証する
 * なぜ: 設定漏れでも安全な既定値で起動し、明示した値が正しく効くことを保証するため
 */
package io.skuldata.actionlog.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ActionLogPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsExplicitValues() {
    contextRunner
        .withPropertyValues(
            "action-log.synchronous=true",
            "action-log.async.core-pool-size=3",
            "action-log.async.max-pool-size=6",
            "action-log.async.queue-capacity=50",
            "action-log.async.shutdown-timeout=5s",
            "action-log.observer.excluded-types=FlywaySchemaHistory,Session",
            "action-log.interceptor.enabled=false",
            "action-log.interceptor.skip-path-prefixes=/internal/",
            "action-log.seed.enabled=true")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final ActionLogProperties properties = context.getBean(ActionLogProperties.class);

              assertThat(properties.synchronous()).isTrue();
              assertThat(properties.async().corePoolSize()).isEqualTo(3);
              assertThat(properties.async().maxPoolSize()).isEqualTo(6);
              assertThat(properties.async().queueCapacity()).isEqualTo(50);
              assertThat(properties.async().shutdownTimeout()).isEqualTo(Duration.ofSeconds(5));
              assertThat(properties.observer().excludedTypes())
                  .containsExactly("FlywaySchemaHistory", "Session");
              assertThat(properties.interceptor().enabled()).isFalse();
              assertThat(properties.interceptor().skipPathPrefixes()).containsExactly("/internal/");
              assertThat(properties.seed().enabled()).isTrue();

              final ThreadPoolTaskExecutor executor =
                  context.getBean(
                      ActionLogExecutorConfig.ACTION_LOG_EXECUTOR, ThreadPoolTaskExecutor.class);
              assertThat(executor.getCorePoolSize()).isEqualTo(3);
              assertThat(executor.getMaxPoolSize()).isEqualTo(6);
              assertThat(executor.getQueueCapacity()).isEqualTo(50);
              assertThat(executor.getThreadNamePrefix()).isEqualTo("action-log-");
            });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final ActionLogProperties properties = context.getBean(ActionLogProperties.class);

          assertThat(properties.synchronous()).isFalse();
          assertThat(properties.async().corePoolSize()).isEqualTo(2);
          assertThat(properties.async().maxPoolSize()).isEqualTo(4);
          assertThat(properties.async().queueCapacity()).isEqualTo(1000);
          assertThat(properties.async().shutdownTimeout()).isEqualTo(Duration.ofSeconds(10));
          assertThat(properties.observer().excludedTypes()).containsExactly("FlywaySchemaHistory");
          assertThat(properties.interceptor().enabled()).isTrue();
          assertThat(properties.interceptor().skipPathPrefixes())
              .contains("/admin/", "/static/");
          assertThat(properties.seed().enabled()).isFalse();
        });
  }

  @Configuration
  @EnableConfigurationProperties(ActionLogProperties.class)
  @Import(ActionLogExecutorConfig.class)
  static class TestConfiguration {}
}
