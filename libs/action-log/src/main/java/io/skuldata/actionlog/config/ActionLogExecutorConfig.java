/*
 * どこで: Action log の非同期実行設定
 * 何を: recordAsync が使う上限付きワーカープールを定義する
 * なぜ: イベントごとのスレッド生成を避け、負荷時はキュー溢れ分を破棄して呼び出し元を待たせないため
 */
package io.skuldata.actionlog.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ActionLogExecutorConfig {

  public static final String ACTION_LOG_EXECUTOR = "actionLogExecutor";

  private static final Logger logger = LoggerFactory.getLogger(ActionLogExecutorConfig.class);

  @Bean(name = ACTION_LOG_EXECUTOR)
  public ThreadPoolTaskExecutor actionLogExecutor(ActionLogProperties properties) {
    final ActionLogProperties.Async async = properties.async();
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(async.corePoolSize());
    executor.setMaxPoolSize(async.maxPoolSize());
    executor.setQueueCapacity(async.queueCapacity());
    executor.setThreadNamePrefix("action-log-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    // 満杯時は TaskRejectedException を投げ、呼び出し側で破棄として計上する
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds((int) async.shutdownTimeout().toSeconds());
    logger.info(
        "action log executor configured core={} max={} queue={}",
        async.corePoolSize(),
        async.maxPoolSize(),
        async.queueCapacity());
    return executor;
  }
}
