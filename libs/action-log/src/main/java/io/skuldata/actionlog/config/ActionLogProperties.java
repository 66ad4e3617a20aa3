/*
 * どこで: Action log の設定バインド
 * 何を: 同期モード/ワーカープール/監視除外/インターセプタ設定を保持する
 * なぜ: 運用パラメータを外部化し、未設定でも安全な既定値で動かすため
 */
package io.skuldata.actionlog.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "action-log")
public record ActionLogProperties(
    boolean synchronous, Async async, Observer observer, Interceptor interceptor, Seed seed) {

  public ActionLogProperties {
    async = async == null ? new Async(0, 0, 0, null) : async;
    observer = observer == null ? new Observer(null) : observer;
    interceptor = interceptor == null ? new Interceptor(null, null) : interceptor;
    seed = seed == null ? new Seed(false) : seed;
  }

  public record Async(
      int corePoolSize, int maxPoolSize, int queueCapacity, Duration shutdownTimeout) {

    public Async {
      corePoolSize = corePoolSize <= 0 ? 2 : corePoolSize;
      maxPoolSize = maxPoolSize < corePoolSize ? Math.max(corePoolSize, 4) : maxPoolSize;
      queueCapacity = queueCapacity <= 0 ? 1000 : queueCapacity;
      shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(10) : shutdownTimeout;
    }
  }

  public record Observer(List<String> excludedTypes) {

    public Observer {
      excludedTypes =
          excludedTypes == null ? List.of("FlywaySchemaHistory") : List.copyOf(excludedTypes);
    }
  }

  public record Interceptor(Boolean enabled, List<String> skipPathPrefixes) {

    public Interceptor {
      enabled = enabled == null ? Boolean.TRUE : enabled;
      skipPathPrefixes =
          skipPathPrefixes == null
              ? List.of("/admin/", "/static/", "/actuator/", "/error")
              : List.copyOf(skipPathPrefixes);
    }
  }

  public record Seed(boolean enabled) {}
}
