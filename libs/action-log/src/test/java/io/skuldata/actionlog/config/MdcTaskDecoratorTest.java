package io.skuldata.actionlog.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcTaskDecoratorTest {

  private final MdcTaskDecorator decorator = new MdcTaskDecorator();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void copiesSubmitterContextAndRestoresWorkerContext() {
    MDC.put("request_id", "req-1");
    final AtomicReference<String> seen = new AtomicReference<>();
    final Runnable decorated = decorator.decorate(() -> seen.set(MDC.get("request_id")));

    // ワーカースレッド側に別の値が残っている状況を同一スレッドで再現する
    MDC.put("request_id", "worker-previous");
    decorated.run();

    assertThat(seen.get()).isEqualTo("req-1");
    assertThat(MDC.get("request_id")).isEqualTo("worker-previous");
  }

  @Test
  void clearsContextWhenSubmitterHadNone() {
    MDC.clear();
    final AtomicReference<String> seen = new AtomicReference<>("unset");
    final Runnable decorated = decorator.decorate(() -> seen.set(MDC.get("request_id")));

    MDC.put("request_id", "stale");
    decorated.run();

    assertThat(seen.get()).isNull();
    assertThat(MDC.get("request_id")).isEqualTo("stale");
  }
}
