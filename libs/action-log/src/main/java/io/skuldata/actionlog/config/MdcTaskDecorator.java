package io.skuldata.actionlog.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/** 投入元スレッドの MDC (request_id など) をワーカースレッドへ引き継ぐ。 */
public class MdcTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    final Map<String, String> captured = MDC.getCopyOfContextMap();
    return () -> {
      final Map<String, String> previous = MDC.getCopyOfContextMap();
      if (captured == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(captured);
      }
      try {
        runnable.run();
      } finally {
        if (previous == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(previous);
        }
      }
    };
  }
}
