/*
 * どこで: Action log サービス層
 * 何を: 記録/スキップ/失敗/破棄/codec フォールバックの件数をメトリクスとして集計する
 * なぜ: 監査ログはベストエフォートのため、欠落を運用で検知できるようにするため
 */
package io.skuldata.actionlog.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.skuldata.actionlog.model.ActionCategory;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ActionLogMetrics {

  static final String METRIC_RECORDED_TOTAL = "action_log.recorded.total";
  static final String METRIC_SKIPPED_TOTAL = "action_log.skipped.total";
  static final String METRIC_FAILED_TOTAL = "action_log.failed.total";
  static final String METRIC_DROPPED_TOTAL = "action_log.dropped.total";
  static final String METRIC_CODEC_FALLBACK_TOTAL = "action_log.codec.fallback.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter failedCounter;
  private final Counter droppedCounter;

  public ActionLogMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.failedCounter =
        Counter.builder(METRIC_FAILED_TOTAL)
            .description("Action log writes that failed and were discarded")
            .register(meterRegistry);
    this.droppedCounter =
        Counter.builder(METRIC_DROPPED_TOTAL)
            .description("Action log tasks rejected because the worker queue was full")
            .register(meterRegistry);
  }

  public void recordRecorded(ActionCategory category) {
    counter(
            METRIC_RECORDED_TOTAL,
            "Action log entries written",
            Tags.of("category", category.name()))
        .increment();
  }

  public void recordSkipped(String reason) {
    counter(
            METRIC_SKIPPED_TOTAL,
            "Action log entries intentionally skipped",
            Tags.of("reason", reason))
        .increment();
  }

  public void recordCodecFallback(int tier) {
    counter(
            METRIC_CODEC_FALLBACK_TOTAL,
            "Metadata encodings that needed a fallback tier",
            Tags.of("tier", Integer.toString(tier)))
        .increment();
  }

  public void recordFailed() {
    failedCounter.increment();
  }

  public void recordDropped() {
    droppedCounter.increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
