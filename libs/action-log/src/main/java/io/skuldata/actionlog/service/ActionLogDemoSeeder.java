/*
 * どこで: Action log 開発用データ投入
 * 何を: 起動時にカテゴリごとのサンプル監査ログを書き込む
 * なぜ: ローカル環境で検索 API と画面を空データのまま確認しなくて済むようにするため
 */
package io.skuldata.actionlog.service;

import io.skuldata.actionlog.model.ActionCategory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "action-log.seed", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class ActionLogDemoSeeder implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(ActionLogDemoSeeder.class);

  static final List<SampleAction> SAMPLE_ACTIONS =
      List.of(
          new SampleAction("Created Teacher: Jane Doe", ActionCategory.CREATE),
          new SampleAction("Updated Student: John Smith", ActionCategory.UPDATE),
          new SampleAction("Deleted Document: Old Report", ActionCategory.DELETE),
          new SampleAction("Viewed Analytics Dashboard", ActionCategory.VIEW),
          new SampleAction("Downloaded Report: Term 1 Results", ActionCategory.DOWNLOAD),
          new SampleAction("Uploaded Document: Syllabus 2025", ActionCategory.UPLOAD),
          new SampleAction("User Login", ActionCategory.LOGIN),
          new SampleAction("User Logout", ActionCategory.LOGOUT));

  private final ActionLogRecorder recorder;

  @Override
  public void run(ApplicationArguments args) {
    int created = 0;
    for (int i = 0; i < SAMPLE_ACTIONS.size(); i++) {
      final SampleAction sample = SAMPLE_ACTIONS.get(i);
      final Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("test_data", true);
      metadata.put("index", i);
      if (recorder.recordSystem(sample.action(), sample.category(), null, metadata).isPresent()) {
        created++;
      }
    }
    logger.info("action log seed finished created={} total={}", created, SAMPLE_ACTIONS.size());
  }

  record SampleAction(String action, ActionCategory category) {}
}
