package io.skuldata.actionlog.service;

import io.skuldata.actionlog.config.ActionLogProperties;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/**
 * 同期 (テスト) モードのフラグ。
 *
 * <p>有効な間は recordAsync がその場で書き込み、インターセプタは記録しない。テストは setUp で有効化し
 * tearDown で戻すこと。並行するテスト間で共有しない。
 */
@Component
public class ActionLogMode {

  private final AtomicBoolean testMode;

  public ActionLogMode(ActionLogProperties properties) {
    this.testMode = new AtomicBoolean(properties.synchronous());
  }

  public boolean isTestMode() {
    return testMode.get();
  }

  public void setTestMode(boolean enabled) {
    testMode.set(enabled);
  }
}
