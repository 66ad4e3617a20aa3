package io.skuldata.common;

import java.util.UUID;

public final class RequestIds {
  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** ヘッダー値が空の場合だけ新しい ID を採番する。 */
  public static String resolve(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return newRequestId();
    }
    return headerValue.trim();
  }
}
