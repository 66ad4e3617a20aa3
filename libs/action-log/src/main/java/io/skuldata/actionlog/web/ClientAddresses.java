package io.skuldata.actionlog.web;

import jakarta.servlet.http.HttpServletRequest;

/** プロキシ経由のリクエストから呼び出し元 IP を取り出す。 */
public final class ClientAddresses {
  private ClientAddresses() {}

  // X-Forwarded-For は "client, proxy1, proxy2" の順なので先頭だけを使う
  public static String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
