package io.skuldata.actionlog.model;

/** HTTP リクエスト由来の付帯情報。リクエスト外の記録では両方とも null。 */
public record RequestDetails(String ipAddress, String userAgent) {

  private static final RequestDetails NONE = new RequestDetails(null, null);

  public static RequestDetails none() {
    return NONE;
  }
}
