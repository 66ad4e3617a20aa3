package io.skuldata.actionlog.web;

import io.skuldata.actionlog.model.ActionTarget;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * URL から読み取った対象と追加 metadata。
 *
 * @param target URL が特定の対象を指す場合のみ非 null
 */
public record PathContext(ActionTarget target, Map<String, Object> metadata) {

  public PathContext {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
