package io.skuldata.actionlog.capability;

import java.util.List;
import java.util.Map;

/**
 * 更新差分の検出対象になるフィールドを公開する。
 *
 * <p>trackedValues は null 値を含み得るため、Map.of ではなく LinkedHashMap 等で返すこと。
 */
public interface FieldTracking {

  List<String> trackedFields();

  Map<String, Object> trackedValues();
}
