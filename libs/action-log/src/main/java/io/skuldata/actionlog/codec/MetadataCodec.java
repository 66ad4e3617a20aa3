/*
 * どこで: Action log の metadata codec
 * 何を: 任意の値ツリーを JSON 安全な Map/JSON 文字列へ変換する
 * なぜ: metadata が直列化できなくても監査ログの書き込み自体は必ず継続させるため
 */
package io.skuldata.actionlog.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.service.ActionLogMetrics;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Period;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MetadataCodec {

  static final String FAILURE_MESSAGE = "metadata serialization failed";
  static final int MAX_DEPTH = 32;
  private static final int DESCRIBE_DEPTH = 4;
  private static final String FAILURE_JSON = "{\"error\":\"" + FAILURE_MESSAGE + "\"}";

  private static final Logger logger = LoggerFactory.getLogger(MetadataCodec.class);

  private final ObjectMapper objectMapper;
  private final ActionLogMetrics metrics;

  public Map<String, Object> encode(Map<String, ?> metadata, String action) {
    return encodeInternal(metadata, action).values();
  }

  public String encodeToJson(Map<String, ?> metadata, String action) {
    return encodeInternal(metadata, action).json();
  }

  private Encoded encodeInternal(Map<String, ?> metadata, String action) {
    try {
      if (metadata == null || metadata.isEmpty()) {
        return new Encoded(new LinkedHashMap<>(), "{}");
      }
      return encodeWithFallback(metadata, action);
    } catch (RuntimeException ex) {
      logger.warn("metadata encoding aborted, storing error marker action={}", action, ex);
      return failure(action);
    }
  }

  private Encoded encodeWithFallback(Map<String, ?> metadata, String action) {
    try {
      final Map<String, Object> structural = convertMap(metadata, 0);
      return new Encoded(structural, write(structural));
    } catch (RuntimeException ex) {
      logger.debug("metadata structural conversion failed, flattening action={}", action, ex);
    }
    metrics.recordCodecFallback(2);
    try {
      final Map<String, Object> flattened = flatten(metadata);
      return new Encoded(flattened, write(flattened));
    } catch (RuntimeException ex) {
      logger.warn("metadata flattening failed, storing error marker action={}", action, ex);
    }
    return failure(action);
  }

  private Encoded failure(String action) {
    metrics.recordCodecFallback(3);
    final Map<String, Object> values = new LinkedHashMap<>();
    values.put("error", FAILURE_MESSAGE);
    values.put("original_action", action);
    try {
      return new Encoded(values, objectMapper.writeValueAsString(values));
    } catch (JsonProcessingException ex) {
      logger.warn("failed to serialize metadata error marker action={}", action, ex);
      return new Encoded(values, FAILURE_JSON);
    }
  }

  // Tier 2: トップレベルのキーごとに変換し、変換できない値だけを文字列化する
  private Map<String, Object> flatten(Map<String, ?> metadata) {
    final Map<String, Object> flattened = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : metadata.entrySet()) {
      final String key = String.valueOf(entry.getKey());
      final Object value = entry.getValue();
      try {
        flattened.put(key, convert(value, 1));
      } catch (RuntimeException ex) {
        flattened.put(key, describe(value, 0));
      }
    }
    return flattened;
  }

  private String write(Map<String, Object> values) {
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException ex) {
      throw new MetadataConversionException("metadata is not JSON serializable", ex);
    }
  }

  private Map<String, Object> convertMap(Map<?, ?> source, int depth) {
    final Map<String, Object> converted = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      converted.put(String.valueOf(entry.getKey()), convert(entry.getValue(), depth + 1));
    }
    return converted;
  }

  // Tier 1: 構造を保ったまま JSON で表現できる型へ寄せる
  private Object convert(Object value, int depth) {
    if (depth > MAX_DEPTH) {
      throw new MetadataConversionException("metadata is nested too deeply");
    }
    if (value == null || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Number number) {
      return convertNumber(number);
    }
    if (value instanceof Character || value instanceof UUID || value instanceof URI) {
      return value.toString();
    }
    if (value instanceof Enum<?> enumValue) {
      return enumValue.name();
    }
    if (value instanceof TemporalAccessor
        || value instanceof Duration
        || value instanceof Period) {
      // java.time の toString は ISO-8601 表記
      return value.toString();
    }
    if (value instanceof Date date) {
      return date.toInstant().toString();
    }
    if (value instanceof Optional<?> optional) {
      return convert(optional.orElse(null), depth + 1);
    }
    if (value instanceof AuditableEntity entity) {
      return convertEntity(entity);
    }
    if (value instanceof AuditActor actor) {
      return convertActor(actor);
    }
    if (value instanceof JsonNode node) {
      return objectMapper.convertValue(node, Object.class);
    }
    if (value instanceof Map<?, ?> map) {
      return convertMap(map, depth);
    }
    if (value instanceof Collection<?> collection) {
      final List<Object> items = new ArrayList<>(collection.size());
      for (Object item : collection) {
        items.add(convert(item, depth + 1));
      }
      return items;
    }
    if (value.getClass().isArray()) {
      final int length = Array.getLength(value);
      final List<Object> items = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        items.add(convert(Array.get(value, i), depth + 1));
      }
      return items;
    }
    throw new MetadataConversionException(
        "unsupported metadata value type: " + value.getClass().getName());
  }

  private Object convertNumber(Number number) {
    if (number instanceof BigDecimal decimal) {
      return finite(decimal.doubleValue());
    }
    if (number instanceof Integer
        || number instanceof Long
        || number instanceof Short
        || number instanceof Byte
        || number instanceof BigInteger) {
      return number;
    }
    return finite(number.doubleValue());
  }

  private double finite(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new MetadataConversionException("non-finite number is not JSON safe");
    }
    return value;
  }

  private Map<String, Object> convertEntity(AuditableEntity entity) {
    final Map<String, Object> converted = new LinkedHashMap<>();
    converted.put("type", entity.typeTag());
    converted.put("id", entity.identity().orElse(null));
    converted.put("display", entity.displayName());
    return converted;
  }

  private Map<String, Object> convertActor(AuditActor actor) {
    final Map<String, Object> converted = new LinkedHashMap<>();
    converted.put("id", actor.identity().orElse(null));
    converted.put("tag", String.valueOf(actor.stableTag()));
    converted.put("display", actor.displayName());
    return converted;
  }

  // 循環参照でも停止するよう、コンテナは深さを制限して文字列化する
  private String describe(Object value, int depth) {
    if (depth > DESCRIBE_DEPTH) {
      return "...";
    }
    if (value instanceof Map<?, ?> map) {
      final StringBuilder builder = new StringBuilder("{");
      final Iterator<? extends Map.Entry<?, ?>> iterator = map.entrySet().iterator();
      while (iterator.hasNext()) {
        final Map.Entry<?, ?> entry = iterator.next();
        builder
            .append(describe(entry.getKey(), depth + 1))
            .append('=')
            .append(describe(entry.getValue(), depth + 1));
        if (iterator.hasNext()) {
          builder.append(", ");
        }
      }
      return builder.append('}').toString();
    }
    if (value instanceof Collection<?> collection) {
      final List<String> items = new ArrayList<>(collection.size());
      for (Object item : collection) {
        items.add(describe(item, depth + 1));
      }
      return items.toString();
    }
    if (value != null && value.getClass().isArray()) {
      final List<String> items = new ArrayList<>();
      for (int i = 0; i < Array.getLength(value); i++) {
        items.add(describe(Array.get(value, i), depth + 1));
      }
      return items.toString();
    }
    return String.valueOf(value);
  }

  private record Encoded(Map<String, Object> values, String json) {}
}
