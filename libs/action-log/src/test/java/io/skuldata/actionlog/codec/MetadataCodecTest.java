/*
 * どこで: MetadataCodec のユニットテスト
 * 何を: 3 段階のフォールバックと型ごとの変換結果を検証する
 * なぜ: どんな metadata でも例外を出さずに JSON 安全な値を返すことを保証するため
 */
package io.skuldata.actionlog.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.service.ActionLogMetrics;
import io.skuldata.actionlog.support.TestActor;
import io.skuldata.actionlog.support.TrackedEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetadataCodecTest {

  private static final String ACTION = "Created Student";

  private SimpleMeterRegistry registry;
  private MetadataCodec codec;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    codec = new MetadataCodec(new ObjectMapper(), new ActionLogMetrics(registry));
  }

  @Test
  void convertsDecimalAndDateToJsonSafeValues() {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("amount", new BigDecimal("9.99"));
    metadata.put("when", LocalDate.of(2024, 1, 1));

    assertThat(codec.encode(metadata, ACTION))
        .containsExactly(Map.entry("amount", 9.99d), Map.entry("when", "2024-01-01"));
    assertThat(codec.encodeToJson(metadata, ACTION))
        .isEqualTo("{\"amount\":9.99,\"when\":\"2024-01-01\"}");
    assertThat(fallbackCount("2")).isZero();
  }

  @Test
  void convertsEntityLikeValuesToTypedReference() {
    final TrackedEntity student = TrackedEntity.of("Student", 42L, Map.of("name", "Jane"));

    final Map<String, Object> encoded = codec.encode(Map.of("student", student), ACTION);

    assertThat(encoded.get("student"))
        .isEqualTo(Map.of("type", "Student", "id", 42L, "display", "Student#42"));
  }

  @Test
  void convertsNestedContainersAndScalarTypes() {
    final UUID tag = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("tags", List.of("a", "b"));
    metadata.put("scores", new int[] {1, 2});
    metadata.put("nested", Map.of("at", Instant.parse("2026-01-17T00:00:00Z")));
    metadata.put("category", ActionCategory.UPDATE);
    metadata.put("maybe", Optional.empty());
    metadata.put("tag", tag);
    metadata.put("actor", TestActor.persisted(7L));

    final Map<String, Object> encoded = codec.encode(metadata, ACTION);

    assertThat(encoded.get("tags")).isEqualTo(List.of("a", "b"));
    assertThat(encoded.get("scores")).isEqualTo(List.of(1, 2));
    assertThat(encoded.get("nested")).isEqualTo(Map.of("at", "2026-01-17T00:00:00Z"));
    assertThat(encoded.get("category")).isEqualTo("UPDATE");
    assertThat(encoded).containsEntry("maybe", null);
    assertThat(encoded.get("tag")).isEqualTo(tag.toString());
    assertThat(encoded.get("actor")).isInstanceOf(Map.class);
  }

  @Test
  void emptyOrNullMetadataEncodesToEmptyObject() {
    assertThat(codec.encode(null, ACTION)).isEmpty();
    assertThat(codec.encodeToJson(Map.of(), ACTION)).isEqualTo("{}");
  }

  @Test
  void flattensOnlyTheUnconvertibleKeys() {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("ok", 1);
    metadata.put("opaque", new Opaque());

    final Map<String, Object> encoded = codec.encode(metadata, ACTION);

    assertThat(encoded).containsExactly(Map.entry("ok", 1), Map.entry("opaque", "opaque-value"));
    assertThat(fallbackCount("2")).isEqualTo(1.0d);
  }

  @Test
  void nonFiniteNumbersAreStringified() {
    final Map<String, Object> encoded = codec.encode(Map.of("ratio", Double.NaN), ACTION);

    assertThat(encoded).containsEntry("ratio", "NaN");
  }

  @Test
  void cyclicMetadataTerminates() {
    final Map<String, Object> cyclic = new HashMap<>();
    cyclic.put("self", cyclic);

    final Map<String, Object> encoded = codec.encode(Map.of("loop", cyclic), ACTION);

    assertThat(encoded.get("loop")).isInstanceOf(String.class);
    assertThat((String) encoded.get("loop")).startsWith("{self=");
  }

  @Test
  void fallsBackToErrorMarkerWhenEvenStringificationFails() {
    final Map<String, Object> metadata = Map.of("bomb", new Explosive());

    assertThatCode(() -> codec.encode(metadata, ACTION)).doesNotThrowAnyException();
    final Map<String, Object> encoded = codec.encode(metadata, ACTION);

    assertThat(encoded)
        .containsExactly(
            Map.entry("error", MetadataCodec.FAILURE_MESSAGE),
            Map.entry("original_action", ACTION));
    assertThat(codec.encodeToJson(metadata, ACTION))
        .isEqualTo(
            "{\"error\":\"metadata serialization failed\","
                + "\"original_action\":\"Created Student\"}");
    assertThat(fallbackCount("3")).isGreaterThanOrEqualTo(1.0d);
  }

  private double fallbackCount(String tier) {
    final Counter counter =
        registry.find("action_log.codec.fallback.total").tag("tier", tier).counter();
    return counter == null ? 0.0d : counter.count();
  }

  private static final class Opaque {
    @Override
    public String toString() {
      return "opaque-value";
    }
  }

  private static final class Explosive {
    @Override
    public String toString() {
      throw new IllegalStateException("cannot describe");
    }
  }
}
