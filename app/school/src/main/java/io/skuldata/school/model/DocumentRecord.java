/*
 * どこで: School ドメインモデル
 * 何を: documents テーブル相当のレコード
 * なぜ: 代理アップロード時に、リクエスト送信者ではなくアップロード者を監査ログのアクターにするため
 */
package io.skuldata.school.model;

import io.skuldata.actionlog.capability.ActorAware;
import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 文書のメタ情報。ファイル本体は保持しない。
 *
 * @param uploadedById アップロード者。ユーザー削除後は null
 * @param attachedActor 永続化されない一時的なアクター。監査ログの記録にだけ使う
 */
public record DocumentRecord(
    Long id,
    String title,
    String description,
    String category,
    String fileName,
    Long uploadedById,
    Instant createdAt,
    Instant updatedAt,
    AuditActor attachedActor)
    implements AuditableEntity, FieldTracking, ActorAware {

  public static final String TYPE_TAG = "Document";

  private static final List<String> TRACKED_FIELDS =
      List.of("title", "description", "category", "file_name");

  public DocumentRecord withActor(AuditActor actor) {
    return new DocumentRecord(
        id, title, description, category, fileName, uploadedById, createdAt, updatedAt, actor);
  }

  @Override
  public Optional<AuditActor> currentActor() {
    return Optional.ofNullable(attachedActor);
  }

  @Override
  public Optional<Long> identity() {
    return Optional.ofNullable(id);
  }

  @Override
  public String typeTag() {
    return TYPE_TAG;
  }

  @Override
  public String displayName() {
    return title;
  }

  @Override
  public List<String> trackedFields() {
    return TRACKED_FIELDS;
  }

  @Override
  public Map<String, Object> trackedValues() {
    final Map<String, Object> values = new LinkedHashMap<>();
    values.put("title", title);
    values.put("description", description);
    values.put("category", category);
    values.put("file_name", fileName);
    return values;
  }
}
