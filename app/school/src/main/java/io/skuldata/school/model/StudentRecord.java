/*
 * どこで: School ドメインモデル
 * 何を: students テーブル相当のレコード
 * なぜ: 作成/更新/削除を Entity Observer へ流し、変更されたフィールドだけを監査するため
 */
package io.skuldata.school.model;

import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record StudentRecord(
    Long id,
    String admissionNumber,
    String firstName,
    String lastName,
    LocalDate dateOfBirth,
    String gradeLevel,
    StudentStatus status,
    Instant createdAt,
    Instant updatedAt)
    implements AuditableEntity, FieldTracking {

  public static final String TYPE_TAG = "Student";

  private static final List<String> TRACKED_FIELDS =
      List.of(
          "admission_number", "first_name", "last_name", "date_of_birth", "grade_level", "status");

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
    return firstName + " " + lastName;
  }

  @Override
  public List<String> trackedFields() {
    return TRACKED_FIELDS;
  }

  @Override
  public Map<String, Object> trackedValues() {
    final Map<String, Object> values = new LinkedHashMap<>();
    values.put("admission_number", admissionNumber);
    values.put("first_name", firstName);
    values.put("last_name", lastName);
    values.put("date_of_birth", dateOfBirth);
    values.put("grade_level", gradeLevel);
    values.put("status", status);
    return values;
  }
}
