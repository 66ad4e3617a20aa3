package io.skuldata.school.model;

import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record TimetableRecord(
    Long id, String name, String gradeLevel, String term, Instant createdAt, Instant updatedAt)
    implements AuditableEntity, FieldTracking {

  public static final String TYPE_TAG = "Timetable";

  private static final List<String> TRACKED_FIELDS = List.of("name", "grade_level", "term");

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
    return name + " (" + term + ")";
  }

  @Override
  public List<String> trackedFields() {
    return TRACKED_FIELDS;
  }

  @Override
  public Map<String, Object> trackedValues() {
    final Map<String, Object> values = new LinkedHashMap<>();
    values.put("name", name);
    values.put("grade_level", gradeLevel);
    values.put("term", term);
    return values;
  }
}
