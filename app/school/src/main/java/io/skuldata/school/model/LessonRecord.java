/*
 * どこで: School ドメインモデル
 * 何を: timetable_lessons テーブル相当のレコード
 * なぜ: 時間割の 1 コマ単位で変更履歴を残すため
 */
package io.skuldata.school.model;

import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.capability.FieldTracking;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record LessonRecord(
    Long id,
    Long timetableId,
    String subject,
    Long teacherId,
    DayOfWeek dayOfWeek,
    LocalTime startTime,
    LocalTime endTime,
    String room)
    implements AuditableEntity, FieldTracking {

  public static final String TYPE_TAG = "TimetableLesson";

  private static final List<String> TRACKED_FIELDS =
      List.of("subject", "teacher_id", "day_of_week", "start_time", "end_time", "room");

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
    return subject + " " + dayOfWeek + " " + startTime;
  }

  @Override
  public List<String> trackedFields() {
    return TRACKED_FIELDS;
  }

  @Override
  public Map<String, Object> trackedValues() {
    final Map<String, Object> values = new LinkedHashMap<>();
    values.put("subject", subject);
    values.put("teacher_id", teacherId);
    values.put("day_of_week", dayOfWeek);
    values.put("start_time", startTime);
    values.put("end_time", endTime);
    values.put("room", room);
    return values;
  }
}
