package io.skuldata.school.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.skuldata.school.model.LessonRecord;
import java.time.LocalTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LessonResponse(
    long id,
    long timetableId,
    String subject,
    Long teacherId,
    String dayOfWeek,
    LocalTime startTime,
    LocalTime endTime,
    String room) {

  public static LessonResponse from(LessonRecord lesson) {
    return new LessonResponse(
        lesson.id(),
        lesson.timetableId(),
        lesson.subject(),
        lesson.teacherId(),
        lesson.dayOfWeek().name(),
        lesson.startTime(),
        lesson.endTime(),
        lesson.room());
  }
}
