package io.skuldata.school.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.skuldata.school.model.LessonRecord;
import io.skuldata.school.model.TimetableRecord;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimetableResponse(
    long id, String name, String gradeLevel, String term, List<LessonResponse> lessons) {

  public static TimetableResponse from(TimetableRecord timetable, List<LessonRecord> lessons) {
    return new TimetableResponse(
        timetable.id(),
        timetable.name(),
        timetable.gradeLevel(),
        timetable.term(),
        lessons.stream().map(LessonResponse::from).toList());
  }
}
