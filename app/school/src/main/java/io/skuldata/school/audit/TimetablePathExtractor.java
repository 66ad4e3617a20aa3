package io.skuldata.school.audit;

import io.skuldata.actionlog.model.ActionTarget;
import io.skuldata.actionlog.web.PathContext;
import io.skuldata.actionlog.web.RequestMetadataExtractor;
import io.skuldata.school.model.LessonRecord;
import io.skuldata.school.model.TimetableRecord;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * /timetables/{id} と /timetables/{id}/lessons/{lessonId} を解釈する。
 *
 * <p>コマ ID を含むパスではコマを、そうでなければ時間割を対象にする。
 */
@Component
@Order(20)
public class TimetablePathExtractor implements RequestMetadataExtractor {

  private static final Pattern TIMETABLE_PATH =
      Pattern.compile("^/timetables/(\\d{1,18})(?:/lessons(?:/(\\d{1,18}))?)?/?$");

  @Override
  public Optional<PathContext> extract(String path, HttpServletRequest request) {
    final Matcher matcher = TIMETABLE_PATH.matcher(path);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    final long timetableId = Long.parseLong(matcher.group(1));
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("timetable_id", timetableId);
    final String lessonGroup = matcher.group(2);
    if (lessonGroup == null) {
      return Optional.of(
          new PathContext(new ActionTarget(TimetableRecord.TYPE_TAG, timetableId), metadata));
    }
    final long lessonId = Long.parseLong(lessonGroup);
    metadata.put("lesson_id", lessonId);
    return Optional.of(
        new PathContext(new ActionTarget(LessonRecord.TYPE_TAG, lessonId), metadata));
  }
}
