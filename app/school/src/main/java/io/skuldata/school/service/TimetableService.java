package io.skuldata.school.service;

import io.skuldata.actionlog.event.EntityCreatedEvent;
import io.skuldata.actionlog.event.EntityDeletedEvent;
import io.skuldata.actionlog.event.EntityUpdatedEvent;
import io.skuldata.actionlog.model.ActorContext;
import io.skuldata.school.api.ResourceNotFoundException;
import io.skuldata.school.api.request.LessonRequest;
import io.skuldata.school.api.request.TimetableRequest;
import io.skuldata.school.api.response.LessonResponse;
import io.skuldata.school.api.response.TimetableResponse;
import io.skuldata.school.model.LessonRecord;
import io.skuldata.school.model.TimetableRecord;
import io.skuldata.school.repository.TimetableRepository;
import io.skuldata.school.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class TimetableService {

  private final TimetableRepository timetableRepository;
  private final UserRepository userRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  @Transactional
  public TimetableResponse createTimetable(TimetableRequest request, ActorContext context) {
    final Instant now = Instant.now(clock);
    final TimetableRecord saved =
        timetableRepository.insertTimetable(
            new TimetableRecord(
                null, request.name(), request.gradeLevel(), request.term(), now, now));
    eventPublisher.publishEvent(new EntityCreatedEvent(saved, context));
    return TimetableResponse.from(saved, List.of());
  }

  @Transactional(readOnly = true)
  public TimetableResponse getTimetable(long timetableId) {
    final TimetableRecord timetable = loadTimetable(timetableId);
    return TimetableResponse.from(timetable, timetableRepository.findLessons(timetableId));
  }

  @Transactional
  public LessonResponse addLesson(long timetableId, LessonRequest request, ActorContext context) {
    loadTimetable(timetableId);
    validate(request);
    final LessonRecord saved =
        timetableRepository.insertLesson(toLesson(null, timetableId, request));
    eventPublisher.publishEvent(new EntityCreatedEvent(saved, context));
    return LessonResponse.from(saved);
  }

  @Transactional
  public LessonResponse updateLesson(
      long timetableId, long lessonId, LessonRequest request, ActorContext context) {
    final LessonRecord before = loadLesson(timetableId, lessonId);
    validate(request);
    final LessonRecord after =
        timetableRepository
            .updateLesson(toLesson(lessonId, timetableId, request))
            .orElseThrow(() -> ResourceNotFoundException.of(LessonRecord.TYPE_TAG, lessonId));
    eventPublisher.publishEvent(EntityUpdatedEvent.of(before, after, context));
    return LessonResponse.from(after);
  }

  @Transactional
  public void deleteLesson(long timetableId, long lessonId, ActorContext context) {
    final LessonRecord lesson = loadLesson(timetableId, lessonId);
    timetableRepository.deleteLesson(timetableId, lessonId);
    eventPublisher.publishEvent(EntityDeletedEvent.of(lesson, context));
  }

  private void validate(LessonRequest request) {
    if (!request.startTime().isBefore(request.endTime())) {
      throw new IllegalArgumentException("start_time must be before end_time");
    }
    if (request.teacherId() != null && userRepository.findById(request.teacherId()).isEmpty()) {
      throw ResourceNotFoundException.of("User", request.teacherId());
    }
  }

  private static LessonRecord toLesson(Long lessonId, long timetableId, LessonRequest request) {
    return new LessonRecord(
        lessonId,
        timetableId,
        request.subject(),
        request.teacherId(),
        request.dayOfWeek(),
        request.startTime(),
        request.endTime(),
        request.room());
  }

  private TimetableRecord loadTimetable(long timetableId) {
    return timetableRepository
        .findTimetable(timetableId)
        .orElseThrow(() -> ResourceNotFoundException.of(TimetableRecord.TYPE_TAG, timetableId));
  }

  private LessonRecord loadLesson(long timetableId, long lessonId) {
    return timetableRepository
        .findLesson(timetableId, lessonId)
        .orElseThrow(() -> ResourceNotFoundException.of(LessonRecord.TYPE_TAG, lessonId));
  }
}
