package io.skuldata.school.api;

import io.skuldata.actionlog.web.ActorContextResolver;
import io.skuldata.school.api.request.LessonRequest;
import io.skuldata.school.api.request.TimetableRequest;
import io.skuldata.school.api.response.LessonResponse;
import io.skuldata.school.api.response.TimetableResponse;
import io.skuldata.school.service.TimetableService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/timetables")
@RequiredArgsConstructor
public class TimetableController {

  private final TimetableService timetableService;
  private final ActorContextResolver actorContextResolver;

  @PostMapping
  public ResponseEntity<TimetableResponse> create(
      @Valid @RequestBody TimetableRequest request, HttpServletRequest httpRequest) {
    final TimetableResponse response =
        timetableService.createTimetable(request, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/{timetableId}")
  public TimetableResponse get(@PathVariable("timetableId") long timetableId) {
    return timetableService.getTimetable(timetableId);
  }

  @PostMapping("/{timetableId}/lessons")
  public ResponseEntity<LessonResponse> addLesson(
      @PathVariable("timetableId") long timetableId,
      @Valid @RequestBody LessonRequest request,
      HttpServletRequest httpRequest) {
    final LessonResponse response =
        timetableService.addLesson(
            timetableId, request, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PutMapping("/{timetableId}/lessons/{lessonId}")
  public LessonResponse updateLesson(
      @PathVariable("timetableId") long timetableId,
      @PathVariable("lessonId") long lessonId,
      @Valid @RequestBody LessonRequest request,
      HttpServletRequest httpRequest) {
    return timetableService.updateLesson(
        timetableId, lessonId, request, actorContextResolver.resolve(httpRequest));
  }

  @DeleteMapping("/{timetableId}/lessons/{lessonId}")
  public ResponseEntity<Void> deleteLesson(
      @PathVariable("timetableId") long timetableId,
      @PathVariable("lessonId") long lessonId,
      HttpServletRequest httpRequest) {
    timetableService.deleteLesson(
        timetableId, lessonId, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.noContent().build();
  }
}
