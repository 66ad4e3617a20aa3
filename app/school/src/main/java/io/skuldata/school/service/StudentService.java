/*
 * どこで: School サービス層
 * 何を: 生徒情報の登録/参照/更新/削除と、変更イベントの発行を担う
 * なぜ: 監査ログを業務トランザクションの結果 (コミット) に連動させるため
 */
package io.skuldata.school.service;

import io.skuldata.actionlog.event.EntityCreatedEvent;
import io.skuldata.actionlog.event.EntityDeletedEvent;
import io.skuldata.actionlog.event.EntityUpdatedEvent;
import io.skuldata.actionlog.model.ActorContext;
import io.skuldata.school.api.ResourceNotFoundException;
import io.skuldata.school.api.request.StudentRequest;
import io.skuldata.school.api.response.StudentResponse;
import io.skuldata.school.model.StudentRecord;
import io.skuldata.school.model.StudentStatus;
import io.skuldata.school.repository.StudentRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class StudentService {

  private final StudentRepository studentRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  @Transactional
  public StudentResponse create(StudentRequest request, ActorContext context) {
    final Instant now = Instant.now(clock);
    final StudentRecord saved =
        studentRepository.insert(
            new StudentRecord(
                null,
                request.admissionNumber(),
                request.firstName(),
                request.lastName(),
                request.dateOfBirth(),
                request.gradeLevel(),
                statusOrDefault(request.status()),
                now,
                now));
    eventPublisher.publishEvent(new EntityCreatedEvent(saved, context));
    return StudentResponse.from(saved);
  }

  @Transactional(readOnly = true)
  public StudentResponse get(long id) {
    return StudentResponse.from(load(id));
  }

  @Transactional(readOnly = true)
  public List<StudentResponse> list(int page, int size) {
    return studentRepository.findAll(size, (long) page * size).stream()
        .map(StudentResponse::from)
        .toList();
  }

  @Transactional
  public StudentResponse update(long id, StudentRequest request, ActorContext context) {
    final StudentRecord before = load(id);
    final StudentRecord after =
        studentRepository
            .update(
                new StudentRecord(
                    id,
                    request.admissionNumber(),
                    request.firstName(),
                    request.lastName(),
                    request.dateOfBirth(),
                    request.gradeLevel(),
                    statusOrDefault(request.status()),
                    before.createdAt(),
                    Instant.now(clock)))
            .orElseThrow(() -> ResourceNotFoundException.of(StudentRecord.TYPE_TAG, id));
    eventPublisher.publishEvent(EntityUpdatedEvent.of(before, after, context));
    return StudentResponse.from(after);
  }

  @Transactional
  public void delete(long id, ActorContext context) {
    final StudentRecord student = load(id);
    studentRepository.deleteById(id);
    eventPublisher.publishEvent(EntityDeletedEvent.of(student, context));
  }

  private StudentRecord load(long id) {
    return studentRepository
        .findById(id)
        .orElseThrow(() -> ResourceNotFoundException.of(StudentRecord.TYPE_TAG, id));
  }

  private static StudentStatus statusOrDefault(StudentStatus status) {
    return status == null ? StudentStatus.ACTIVE : status;
  }
}
