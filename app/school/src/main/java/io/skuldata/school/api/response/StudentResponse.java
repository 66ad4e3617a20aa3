package io.skuldata.school.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.skuldata.school.model.StudentRecord;
import java.time.Instant;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StudentResponse(
    long id,
    String admissionNumber,
    String firstName,
    String lastName,
    LocalDate dateOfBirth,
    String gradeLevel,
    String status,
    Instant createdAt,
    Instant updatedAt) {

  public static StudentResponse from(StudentRecord student) {
    return new StudentResponse(
        student.id(),
        student.admissionNumber(),
        student.firstName(),
        student.lastName(),
        student.dateOfBirth(),
        student.gradeLevel(),
        student.status().name(),
        student.createdAt(),
        student.updatedAt());
  }
}
