package io.skuldata.school.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.skuldata.school.model.StudentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

/** 作成と全体更新の両方で使う。status 未指定は ACTIVE。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StudentRequest(
    @NotBlank(message = "admission_number is required") @Size(max = 50) String admissionNumber,
    @NotBlank(message = "first_name is required") @Size(max = 150) String firstName,
    @NotBlank(message = "last_name is required") @Size(max = 150) String lastName,
    LocalDate dateOfBirth,
    @Size(max = 20) String gradeLevel,
    StudentStatus status) {}
