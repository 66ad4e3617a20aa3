package io.skuldata.school.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimetableRequest(
    @NotBlank(message = "name is required") @Size(max = 150) String name,
    @Size(max = 20) String gradeLevel,
    @NotBlank(message = "term is required") @Size(max = 50) String term) {}
