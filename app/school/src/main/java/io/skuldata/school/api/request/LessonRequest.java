package io.skuldata.school.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.DayOfWeek;
import java.time.LocalTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LessonRequest(
    @NotBlank(message = "subject is required") @Size(max = 100) String subject,
    Long teacherId,
    @NotNull(message = "day_of_week is required") DayOfWeek dayOfWeek,
    @NotNull(message = "start_time is required") LocalTime startTime,
    @NotNull(message = "end_time is required") LocalTime endTime,
    @Size(max = 50) String room) {}
