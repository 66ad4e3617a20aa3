package io.skuldata.school.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.skuldata.school.model.DocumentRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentResponse(
    long id,
    String title,
    String description,
    String category,
    String fileName,
    Long uploadedById,
    Instant createdAt,
    Instant updatedAt) {

  public static DocumentResponse from(DocumentRecord document) {
    return new DocumentResponse(
        document.id(),
        document.title(),
        document.description(),
        document.category(),
        document.fileName(),
        document.uploadedById(),
        document.createdAt(),
        document.updatedAt());
  }
}
