package io.skuldata.school.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 文書メタ情報の登録/更新。
 *
 * @param uploadedByUserId 代理アップロード時のアップロード者。更新時は無視される
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentRequest(
    @NotBlank(message = "title is required") @Size(max = 255) String title,
    String description,
    @Size(max = 50) String category,
    @NotBlank(message = "file_name is required") @Size(max = 255) String fileName,
    Long uploadedByUserId) {}
