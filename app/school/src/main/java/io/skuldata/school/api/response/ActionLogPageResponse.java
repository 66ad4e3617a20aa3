package io.skuldata.school.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.skuldata.actionlog.query.ActionLogPage;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActionLogPageResponse(
    List<ActionLogResponse> items, int page, int size, long total, boolean hasNext) {

  public static ActionLogPageResponse from(ActionLogPage page) {
    return new ActionLogPageResponse(
        page.items().stream().map(ActionLogResponse::from).toList(),
        page.page(),
        page.size(),
        page.total(),
        page.hasNext());
  }
}
