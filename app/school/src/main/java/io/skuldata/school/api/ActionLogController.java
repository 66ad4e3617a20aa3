/*
 * どこで: School API (監査ログ参照)
 * 何を: action_logs の検索/詳細/フィルタ選択肢を提供する
 * なぜ: 管理者が「誰が・いつ・何を」したかを画面から追跡できるようにするため
 */
package io.skuldata.school.api;

import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActionLogQuery;
import io.skuldata.actionlog.query.ActionLogQueryService;
import io.skuldata.actionlog.query.FilterOption;
import io.skuldata.school.api.response.ActionLogPageResponse;
import io.skuldata.school.api.response.ActionLogResponse;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/action-logs")
@RequiredArgsConstructor
public class ActionLogController {

  private static final String ORDER_OLDEST_FIRST = "timestamp";
  private static final String ORDER_NEWEST_FIRST = "-timestamp";

  private final ActionLogQueryService queryService;

  @GetMapping
  public ActionLogPageResponse search(
      @RequestParam(value = "category", required = false) ActionCategory category,
      @RequestParam(value = "target_type", required = false) String targetType,
      @RequestParam(value = "target_id", required = false) Long targetId,
      @RequestParam(value = "actor_tag", required = false) UUID actorTag,
      @RequestParam(value = "actor_id", required = false) Long actorId,
      @RequestParam(value = "from", required = false) Instant from,
      @RequestParam(value = "to", required = false) Instant to,
      @RequestParam(value = "search", required = false) String search,
      @RequestParam(value = "ordering", defaultValue = ORDER_NEWEST_FIRST) String ordering,
      @RequestParam(value = "page", defaultValue = "0") int page,
      @RequestParam(value = "size", defaultValue = "50") int size) {
    final ActionLogQuery query =
        new ActionLogQuery(
            category,
            blankToNull(targetType),
            targetId,
            actorTag,
            actorId,
            from,
            to,
            blankToNull(search),
            isOldestFirst(ordering));
    return ActionLogPageResponse.from(queryService.search(query, page, size));
  }

  @GetMapping("/{logId}")
  public ActionLogResponse get(@PathVariable("logId") UUID logId) {
    return queryService
        .find(logId)
        .map(ActionLogResponse::from)
        .orElseThrow(() -> ResourceNotFoundException.of("ActionLog", logId));
  }

  @GetMapping("/category-options")
  public List<FilterOption> categoryOptions() {
    return queryService.categoryOptions();
  }

  @GetMapping("/model-options")
  public List<FilterOption> modelOptions() {
    return queryService.targetTypeOptions();
  }

  private static boolean isOldestFirst(String ordering) {
    if (ORDER_OLDEST_FIRST.equals(ordering)) {
      return true;
    }
    if (ORDER_NEWEST_FIRST.equals(ordering)) {
      return false;
    }
    throw new IllegalArgumentException("ordering must be timestamp or -timestamp");
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
