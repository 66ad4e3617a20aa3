/*
 * どこで: ActionLogQueryService のユニットテスト
 * 何を: ページング計算、アクター・対象の解決、選択肢の生成を検証する
 * なぜ: 削除済みの対象を含むログでも参照 API が失敗しないことを保証するため
 */
package io.skuldata.actionlog.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActionLogQuery;
import io.skuldata.actionlog.model.ActionLogRecord;
import io.skuldata.actionlog.repository.ActionLogRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class ActionLogQueryServiceTest {

  private static final Instant OCCURRED_AT = Instant.parse("2026-01-17T00:00:00Z");
  private static final UUID ACTOR_TAG = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

  @Mock private ActionLogRepository repository;
  @Mock private ObjectProvider<ActionTargetResolver> resolverProvider;
  @Mock private ObjectProvider<ActionActorDirectory> actorDirectoryProvider;
  @Mock private ActionActorDirectory actorDirectory;

  private ActionLogQueryService service;

  @BeforeEach
  void setUp() {
    final Map<Long, String> students = Map.of(42L, "Jane Doe");
    when(resolverProvider.orderedStream())
        .thenReturn(
            Stream.of(
                ActionTargetResolver.of("Student", id -> Optional.ofNullable(students.get(id)))));
    when(actorDirectoryProvider.getIfUnique()).thenReturn(actorDirectory);
    service =
        new ActionLogQueryService(
            repository, new ObjectMapper(), resolverProvider, actorDirectoryProvider);
  }

  @Test
  void searchResolvesExistingAndDeletedTargets() {
    final ActionLogQuery query = ActionLogQuery.all().withCategory(ActionCategory.UPDATE);
    when(repository.count(query, List.of())).thenReturn(3L);
    when(repository.search(query, List.of(), 20, 20L))
        .thenReturn(
            List.of(
                record("Student", 42L, "{\"fields_changed\":[\"last_name\"]}"),
                record("Student", 99L, "{}"),
                record("Timetable", 3L, "{}")));

    final ActionLogPage page = service.search(query, 1, 20);

    assertThat(page.total()).isEqualTo(3L);
    assertThat(page.hasNext()).isFalse();
    assertThat(page.items()).hasSize(3);
    assertThat(page.items().get(0).affectedObject()).isEqualTo("Jane Doe");
    assertThat(page.items().get(0).categoryDisplay()).isEqualTo("Update");
    assertThat(page.items().get(0).metadata().get("fields_changed").get(0).asText())
        .isEqualTo("last_name");
    assertThat(page.items().get(1).affectedObject())
        .isEqualTo(ActionLogQueryService.OBJECT_NOT_AVAILABLE);
    // 解決手段のない型は型タグと ID だけで表示する
    assertThat(page.items().get(2).affectedObject()).isEqualTo("Timetable#3");
  }

  @Test
  void entryWithoutTargetHasNoAffectedObject() {
    final UUID logId = UUID.randomUUID();
    when(repository.findById(logId))
        .thenReturn(
            Optional.of(
                new ActionLogRecord(
                    logId,
                    null,
                    ActionLogRecord.SYSTEM_ACTOR_TAG,
                    "System cleanup",
                    ActionCategory.SYSTEM,
                    null,
                    null,
                    null,
                    null,
                    "{\"system\":true}",
                    OCCURRED_AT)));

    final ActionLogView view = service.find(logId).orElseThrow();

    assertThat(view.affectedModel()).isNull();
    assertThat(view.affectedObject()).isNull();
    assertThat(view.systemAction()).isTrue();
    assertThat(view.metadata().get("system").asBoolean()).isTrue();
    assertThat(view.actorDetails()).isNull();
    verifyNoInteractions(actorDirectory);
  }

  @Test
  void keywordSearchAlsoMatchesActorsAndAttachesTheirDetails() {
    final ActionLogQuery query = ActionLogQuery.all().withSearch("  jane ");
    final ActorDetails jane =
        new ActorDetails(7L, ACTOR_TAG, "jdoe", "jane@school.local", "Jane", "Doe", "TEACHER");
    when(actorDirectory.findIdsMatching("jane")).thenReturn(List.of(7L));
    when(actorDirectory.find(7L)).thenReturn(Optional.of(jane));
    when(repository.count(query, List.of(7L))).thenReturn(2L);
    when(repository.search(query, List.of(7L), 20, 0L))
        .thenReturn(List.of(record(7L, "Student", 42L), record(7L, "Student", 99L)));

    final ActionLogPage page = service.search(query, 0, 20);

    assertThat(page.total()).isEqualTo(2L);
    assertThat(page.items()).extracting(ActionLogView::actorDetails).containsOnly(jane);
    verify(actorDirectory, times(1)).find(7L);
  }

  @Test
  void deletedActorHasNoDetailsButKeepsTag() {
    when(actorDirectory.find(1L)).thenReturn(Optional.empty());
    when(repository.count(ActionLogQuery.all(), List.of())).thenReturn(1L);
    when(repository.search(ActionLogQuery.all(), List.of(), 20, 0L))
        .thenReturn(List.of(record("Student", 42L, "{}")));

    final ActionLogView view = service.search(ActionLogQuery.all(), 0, 20).items().get(0);

    assertThat(view.actorDetails()).isNull();
    assertThat(view.actorId()).isEqualTo(1L);
    assertThat(view.actorTag()).isEqualTo(ACTOR_TAG);
  }

  @Test
  void failingDirectoryFallsBackToActionOnlySearch() {
    final ActionLogQuery query = ActionLogQuery.all().withSearch("jane");
    when(actorDirectory.findIdsMatching("jane")).thenThrow(new IllegalStateException("down"));
    when(actorDirectory.find(1L)).thenThrow(new IllegalStateException("down"));
    when(repository.count(query, List.of())).thenReturn(1L);
    when(repository.search(query, List.of(), 20, 0L))
        .thenReturn(List.of(record("Student", 42L, "{}")));

    final ActionLogPage page = service.search(query, 0, 20);

    assertThat(page.items()).hasSize(1);
    assertThat(page.items().get(0).actorDetails()).isNull();
  }

  @Test
  void withoutDirectoryKeywordSearchCoversActionsOnly() {
    when(resolverProvider.orderedStream()).thenReturn(Stream.empty());
    when(actorDirectoryProvider.getIfUnique()).thenReturn(null);
    final ActionLogQueryService withoutDirectory =
        new ActionLogQueryService(
            repository, new ObjectMapper(), resolverProvider, actorDirectoryProvider);
    final ActionLogQuery query = ActionLogQuery.all().withSearch("jane");
    when(repository.count(query, List.of())).thenReturn(1L);
    when(repository.search(query, List.of(), 20, 0L))
        .thenReturn(List.of(record("Student", 42L, "{}")));

    final ActionLogView view = withoutDirectory.search(query, 0, 20).items().get(0);

    assertThat(view.actorDetails()).isNull();
    assertThat(view.affectedObject()).isEqualTo("Student#42");
  }

  @Test
  void rejectsInvalidPaging() {
    assertThatThrownBy(() -> service.search(ActionLogQuery.all(), -1, 20))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> service.search(ActionLogQuery.all(), 0, ActionLogQueryService.MAX_PAGE_SIZE + 1))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(repository);
  }

  @Test
  void rejectsInvertedTimeRange() {
    final ActionLogQuery query =
        ActionLogQuery.all().withRange(OCCURRED_AT, OCCURRED_AT.minusSeconds(60));

    assertThatThrownBy(() -> service.search(query, 0, 20))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("from");
  }

  @Test
  void hasNextWhenMoreEntriesRemain() {
    when(repository.count(any(), any())).thenReturn(45L);
    when(repository.search(any(), any(), anyInt(), anyLong())).thenReturn(List.of());

    final ActionLogPage page = service.search(ActionLogQuery.all(), 1, 20);

    assertThat(page.hasNext()).isTrue();
    verify(repository).search(ActionLogQuery.all(), List.of(), 20, 20L);
  }

  @Test
  void optionsListAllCategoriesAndRecordedTargetTypes() {
    when(repository.findDistinctTargetTypes()).thenReturn(List.of("Document", "Student"));

    assertThat(service.categoryOptions())
        .hasSize(ActionCategory.values().length)
        .contains(new FilterOption("CREATE", "Create"), new FilterOption("OTHER", "Other"));
    assertThat(service.targetTypeOptions())
        .containsExactly(
            new FilterOption("Document", "Document"), new FilterOption("Student", "Student"));
  }

  private static ActionLogRecord record(String targetType, Long targetId, String metadataJson) {
    return record(1L, targetType, targetId, metadataJson);
  }

  private static ActionLogRecord record(long actorId, String targetType, Long targetId) {
    return record(actorId, targetType, targetId, "{}");
  }

  private static ActionLogRecord record(
      long actorId, String targetType, Long targetId, String metadataJson) {
    return new ActionLogRecord(
        UUID.randomUUID(),
        actorId,
        ACTOR_TAG,
        "Updated " + targetType,
        ActionCategory.UPDATE,
        targetType,
        targetId,
        "10.0.0.1",
        "junit",
        metadataJson,
        OCCURRED_AT);
  }
}
