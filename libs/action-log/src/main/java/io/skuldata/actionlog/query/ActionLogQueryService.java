/*
 * どこで: Action log 参照サービス
 * 何を: 検索条件でのページング取得と、アクター詳細・対象・カテゴリ表示名の解決を行う
 * なぜ: 対象が削除済みでもエラーにせず「参照不可」として読めるようにするため
 */
package io.skuldata.actionlog.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActionLogQuery;
import io.skuldata.actionlog.model.ActionLogRecord;
import io.skuldata.actionlog.model.ActionTarget;
import io.skuldata.actionlog.repository.ActionLogRepository;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Spring 管理の共有コンポーネントを保持するだけで防御的コピーが不可能なため")
public class ActionLogQueryService {

  public static final String OBJECT_NOT_AVAILABLE = "object no longer available";
  public static final int MAX_PAGE_SIZE = 200;

  private static final Logger logger = LoggerFactory.getLogger(ActionLogQueryService.class);

  private final ActionLogRepository repository;
  private final ObjectMapper objectMapper;
  private final Map<String, ActionTargetResolver> resolvers;
  private final ActionActorDirectory actorDirectory;

  public ActionLogQueryService(
      ActionLogRepository repository,
      ObjectMapper objectMapper,
      ObjectProvider<ActionTargetResolver> resolverProvider,
      ObjectProvider<ActionActorDirectory> actorDirectoryProvider) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.actorDirectory = actorDirectoryProvider.getIfUnique();
    this.resolvers =
        resolverProvider
            .orderedStream()
            .collect(
                Collectors.toUnmodifiableMap(
                    ActionTargetResolver::typeTag, Function.identity(), (first, second) -> first));
  }

  public ActionLogPage search(ActionLogQuery query, int page, int size) {
    if (page < 0) {
      throw new IllegalArgumentException("page must be zero or greater");
    }
    if (size < 1 || size > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
    }
    if (query.from() != null && query.to() != null && query.from().isAfter(query.to())) {
      throw new IllegalArgumentException("from must not be after to");
    }
    final List<Long> searchActorIds = findActorIdsMatching(query.search());
    final long total = repository.count(query, searchActorIds);
    final Map<Long, Optional<ActorDetails>> actors = new HashMap<>();
    final List<ActionLogView> items =
        repository.search(query, searchActorIds, size, (long) page * size).stream()
            .map(record -> toView(record, actors))
            .toList();
    return new ActionLogPage(items, page, size, total);
  }

  public Optional<ActionLogView> find(UUID logId) {
    return repository.findById(logId).map(record -> toView(record, new HashMap<>()));
  }

  public List<FilterOption> categoryOptions() {
    return Arrays.stream(ActionCategory.values())
        .map(category -> new FilterOption(category.name(), category.label()))
        .toList();
  }

  /** 実際に記録されている対象の型タグだけを返す。 */
  public List<FilterOption> targetTypeOptions() {
    return repository.findDistinctTargetTypes().stream()
        .map(typeTag -> new FilterOption(typeTag, typeTag))
        .toList();
  }

  private List<Long> findActorIdsMatching(String search) {
    if (actorDirectory == null || search == null || search.isBlank()) {
      return List.of();
    }
    try {
      return List.copyOf(actorDirectory.findIdsMatching(search.trim()));
    } catch (RuntimeException ex) {
      logger.warn("failed to search action log actors; searching actions only", ex);
      return List.of();
    }
  }

  /** 同じページ内の同一アクターは 1 回だけ引く。 */
  private ActionLogView toView(ActionLogRecord record, Map<Long, Optional<ActorDetails>> actors) {
    final Optional<ActionTarget> target = record.target();
    final ActorDetails actorDetails =
        record.actorId() == null
            ? null
            : actors.computeIfAbsent(record.actorId(), this::findActor).orElse(null);
    return new ActionLogView(
        record.logId(),
        record.actorId(),
        record.actorTag(),
        actorDetails,
        record.action(),
        record.category(),
        record.category().label(),
        record.ipAddress(),
        record.userAgent(),
        record.targetType(),
        record.targetId(),
        target.map(this::resolveAffectedObject).orElse(null),
        readMetadata(record),
        record.occurredAt(),
        record.isSystemAction());
  }

  private Optional<ActorDetails> findActor(long actorId) {
    if (actorDirectory == null) {
      return Optional.empty();
    }
    try {
      return actorDirectory.find(actorId);
    } catch (RuntimeException ex) {
      logger.warn("failed to resolve action log actor id={}", actorId, ex);
      return Optional.empty();
    }
  }

  private String resolveAffectedObject(ActionTarget target) {
    final ActionTargetResolver resolver = resolvers.get(target.typeTag());
    if (resolver == null) {
      return target.displayName();
    }
    try {
      return resolver.resolveDisplay(target.id()).orElse(OBJECT_NOT_AVAILABLE);
    } catch (RuntimeException ex) {
      logger.warn(
          "failed to resolve action log target type={} id={}", target.typeTag(), target.id(), ex);
      return OBJECT_NOT_AVAILABLE;
    }
  }

  private JsonNode readMetadata(ActionLogRecord record) {
    try {
      return objectMapper.readTree(record.metadataJson());
    } catch (JsonProcessingException ex) {
      logger.warn("stored action log metadata is not valid JSON logId={}", record.logId(), ex);
      return objectMapper.createObjectNode();
    }
  }
}
