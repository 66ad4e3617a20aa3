/*
 * どこで: Action log サービス層
 * 何を: 監査ログの書き込み窓口 (record / recordAsync / recordSystem) を提供する
 * なぜ: 監査ログの失敗や遅延が業務処理へ波及しないよう、実行方式と例外処理をここに集約するため
 */
package io.skuldata.actionlog.service;

import static io.skuldata.actionlog.config.ActionLogExecutorConfig.ACTION_LOG_EXECUTOR;

import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.capability.AuditableEntity;
import io.skuldata.actionlog.codec.MetadataCodec;
import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActionLogRecord;
import io.skuldata.actionlog.model.ActionTarget;
import io.skuldata.actionlog.model.RequestDetails;
import io.skuldata.actionlog.repository.ActionLogRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Spring 管理の共有コンポーネントを保持するだけで防御的コピーが不可能なため")
public class ActionLogRecorder {

  static final int MAX_ACTION_LENGTH = 255;
  static final int MAX_USER_AGENT_LENGTH = 500;
  static final int MAX_IP_ADDRESS_LENGTH = 45;
  static final String SYSTEM_METADATA_KEY = "system";

  private static final Logger logger = LoggerFactory.getLogger(ActionLogRecorder.class);

  private static final TransactionDefinition PARTICIPATE =
      new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_SUPPORTS);

  private final ActionLogRepository repository;
  private final MetadataCodec codec;
  private final ActionLogMode mode;
  private final ActionLogMetrics metrics;
  private final TaskExecutor executor;
  private final PlatformTransactionManager transactionManager;
  private final TransactionTemplate requiresNewTransaction;
  private final TransactionTemplate nestedTransaction;
  private final Clock clock;

  public ActionLogRecorder(
      ActionLogRepository repository,
      MetadataCodec codec,
      ActionLogMode mode,
      ActionLogMetrics metrics,
      @Qualifier(ACTION_LOG_EXECUTOR) TaskExecutor executor,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.repository = repository;
    this.codec = codec;
    this.mode = mode;
    this.metrics = metrics;
    this.executor = executor;
    this.transactionManager = transactionManager;
    this.requiresNewTransaction = new TransactionTemplate(transactionManager);
    this.requiresNewTransaction.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.nestedTransaction = new TransactionTemplate(transactionManager);
    this.nestedTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    this.clock = clock;
  }

  public Optional<ActionLogRecord> record(
      AuditActor actor,
      String action,
      ActionCategory category,
      AuditableEntity target,
      Map<String, ?> metadata) {
    return record(actor, action, category, target, metadata, RequestDetails.none());
  }

  /**
   * 呼び出し元スレッドで書き込む。失敗しても例外は投げず空を返す。
   *
   * <p>呼び出し元のトランザクション内ではセーブポイントを切って書き込み、INSERT の失敗は
   * セーブポイントまでの巻き戻しに留める。
   */
  public Optional<ActionLogRecord> record(
      AuditActor actor,
      String action,
      ActionCategory category,
      AuditableEntity target,
      Map<String, ?> metadata,
      RequestDetails requestDetails) {
    try {
      if (insideTransaction()) {
        return nestedTransaction.execute(
            status -> write(actor, action, category, target, metadata, requestDetails));
      }
      return write(actor, action, category, target, metadata, requestDetails);
    } catch (RuntimeException ex) {
      metrics.recordFailed();
      logger.warn("action log write failed action={} category={}", action, category, ex);
      return Optional.empty();
    }
  }

  public Optional<ActionLogRecord> recordSystem(
      String action, ActionCategory category, AuditableEntity target, Map<String, ?> metadata) {
    return record(null, action, category, target, withSystemFlag(metadata));
  }

  public void recordAsync(
      AuditActor actor,
      String action,
      ActionCategory category,
      AuditableEntity target,
      Map<String, ?> metadata) {
    recordAsync(actor, action, category, target, metadata, RequestDetails.none());
  }

  /**
   * 実行方式を選んで書き込む。
   *
   * <ul>
   *   <li>テストモード: その場で書き込む
   *   <li>トランザクション外: actionLogExecutor へ投入する (満杯なら破棄)
   *   <li>トランザクション内: コミット後に別トランザクションで書き込む。ロールバック時は何もしない
   *   <li>同期が無効なトランザクション内: その場でセーブポイントを切って書き込む
   * </ul>
   */
  public void recordAsync(
      AuditActor actor,
      String action,
      ActionCategory category,
      AuditableEntity target,
      Map<String, ?> metadata,
      RequestDetails requestDetails) {
    final Map<String, Object> snapshot = snapshot(metadata);
    dispatch(action, () -> record(actor, action, category, target, snapshot, requestDetails));
  }

  public void recordSystemAsync(
      String action, ActionCategory category, AuditableEntity target, Map<String, ?> metadata) {
    final Map<String, Object> snapshot = withSystemFlag(metadata);
    dispatch(action, () -> record(null, action, category, target, snapshot));
  }

  @VisibleForTesting
  void dispatch(String action, Runnable task) {
    try {
      if (mode.isTestMode()) {
        task.run();
        return;
      }
      if (!insideTransaction()) {
        submit(action, task);
        return;
      }
      if (!TransactionSynchronizationManager.isSynchronizationActive()) {
        // コールバックを登録できない場合は同じトランザクション内 (セーブポイント) で書き込み、結果を共にする
        task.run();
        return;
      }
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              runInNewTransaction(action, task);
            }
          });
    } catch (RuntimeException ex) {
      metrics.recordFailed();
      logger.warn("action log dispatch failed action={}", action, ex);
    }
  }

  /** 同期を無効にしたトランザクションマネージャでも、進行中のトランザクションを検出する。 */
  private boolean insideTransaction() {
    if (TransactionSynchronizationManager.isActualTransactionActive()) {
      return true;
    }
    final TransactionStatus status = transactionManager.getTransaction(PARTICIPATE);
    final boolean existing = status.hasTransaction();
    // 参加しているだけなので commit は外側に影響しない。rollback は外側を rollback-only にする
    transactionManager.commit(status);
    return existing;
  }

  private void submit(String action, Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException ex) {
      metrics.recordDropped();
      logger.warn("action log dropped because the worker queue is full action={}", action);
    }
  }

  private void runInNewTransaction(String action, Runnable task) {
    // afterCommit 時点では元の接続がまだ束縛されているため、必ず新しいトランザクションで書く
    try {
      requiresNewTransaction.executeWithoutResult(status -> task.run());
    } catch (RuntimeException ex) {
      metrics.recordFailed();
      logger.warn("action log after-commit write failed action={}", action, ex);
    }
  }

  private Optional<ActionLogRecord> write(
      AuditActor actor,
      String action,
      ActionCategory category,
      AuditableEntity target,
      Map<String, ?> metadata,
      RequestDetails requestDetails) {
    Long actorId = null;
    UUID actorTag = ActionLogRecord.SYSTEM_ACTOR_TAG;
    if (actor != null) {
      final Optional<Long> identity = actor.identity();
      if (identity.isEmpty()) {
        metrics.recordSkipped("unpersisted_actor");
        logger.debug("action log skipped because actor is not persisted action={}", action);
        return Optional.empty();
      }
      actorId = identity.get();
      actorTag = actor.stableTag();
    }
    final ActionCategory resolvedCategory = category == null ? ActionCategory.OTHER : category;
    final String resolvedAction = truncate(action == null ? "" : action, MAX_ACTION_LENGTH);
    final Optional<ActionTarget> resolvedTarget = ActionTarget.of(target);
    if (target != null && resolvedTarget.isEmpty()) {
      logger.debug(
          "action log target is not persisted, recording without target type={} action={}",
          target.typeTag(),
          resolvedAction);
    }
    final RequestDetails details = requestDetails == null ? RequestDetails.none() : requestDetails;
    final String metadataJson = codec.encodeToJson(metadata, resolvedAction);
    final Instant now = Instant.now(clock);
    final ActionLogRecord record =
        new ActionLogRecord(
            UUID.randomUUID(),
            actorId,
            actorTag,
            resolvedAction,
            resolvedCategory,
            resolvedTarget.map(ActionTarget::typeTag).orElse(null),
            resolvedTarget.map(ActionTarget::id).orElse(null),
            truncate(details.ipAddress(), MAX_IP_ADDRESS_LENGTH),
            truncate(details.userAgent(), MAX_USER_AGENT_LENGTH),
            metadataJson,
            now);
    final ActionLogRecord saved = repository.create(record);
    metrics.recordRecorded(resolvedCategory);
    logger.debug(
        "action log recorded logId={} category={} targetType={} targetId={}",
        saved.logId(),
        saved.category(),
        saved.targetType(),
        saved.targetId());
    return Optional.of(saved);
  }

  private Map<String, Object> snapshot(Map<String, ?> metadata) {
    return metadata == null ? null : new LinkedHashMap<>(metadata);
  }

  private Map<String, Object> withSystemFlag(Map<String, ?> metadata) {
    final Map<String, Object> merged = new LinkedHashMap<>();
    if (metadata != null) {
      merged.putAll(metadata);
    }
    merged.put(SYSTEM_METADATA_KEY, Boolean.TRUE);
    return merged;
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
