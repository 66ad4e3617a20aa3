/*
 * どこで: School サービス層
 * 何を: 文書メタ情報の管理と、共有/ダウンロード操作の監査記録を担う
 * なぜ: エンティティ変更以外の業務操作も、同じ監査ログへ明示的に残すため
 */
package io.skuldata.school.service;

import io.skuldata.actionlog.capability.AuditActor;
import io.skuldata.actionlog.event.EntityCreatedEvent;
import io.skuldata.actionlog.event.EntityDeletedEvent;
import io.skuldata.actionlog.event.EntityUpdatedEvent;
import io.skuldata.actionlog.model.ActionCategory;
import io.skuldata.actionlog.model.ActorContext;
import io.skuldata.actionlog.service.ActionLogRecorder;
import io.skuldata.school.api.ForbiddenOperationException;
import io.skuldata.school.api.ResourceNotFoundException;
import io.skuldata.school.api.request.DocumentRequest;
import io.skuldata.school.api.request.DocumentShareRequest;
import io.skuldata.school.api.response.DocumentResponse;
import io.skuldata.school.model.DocumentRecord;
import io.skuldata.school.model.UserRecord;
import io.skuldata.school.model.UserRole;
import io.skuldata.school.repository.DocumentRepository;
import io.skuldata.school.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DocumentService {

  private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

  private final DocumentRepository documentRepository;
  private final UserRepository userRepository;
  private final ActionLogRecorder actionLogRecorder;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  /**
   * 文書を登録する。uploaded_by_user_id が指定された代理アップロードでは、その利用者を
   * アップロード者として保存し、作成ログのアクターにも使う。
   */
  @Transactional
  public DocumentResponse upload(DocumentRequest request, ActorContext context) {
    final UserRecord uploader = resolveUploader(request.uploadedByUserId());
    final Long uploadedById =
        uploader != null
            ? uploader.id()
            : context.findActor().flatMap(AuditActor::identity).orElse(null);
    final Instant now = Instant.now(clock);
    final DocumentRecord saved =
        documentRepository.insert(
            new DocumentRecord(
                null,
                request.title(),
                request.description(),
                request.category(),
                request.fileName(),
                uploadedById,
                now,
                now,
                null));
    eventPublisher.publishEvent(new EntityCreatedEvent(saved.withActor(uploader), context));
    return DocumentResponse.from(saved);
  }

  @Transactional(readOnly = true)
  public DocumentResponse get(long id) {
    return DocumentResponse.from(load(id));
  }

  @Transactional(readOnly = true)
  public List<DocumentResponse> list(int page, int size) {
    return documentRepository.findAll(size, (long) page * size).stream()
        .map(DocumentResponse::from)
        .toList();
  }

  @Transactional
  public DocumentResponse update(long id, DocumentRequest request, ActorContext context) {
    final DocumentRecord before = load(id);
    requireOwnerOrAdmin(before, context);
    final DocumentRecord after =
        documentRepository
            .update(
                new DocumentRecord(
                    id,
                    request.title(),
                    request.description(),
                    request.category(),
                    request.fileName(),
                    before.uploadedById(),
                    before.createdAt(),
                    Instant.now(clock),
                    null))
            .orElseThrow(() -> ResourceNotFoundException.of(DocumentRecord.TYPE_TAG, id));
    eventPublisher.publishEvent(EntityUpdatedEvent.of(before, after, context));
    return DocumentResponse.from(after);
  }

  @Transactional
  public void delete(long id, ActorContext context) {
    final DocumentRecord document = load(id);
    requireOwnerOrAdmin(document, context);
    documentRepository.deleteById(id);
    eventPublisher.publishEvent(EntityDeletedEvent.of(document, context));
  }

  /** 共有はトランザクション内で記録し、コミット後に書き込まれる。 */
  @Transactional
  public void share(long id, DocumentShareRequest request, ActorContext context) {
    final DocumentRecord document = load(id);
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("recipients", request.recipients());
    if (request.note() != null && !request.note().isBlank()) {
      metadata.put("note", request.note());
    }
    actionLogRecorder.recordAsync(
        context.actor(),
        "Shared " + document.title(),
        ActionCategory.SHARE,
        document,
        metadata,
        context.requestDetails());
    logger.info("document shared document_id={} recipients={}", id, request.recipients().size());
  }

  /** ダウンロードはトランザクションを持たないため、その場で同期的に記録する。 */
  public DocumentResponse download(long id, ActorContext context) {
    final DocumentRecord document = load(id);
    actionLogRecorder.record(
        context.actor(),
        "Downloaded " + document.title(),
        ActionCategory.DOWNLOAD,
        document,
        Map.of("file_name", document.fileName()),
        context.requestDetails());
    return DocumentResponse.from(document);
  }

  private UserRecord resolveUploader(Long uploadedByUserId) {
    if (uploadedByUserId == null) {
      return null;
    }
    return userRepository
        .findById(uploadedByUserId)
        .orElseThrow(() -> ResourceNotFoundException.of("User", uploadedByUserId));
  }

  // 教員は自分がアップロードした文書だけを変更できる
  private void requireOwnerOrAdmin(DocumentRecord document, ActorContext context) {
    if (!(context.actor() instanceof UserRecord user)) {
      throw new ForbiddenOperationException("authenticated user is required");
    }
    if (user.role() == UserRole.ADMIN) {
      return;
    }
    if (!Objects.equals(document.uploadedById(), user.id())) {
      throw new ForbiddenOperationException(
          "only the uploader can modify document " + document.id());
    }
  }

  private DocumentRecord load(long id) {
    return documentRepository
        .findById(id)
        .orElseThrow(() -> ResourceNotFoundException.of(DocumentRecord.TYPE_TAG, id));
  }
}
