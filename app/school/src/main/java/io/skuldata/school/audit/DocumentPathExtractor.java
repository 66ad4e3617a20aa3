package io.skuldata.school.audit;

import io.skuldata.actionlog.model.ActionTarget;
import io.skuldata.actionlog.web.PathContext;
import io.skuldata.actionlog.web.RequestMetadataExtractor;
import io.skuldata.school.model.DocumentRecord;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** /documents/{id}/... へのリクエストを文書 1 件への操作として記録する。 */
@Component
@Order(10)
public class DocumentPathExtractor implements RequestMetadataExtractor {

  private static final Pattern DOCUMENT_PATH =
      Pattern.compile("^/documents/(\\d{1,18})(/.*)?$");

  @Override
  public Optional<PathContext> extract(String path, HttpServletRequest request) {
    final Matcher matcher = DOCUMENT_PATH.matcher(path);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    final long documentId = Long.parseLong(matcher.group(1));
    return Optional.of(
        new PathContext(
            new ActionTarget(DocumentRecord.TYPE_TAG, documentId),
            Map.of("document_id", documentId)));
  }
}
