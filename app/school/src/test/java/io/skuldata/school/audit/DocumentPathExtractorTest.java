package io.skuldata.school.audit;

import static org.assertj.core.api.Assertions.assertThat;

import io.skuldata.actionlog.model.ActionTarget;
import io.skuldata.actionlog.web.PathContext;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class DocumentPathExtractorTest {

  private final DocumentPathExtractor extractor = new DocumentPathExtractor();

  @Test
  void extractsDocumentFromNestedPath() {
    final Optional<PathContext> context =
        extractor.extract("/documents/7/download", new MockHttpServletRequest());

    assertThat(context).isPresent();
    assertThat(context.get().target()).isEqualTo(new ActionTarget("Document", 7L));
    assertThat(context.get().metadata()).containsEntry("document_id", 7L);
  }

  @Test
  void ignoresCollectionAndOtherPaths() {
    assertThat(extractor.extract("/documents", new MockHttpServletRequest())).isEmpty();
    assertThat(extractor.extract("/documents/abc", new MockHttpServletRequest())).isEmpty();
    assertThat(extractor.extract("/students/7", new MockHttpServletRequest())).isEmpty();
  }

  @Test
  void idsBeyondLongRangeAreIgnoredRatherThanFailing() {
    final MockHttpServletRequest request = new MockHttpServletRequest();

    assertThat(extractor.extract("/documents/99999999999999999999/download", request)).isEmpty();
    assertThat(extractor.extract("/documents/999999999999999999", request).orElseThrow().target())
        .isEqualTo(new ActionTarget("Document", 999_999_999_999_999_999L));
  }
}
