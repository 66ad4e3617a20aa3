package io.skuldata.school.api;

import io.skuldata.actionlog.web.ActorContextResolver;
import io.skuldata.school.api.request.DocumentRequest;
import io.skuldata.school.api.request.DocumentShareRequest;
import io.skuldata.school.api.response.DocumentResponse;
import io.skuldata.school.service.DocumentService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
@Validated
public class DocumentController {

  private final DocumentService documentService;
  private final ActorContextResolver actorContextResolver;

  @PostMapping
  public ResponseEntity<DocumentResponse> upload(
      @Valid @RequestBody DocumentRequest request, HttpServletRequest httpRequest) {
    final DocumentResponse response =
        documentService.upload(request, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping
  public List<DocumentResponse> list(
      @RequestParam(value = "page", defaultValue = "0")
          @Min(value = 0, message = "page must be >= 0")
          int page,
      @RequestParam(value = "size", defaultValue = "50")
          @Min(value = 1, message = "size must be between 1 and 200")
          @Max(value = 200, message = "size must be between 1 and 200")
          int size) {
    return documentService.list(page, size);
  }

  @GetMapping("/{documentId}")
  public DocumentResponse get(@PathVariable("documentId") long documentId) {
    return documentService.get(documentId);
  }

  @PutMapping("/{documentId}")
  public DocumentResponse update(
      @PathVariable("documentId") long documentId,
      @Valid @RequestBody DocumentRequest request,
      HttpServletRequest httpRequest) {
    return documentService.update(documentId, request, actorContextResolver.resolve(httpRequest));
  }

  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> delete(
      @PathVariable("documentId") long documentId, HttpServletRequest httpRequest) {
    documentService.delete(documentId, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{documentId}/share")
  public ResponseEntity<Void> share(
      @PathVariable("documentId") long documentId,
      @Valid @RequestBody DocumentShareRequest request,
      HttpServletRequest httpRequest) {
    documentService.share(documentId, request, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.accepted().build();
  }

  @GetMapping("/{documentId}/download")
  public DocumentResponse download(
      @PathVariable("documentId") long documentId, HttpServletRequest httpRequest) {
    return documentService.download(documentId, actorContextResolver.resolve(httpRequest));
  }
}
