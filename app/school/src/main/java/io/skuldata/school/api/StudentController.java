package io.skuldata.school.api;

import io.skuldata.actionlog.web.ActorContextResolver;
import io.skuldata.school.api.request.StudentRequest;
import io.skuldata.school.api.response.StudentResponse;
import io.skuldata.school.service.StudentService;
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
@RequestMapping("/students")
@RequiredArgsConstructor
@Validated
public class StudentController {

  private final StudentService studentService;
  private final ActorContextResolver actorContextResolver;

  @PostMapping
  public ResponseEntity<StudentResponse> create(
      @Valid @RequestBody StudentRequest request, HttpServletRequest httpRequest) {
    final StudentResponse response =
        studentService.create(request, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping
  public List<StudentResponse> list(
      @RequestParam(value = "page", defaultValue = "0")
          @Min(value = 0, message = "page must be >= 0")
          int page,
      @RequestParam(value = "size", defaultValue = "50")
          @Min(value = 1, message = "size must be between 1 and 200")
          @Max(value = 200, message = "size must be between 1 and 200")
          int size) {
    return studentService.list(page, size);
  }

  @GetMapping("/{studentId}")
  public StudentResponse get(@PathVariable("studentId") long studentId) {
    return studentService.get(studentId);
  }

  @PutMapping("/{studentId}")
  public StudentResponse update(
      @PathVariable("studentId") long studentId,
      @Valid @RequestBody StudentRequest request,
      HttpServletRequest httpRequest) {
    return studentService.update(studentId, request, actorContextResolver.resolve(httpRequest));
  }

  @DeleteMapping("/{studentId}")
  public ResponseEntity<Void> delete(
      @PathVariable("studentId") long studentId, HttpServletRequest httpRequest) {
    studentService.delete(studentId, actorContextResolver.resolve(httpRequest));
    return ResponseEntity.noContent().build();
  }
}
