package io.skuldata.school.config;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.skuldata.actionlog.model.ActionLogQuery;
import io.skuldata.actionlog.model.ActorContext;
import io.skuldata.actionlog.query.ActionLogPage;
import io.skuldata.actionlog.query.ActionLogQueryService;
import io.skuldata.actionlog.web.ActorContextResolver;
import io.skuldata.school.api.ActionLogController;
import io.skuldata.school.api.ApiExceptionHandler;
import io.skuldata.school.api.StudentController;
import io.skuldata.school.api.request.StudentRequest;
import io.skuldata.school.api.response.StudentResponse;
import io.skuldata.school.model.UserRecord;
import io.skuldata.school.model.UserRole;
import io.skuldata.school.repository.UserRepository;
import io.skuldata.school.service.StudentService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({ActionLogController.class, StudentController.class})
@AutoConfigureMockMvc
@Import({SchoolSecurityConfig.class, ActorContextResolver.class, ApiExceptionHandler.class})
@TestPropertySource(properties = "school.auth.token=test-internal-token")
class SchoolSecurityConfigTest {

  private static final String TOKEN = "test-internal-token";
  private static final String STUDENT_BODY =
      "{\"admission_number\":\"ADM-001\",\"first_name\":\"Jane\",\"last_name\":\"Doe\"}";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private UserRepository userRepository;
  @MockitoBean private ActionLogQueryService actionLogQueryService;
  @MockitoBean private StudentService studentService;

  @Test
  void actionLogsAllowAdmin() throws Exception {
    givenUser(1L, UserRole.ADMIN);
    when(actionLogQueryService.search(any(ActionLogQuery.class), anyInt(), anyInt()))
        .thenReturn(new ActionLogPage(List.of(), 0, 50, 0L));

    mockMvc
        .perform(
            get("/action-logs").header("X-Internal-Token", TOKEN).header("X-User-Id", "1"))
        .andExpect(status().isOk());
  }

  @Test
  void actionLogsRejectTeacher() throws Exception {
    givenUser(2L, UserRole.TEACHER);

    mockMvc
        .perform(
            get("/action-logs").header("X-Internal-Token", TOKEN).header("X-User-Id", "2"))
        .andExpect(status().isForbidden());
  }

  @Test
  void rejectsWhenNoInternalToken() throws Exception {
    mockMvc.perform(get("/action-logs").header("X-User-Id", "1")).andExpect(status().isForbidden());
  }

  @Test
  void rejectsWhenInternalTokenIsInvalid() throws Exception {
    givenUser(1L, UserRole.ADMIN);

    mockMvc
        .perform(
            get("/action-logs").header("X-Internal-Token", "wrong-token").header("X-User-Id", "1"))
        .andExpect(status().isForbidden());
  }

  @Test
  void rejectsUnknownUser() throws Exception {
    when(userRepository.findById(anyLong())).thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/students/1").header("X-Internal-Token", TOKEN).header("X-User-Id", "404"))
        .andExpect(status().isForbidden());
  }

  @Test
  void staffCanReadButNotCreateStudents() throws Exception {
    givenUser(3L, UserRole.STAFF);
    when(studentService.get(1L)).thenReturn(student());

    mockMvc
        .perform(
            get("/students/1").header("X-Internal-Token", TOKEN).header("X-User-Id", "3"))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            post("/students")
                .header("X-Internal-Token", TOKEN)
                .header("X-User-Id", "3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(STUDENT_BODY))
        .andExpect(status().isForbidden());
  }

  @Test
  void teacherCanCreateStudents() throws Exception {
    givenUser(2L, UserRole.TEACHER);
    when(studentService.create(any(StudentRequest.class), any(ActorContext.class)))
        .thenReturn(student());

    mockMvc
        .perform(
            post("/students")
                .header("X-Internal-Token", TOKEN)
                .header("X-User-Id", "2")
                .contentType(MediaType.APPLICATION_JSON)
                .content(STUDENT_BODY))
        .andExpect(status().isCreated());
  }

  private void givenUser(long id, UserRole role) {
    when(userRepository.findById(id))
        .thenReturn(
            Optional.of(
                new UserRecord(
                    id,
                    UUID.randomUUID(),
                    role.name().toLowerCase(),
                    role.name().toLowerCase() + "@school.local",
                    "Test",
                    role.name(),
                    role)));
  }

  private static StudentResponse student() {
    final Instant now = Instant.parse("2026-01-17T00:00:00Z");
    return new StudentResponse(1L, "ADM-001", "Jane", "Doe", null, null, "ACTIVE", now, now);
  }
}
