package io.skuldata.school.repository;

import io.skuldata.common.JdbcTimestampUtils;
import io.skuldata.school.model.StudentRecord;
import io.skuldata.school.model.StudentStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class StudentRepository {

  private static final String COLUMNS =
      "id, admission_number, first_name, last_name, date_of_birth, grade_level, status,"
          + " created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<StudentRecord> findById(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM students WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<StudentRecord> findAll(int limit, long offset) {
    final String sql =
        "SELECT " + COLUMNS + " FROM students ORDER BY id LIMIT :limit OFFSET :offset";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public StudentRecord insert(StudentRecord student) {
    final String sql =
        """
        INSERT INTO students (admission_number, first_name, last_name, date_of_birth,
                              grade_level, status, created_at, updated_at)
        VALUES (:admissionNumber, :firstName, :lastName, :dateOfBirth,
                :gradeLevel, :status, :createdAt, :updatedAt)
        RETURNING
        """
            + " "
            + COLUMNS;
    return jdbcTemplate.queryForObject(sql, params(student), this::mapRow);
  }

  public Optional<StudentRecord> update(StudentRecord student) {
    final String sql =
        """
        UPDATE students
        SET admission_number = :admissionNumber,
            first_name = :firstName,
            last_name = :lastName,
            date_of_birth = :dateOfBirth,
            grade_level = :gradeLevel,
            status = :status,
            updated_at = :updatedAt
        WHERE id = :id
        RETURNING
        """
            + " "
            + COLUMNS;
    return jdbcTemplate.query(sql, params(student), this::mapRow).stream().findFirst();
  }

  public int deleteById(long id) {
    return jdbcTemplate.update(
        "DELETE FROM students WHERE id = :id", new MapSqlParameterSource().addValue("id", id));
  }

  private MapSqlParameterSource params(StudentRecord student) {
    return new MapSqlParameterSource()
        .addValue("id", student.id())
        .addValue("admissionNumber", student.admissionNumber())
        .addValue("firstName", student.firstName())
        .addValue("lastName", student.lastName())
        .addValue("dateOfBirth", student.dateOfBirth())
        .addValue("gradeLevel", student.gradeLevel())
        .addValue("status", student.status().name())
        .addValue("createdAt", JdbcTimestampUtils.toTimestamp(student.createdAt()))
        .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(student.updatedAt()));
  }

  private StudentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new StudentRecord(
        rs.getLong("id"),
        rs.getString("admission_number"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getObject("date_of_birth", LocalDate.class),
        rs.getString("grade_level"),
        StudentStatus.valueOf(rs.getString("status")),
        JdbcTimestampUtils.readInstant(rs, "created_at"),
        JdbcTimestampUtils.readInstant(rs, "updated_at"));
  }
}
