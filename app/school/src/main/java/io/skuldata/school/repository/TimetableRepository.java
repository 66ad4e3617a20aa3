package io.skuldata.school.repository;

import io.skuldata.common.JdbcTimestampUtils;
import io.skuldata.school.model.LessonRecord;
import io.skuldata.school.model.TimetableRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class TimetableRepository {

  private static final String TIMETABLE_COLUMNS =
      "id, name, grade_level, term, created_at, updated_at";
  private static final String LESSON_COLUMNS =
      "id, timetable_id, subject, teacher_id, day_of_week, start_time, end_time, room";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<TimetableRecord> findTimetable(long id) {
    final String sql = "SELECT " + TIMETABLE_COLUMNS + " FROM timetables WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapTimetable)
        .stream()
        .findFirst();
  }

  public TimetableRecord insertTimetable(TimetableRecord timetable) {
    final String sql =
        """
        INSERT INTO timetables (name, grade_level, term, created_at, updated_at)
        VALUES (:name, :gradeLevel, :term, :createdAt, :updatedAt)
        RETURNING
        """
            + " "
            + TIMETABLE_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", timetable.name())
            .addValue("gradeLevel", timetable.gradeLevel())
            .addValue("term", timetable.term())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(timetable.createdAt()))
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(timetable.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapTimetable);
  }

  public Optional<LessonRecord> findLesson(long timetableId, long lessonId) {
    final String sql =
        "SELECT "
            + LESSON_COLUMNS
            + " FROM timetable_lessons WHERE id = :id AND timetable_id = :timetableId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", lessonId).addValue("timetableId", timetableId);
    return jdbcTemplate.query(sql, params, this::mapLesson).stream().findFirst();
  }

  public Optional<LessonRecord> findLessonById(long lessonId) {
    final String sql = "SELECT " + LESSON_COLUMNS + " FROM timetable_lessons WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", lessonId), this::mapLesson)
        .stream()
        .findFirst();
  }

  public List<LessonRecord> findLessons(long timetableId) {
    final String sql =
        "SELECT "
            + LESSON_COLUMNS
            + " FROM timetable_lessons WHERE timetable_id = :timetableId"
            + " ORDER BY day_of_week, start_time, id";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("timetableId", timetableId), this::mapLesson);
  }

  public LessonRecord insertLesson(LessonRecord lesson) {
    final String sql =
        """
        INSERT INTO timetable_lessons (timetable_id, subject, teacher_id, day_of_week,
                                       start_time, end_time, room)
        VALUES (:timetableId, :subject, :teacherId, :dayOfWeek, :startTime, :endTime, :room)
        RETURNING
        """
            + " "
            + LESSON_COLUMNS;
    return jdbcTemplate.queryForObject(sql, lessonParams(lesson), this::mapLesson);
  }

  public Optional<LessonRecord> updateLesson(LessonRecord lesson) {
    final String sql =
        """
        UPDATE timetable_lessons
        SET subject = :subject,
            teacher_id = :teacherId,
            day_of_week = :dayOfWeek,
            start_time = :startTime,
            end_time = :endTime,
            room = :room
        WHERE id = :id AND timetable_id = :timetableId
        RETURNING
        """
            + " "
            + LESSON_COLUMNS;
    return jdbcTemplate.query(sql, lessonParams(lesson), this::mapLesson).stream().findFirst();
  }

  public int deleteLesson(long timetableId, long lessonId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", lessonId).addValue("timetableId", timetableId);
    return jdbcTemplate.update(
        "DELETE FROM timetable_lessons WHERE id = :id AND timetable_id = :timetableId", params);
  }

  private MapSqlParameterSource lessonParams(LessonRecord lesson) {
    return new MapSqlParameterSource()
        .addValue("id", lesson.id())
        .addValue("timetableId", lesson.timetableId())
        .addValue("subject", lesson.subject())
        .addValue("teacherId", lesson.teacherId())
        .addValue("dayOfWeek", lesson.dayOfWeek().getValue())
        .addValue("startTime", lesson.startTime())
        .addValue("endTime", lesson.endTime())
        .addValue("room", lesson.room());
  }

  private TimetableRecord mapTimetable(ResultSet rs, int rowNum) throws SQLException {
    return new TimetableRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("grade_level"),
        rs.getString("term"),
        JdbcTimestampUtils.readInstant(rs, "created_at"),
        JdbcTimestampUtils.readInstant(rs, "updated_at"));
  }

  private LessonRecord mapLesson(ResultSet rs, int rowNum) throws SQLException {
    return new LessonRecord(
        rs.getLong("id"),
        rs.getLong("timetable_id"),
        rs.getString("subject"),
        rs.getObject("teacher_id", Long.class),
        DayOfWeek.of(rs.getInt("day_of_week")),
        rs.getObject("start_time", LocalTime.class),
        rs.getObject("end_time", LocalTime.class),
        rs.getString("room"));
  }
}
