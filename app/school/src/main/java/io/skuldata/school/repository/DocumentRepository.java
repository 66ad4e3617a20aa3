package io.skuldata.school.repository;

import io.skuldata.common.JdbcTimestampUtils;
import io.skuldata.school.model.DocumentRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class DocumentRepository {

  private static final String COLUMNS =
      "id, title, description, category, file_name, uploaded_by, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<DocumentRecord> findById(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM documents WHERE id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<DocumentRecord> findAll(int limit, long offset) {
    final String sql =
        "SELECT " + COLUMNS + " FROM documents ORDER BY id LIMIT :limit OFFSET :offset";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public DocumentRecord insert(DocumentRecord document) {
    final String sql =
        """
        INSERT INTO documents (title, description, category, file_name, uploaded_by,
                               created_at, updated_at)
        VALUES (:title, :description, :category, :fileName, :uploadedBy, :createdAt, :updatedAt)
        RETURNING
        """
            + " "
            + COLUMNS;
    return jdbcTemplate.queryForObject(sql, params(document), this::mapRow);
  }

  public Optional<DocumentRecord> update(DocumentRecord document) {
    final String sql =
        """
        UPDATE documents
        SET title = :title,
            description = :description,
            category = :category,
            file_name = :fileName,
            updated_at = :updatedAt
        WHERE id = :id
        RETURNING
        """
            + " "
            + COLUMNS;
    return jdbcTemplate.query(sql, params(document), this::mapRow).stream().findFirst();
  }

  public int deleteById(long id) {
    return jdbcTemplate.update(
        "DELETE FROM documents WHERE id = :id", new MapSqlParameterSource().addValue("id", id));
  }

  private MapSqlParameterSource params(DocumentRecord document) {
    return new MapSqlParameterSource()
        .addValue("id", document.id())
        .addValue("title", document.title())
        .addValue("description", document.description())
        .addValue("category", document.category())
        .addValue("fileName", document.fileName())
        .addValue("uploadedBy", document.uploadedById())
        .addValue("createdAt", JdbcTimestampUtils.toTimestamp(document.createdAt()))
        .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(document.updatedAt()));
  }

  private DocumentRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DocumentRecord(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("category"),
        rs.getString("file_name"),
        rs.getObject("uploaded_by", Long.class),
        JdbcTimestampUtils.readInstant(rs, "created_at"),
        JdbcTimestampUtils.readInstant(rs, "updated_at"),
        null);
  }
}
