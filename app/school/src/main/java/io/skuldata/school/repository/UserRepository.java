package io.skuldata.school.repository;

import io.skuldata.school.model.UserRecord;
import io.skuldata.school.model.UserRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(long id) {
    final String sql =
        """
        SELECT id, user_tag, username, email, first_name, last_name, role
        FROM users
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** ユーザー名・メールアドレス・姓・名のいずれかに語を含むユーザーの ID を小さい順に返す。 */
  public List<Long> findIdsMatching(String term, int limit) {
    final String sql =
        """
        SELECT id
        FROM users
        WHERE LOWER(username) LIKE :term ESCAPE '\\'
           OR LOWER(email) LIKE :term ESCAPE '\\'
           OR LOWER(first_name) LIKE :term ESCAPE '\\'
           OR LOWER(last_name) LIKE :term ESCAPE '\\'
        ORDER BY id
        LIMIT :limit
        """;
    final String needle = term.trim().toLowerCase(Locale.ROOT);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("term", "%" + escapeLike(needle) + "%")
            .addValue("limit", limit);
    return jdbcTemplate.queryForList(sql, params, Long.class);
  }

  private String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getLong("id"),
        rs.getObject("user_tag", UUID.class),
        rs.getString("username"),
        rs.getString("email"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        UserRole.valueOf(rs.getString("role")));
  }
}
