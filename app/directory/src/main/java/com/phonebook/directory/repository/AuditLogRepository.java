package com.phonebook.directory.repository;

import static com.phonebook.common.JdbcTimestampUtils.toInstant;
import static com.phonebook.common.JdbcTimestampUtils.toTimestamp;

import com.phonebook.directory.model.AuditAction;
import com.phonebook.directory.model.AuditLogRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public AuditLogRepository(
      @Qualifier("auditLogJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public AuditLogRecord insert(AuditLogRecord auditLogRecord) {
    final String sql =
        """
        INSERT INTO audit_log (created_at, action, full_name, phone_number)
        VALUES (:createdAt, :action, :fullName, :phoneNumber)
        RETURNING id, created_at, action, full_name, phone_number
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("createdAt", toTimestamp(auditLogRecord.timestamp()))
            .addValue("action", auditLogRecord.action().tag())
            .addValue("fullName", auditLogRecord.fullName())
            .addValue("phoneNumber", auditLogRecord.phoneNumber());
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public List<AuditLogRecord> findAll() {
    final String sql =
        """
        SELECT id, created_at, action, full_name, phone_number
        FROM audit_log
        ORDER BY id ASC
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private AuditLogRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditLogRecord(
        rs.getLong("id"),
        toInstant(rs.getTimestamp("created_at")),
        AuditAction.fromTag(rs.getString("action")),
        rs.getString("full_name"),
        rs.getString("phone_number"));
  }
}
