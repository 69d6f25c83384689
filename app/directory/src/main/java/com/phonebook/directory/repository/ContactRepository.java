package com.phonebook.directory.repository;

import com.phonebook.directory.model.ContactRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
public class ContactRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ContactRepository(
      @Qualifier("phonebookJdbcTemplate") NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public List<ContactRecord> findAll() {
    final String sql =
        """
        SELECT id, full_name, phone_number
        FROM phonebook
        ORDER BY id ASC
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<ContactRecord> findByFullName(String fullName) {
    final String sql =
        """
        SELECT id, full_name, phone_number
        FROM phonebook
        WHERE full_name = :fullName
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("fullName", fullName);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ContactRecord> findByPhoneNumber(String phoneNumber) {
    final String sql =
        """
        SELECT id, full_name, phone_number
        FROM phonebook
        WHERE phone_number = :phoneNumber
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("phoneNumber", phoneNumber);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Inserts a contact. Both columns carry unique constraints, so a concurrent insert of the same
   * name or number surfaces as {@link org.springframework.dao.DuplicateKeyException}.
   */
  public ContactRecord insert(String fullName, String phoneNumber) {
    final String sql =
        """
        INSERT INTO phonebook (full_name, phone_number)
        VALUES (:fullName, :phoneNumber)
        RETURNING id, full_name, phone_number
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("fullName", fullName)
            .addValue("phoneNumber", phoneNumber);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<ContactRecord> deleteByFullName(String fullName) {
    final String sql =
        """
        DELETE FROM phonebook
        WHERE full_name = :fullName
        RETURNING id, full_name, phone_number
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("fullName", fullName);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ContactRecord> deleteByPhoneNumber(String phoneNumber) {
    final String sql =
        """
        DELETE FROM phonebook
        WHERE phone_number = :phoneNumber
        RETURNING id, full_name, phone_number
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("phoneNumber", phoneNumber);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private ContactRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ContactRecord(
        rs.getLong("id"), rs.getString("full_name"), rs.getString("phone_number"));
  }
}
