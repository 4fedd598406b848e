package com.university.records.repository;

import com.university.records.domain.DomainModels.Advisor;
import com.university.records.domain.DomainModels.AdvisorHistoryEntry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class AdvisorJdbcRepository {
    private static final RowMapper<Advisor> MAPPER = (rs, n) -> new Advisor(
            rs.getLong(1), rs.getObject(2, Long.class), rs.getObject(3, LocalDate.class), rs.getObject(4, LocalDate.class));

    private final JdbcTemplate jdbcTemplate;

    public AdvisorJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Advisor> lock(long studentId) {
        return jdbcTemplate.query(
                "SELECT student_id, instructor_id, start_date, end_date FROM advisor WHERE student_id = ? FOR UPDATE",
                MAPPER, studentId).stream().findFirst();
    }

    public Optional<Advisor> find(long studentId) {
        return jdbcTemplate.query(
                "SELECT student_id, instructor_id, start_date, end_date FROM advisor WHERE student_id = ?",
                MAPPER, studentId).stream().findFirst();
    }

    public void upsert(long studentId, long instructorId, LocalDate startDate) {
        jdbcTemplate.update(
                "MERGE INTO advisor(student_id, instructor_id, start_date, end_date) KEY(student_id) VALUES (?,?,?,NULL)",
                studentId, instructorId, startDate);
    }

    public int update(long studentId, long instructorId, LocalDate endDate) {
        return jdbcTemplate.update(
                "UPDATE advisor SET instructor_id = ?, end_date = ? WHERE student_id = ?",
                instructorId, endDate, studentId);
    }

    public void archive(Advisor replaced, Instant replacedAt) {
        jdbcTemplate.update(
                "INSERT INTO advisor_history(student_id, instructor_id, start_date, end_date, replaced_at) VALUES (?,?,?,?,?)",
                replaced.studentId(), replaced.instructorId(), replaced.startDate(), replaced.endDate(),
                Timestamp.from(replacedAt));
    }

    public List<AdvisorHistoryEntry> loadHistory(long studentId) {
        return jdbcTemplate.query(
                "SELECT student_id, instructor_id, start_date, end_date, replaced_at FROM advisor_history " +
                        "WHERE student_id = ? ORDER BY replaced_at, id",
                (rs, n) -> new AdvisorHistoryEntry(rs.getLong(1), rs.getObject(2, Long.class),
                        rs.getObject(3, LocalDate.class), rs.getObject(4, LocalDate.class),
                        rs.getTimestamp(5).toInstant()),
                studentId);
    }
}
