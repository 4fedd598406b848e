package com.university.records.repository;

import com.university.records.domain.DomainModels.Teaching;
import com.university.records.domain.SectionKey;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class TeachingJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public TeachingJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsert(long instructorId, SectionKey s) {
        jdbcTemplate.update(
                "MERGE INTO teaches(instructor_id, course_id, sec_id, semester, academic_year) " +
                        "KEY(instructor_id, course_id, sec_id, semester, academic_year) VALUES (?,?,?,?,?)",
                instructorId, s.courseId(), s.sectionId(), s.semester().label(), s.year().value());
    }

    public int delete(long instructorId, SectionKey s) {
        return jdbcTemplate.update(
                "DELETE FROM teaches WHERE instructor_id = ? AND course_id = ? AND sec_id = ? AND semester = ? AND academic_year = ?",
                instructorId, s.courseId(), s.sectionId(), s.semester().label(), s.year().value());
    }

    public List<Teaching> loadForSection(SectionKey s) {
        return jdbcTemplate.query(
                "SELECT instructor_id FROM teaches WHERE course_id = ? AND sec_id = ? AND semester = ? AND academic_year = ? ORDER BY instructor_id",
                (rs, n) -> new Teaching(rs.getLong(1), s),
                SectionJdbcRepository.keyArgs(s));
    }
}
