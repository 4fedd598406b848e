package com.university.records.repository;

import com.university.records.domain.DomainModels.Prerequisite;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class PrerequisiteJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public PrerequisiteJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    // held until commit, so a cycle check sees every edge committed before it
    public void lockGraph() {
        jdbcTemplate.queryForObject("SELECT version FROM prereq_graph WHERE id = 1 FOR UPDATE", Long.class);
    }

    public void add(String courseId, String prerequisiteId) {
        jdbcTemplate.update("INSERT INTO prereq(course_id, prereq_id) VALUES (?,?)", courseId, prerequisiteId);
    }

    public int remove(String courseId, String prerequisiteId) {
        return jdbcTemplate.update("DELETE FROM prereq WHERE course_id = ? AND prereq_id = ?", courseId, prerequisiteId);
    }

    /** All edges of a course, including dangling ones left behind by a deleted prerequisite. */
    public List<Prerequisite> loadForCourse(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, prereq_id FROM prereq WHERE course_id = ? ORDER BY prereq_id",
                (rs, rowNum) -> new Prerequisite(rs.getString(1), rs.getString(2)),
                courseId);
    }

    public List<String> loadDirectPrerequisiteIds(String courseId) {
        return jdbcTemplate.queryForList(
                "SELECT prereq_id FROM prereq WHERE course_id = ? AND prereq_id IS NOT NULL ORDER BY prereq_id",
                String.class, courseId);
    }

    public List<Prerequisite> loadAllEdges() {
        return jdbcTemplate.query(
                "SELECT course_id, prereq_id FROM prereq WHERE prereq_id IS NOT NULL",
                (rs, rowNum) -> new Prerequisite(rs.getString(1), rs.getString(2)));
    }
}
