package com.university.records.repository;

import com.university.records.domain.DomainModels.Course;
import com.university.records.domain.DomainModels.CourseChanges;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CourseJdbcRepository {
    private static final String COLUMNS = "course_id, title, credits, dept_name, description";
    private static final RowMapper<Course> MAPPER = (rs, n) -> new Course(
            rs.getString(1), rs.getString(2), rs.getInt(3), rs.getString(4), rs.getString(5));

    private final JdbcTemplate jdbcTemplate;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Course c) {
        jdbcTemplate.update(
                "INSERT INTO course(course_id, title, credits, dept_name, description) VALUES (?,?,?,?,?)",
                c.id(), c.title(), c.credits(), c.deptName(), c.description());
    }

    public int update(String courseId, CourseChanges changes) {
        return new ColumnUpdates()
                .set("title", changes.title())
                .set("credits", changes.credits())
                .set("dept_name", changes.deptName())
                .set("description", changes.description())
                .apply(jdbcTemplate, "course", "course_id = ?", courseId);
    }

    public int delete(String courseId) {
        return jdbcTemplate.update("DELETE FROM course WHERE course_id = ?", courseId);
    }

    public boolean exists(String courseId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM course WHERE course_id = ?", Integer.class, courseId);
        return count != null && count > 0;
    }

    public Optional<Course> find(String courseId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM course WHERE course_id = ?", MAPPER, courseId)
                .stream().findFirst();
    }

    public List<Course> findAll(String deptName) {
        if (deptName == null) {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM course ORDER BY course_id", MAPPER);
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM course WHERE dept_name = ? ORDER BY course_id", MAPPER, deptName);
    }
}
