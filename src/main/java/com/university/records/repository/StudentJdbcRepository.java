package com.university.records.repository;

import com.university.records.domain.DomainModels.NewStudent;
import com.university.records.domain.DomainModels.Student;
import com.university.records.domain.DomainModels.StudentChanges;
import com.university.records.domain.Email;
import com.university.records.domain.StudentStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
public class StudentJdbcRepository {
    private static final String COLUMNS = "id, fname, lname, dept_name, major, tot_cred, email, enrollment_date, status";
    private static final RowMapper<Student> MAPPER = (rs, n) -> new Student(
            rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5),
            rs.getInt(6), new Email(rs.getString(7)), rs.getObject(8, LocalDate.class),
            StudentStatus.of(rs.getString(9)));

    private final JdbcTemplate jdbcTemplate;

    public StudentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long insert(NewStudent s) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO student(fname, lname, dept_name, email, tot_cred, major, enrollment_date) VALUES (?,?,?,?,?,?,?)",
                    new String[]{"ID"});
            ps.setString(1, s.firstName());
            ps.setString(2, s.lastName());
            ps.setString(3, s.deptName());
            ps.setString(4, s.email().value());
            ps.setInt(5, s.totalCredits());
            ps.setString(6, s.major());
            ps.setObject(7, s.enrollmentDate() == null ? LocalDate.now() : s.enrollmentDate());
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "student id was not generated").longValue();
    }

    public int update(long id, StudentChanges changes) {
        return new ColumnUpdates()
                .set("fname", changes.firstName())
                .set("lname", changes.lastName())
                .set("dept_name", changes.deptName())
                .set("major", changes.major())
                .set("tot_cred", changes.totalCredits())
                .set("email", changes.email() == null ? null : changes.email().value())
                .set("enrollment_date", changes.enrollmentDate())
                .set("status", changes.status() == null ? null : changes.status().label())
                .apply(jdbcTemplate, "student", "id = ?", id);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM student WHERE id = ?", id);
    }

    public boolean lock(long id) {
        return !jdbcTemplate.queryForList("SELECT id FROM student WHERE id = ? FOR UPDATE", Long.class, id).isEmpty();
    }

    public boolean exists(long id) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM student WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public Optional<Student> find(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM student WHERE id = ?", MAPPER, id)
                .stream().findFirst();
    }

    public List<Student> findAll(String deptName) {
        if (deptName == null) {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM student ORDER BY id", MAPPER);
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM student WHERE dept_name = ? ORDER BY id", MAPPER, deptName);
    }
}
