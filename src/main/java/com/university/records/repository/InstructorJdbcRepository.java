package com.university.records.repository;

import com.university.records.domain.AcademicRank;
import com.university.records.domain.DomainModels.Instructor;
import com.university.records.domain.DomainModels.InstructorChanges;
import com.university.records.domain.DomainModels.NewInstructor;
import com.university.records.domain.DomainModels.WorkloadEntry;
import com.university.records.domain.Email;
import com.university.records.domain.AcademicYear;
import com.university.records.domain.Semester;
import com.university.records.domain.TimeSlot;
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
public class InstructorJdbcRepository {
    private static final String COLUMNS = "id, fname, lname, dept_name, academic_rank, salary, email, hire_date, office_number";
    private static final RowMapper<Instructor> MAPPER = (rs, n) -> new Instructor(
            rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
            rs.getString(5) == null ? null : AcademicRank.of(rs.getString(5)),
            rs.getBigDecimal(6), new Email(rs.getString(7)), rs.getObject(8, LocalDate.class), rs.getString(9));

    private final JdbcTemplate jdbcTemplate;

    public InstructorJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long insert(NewInstructor i) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO instructor(fname, lname, dept_name, email, academic_rank, salary, office_number, hire_date) VALUES (?,?,?,?,?,?,?,?)",
                    new String[]{"ID"});
            ps.setString(1, i.firstName());
            ps.setString(2, i.lastName());
            ps.setString(3, i.deptName());
            ps.setString(4, i.email().value());
            ps.setString(5, i.rank().label());
            ps.setBigDecimal(6, i.salary());
            ps.setString(7, i.office());
            ps.setObject(8, i.hireDate() == null ? LocalDate.now() : i.hireDate());
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "instructor id was not generated").longValue();
    }

    public int update(long id, InstructorChanges changes) {
        return new ColumnUpdates()
                .set("fname", changes.firstName())
                .set("lname", changes.lastName())
                .set("dept_name", changes.deptName())
                .set("academic_rank", changes.rank() == null ? null : changes.rank().label())
                .set("salary", changes.salary())
                .set("email", changes.email() == null ? null : changes.email().value())
                .set("hire_date", changes.hireDate())
                .set("office_number", changes.office())
                .apply(jdbcTemplate, "instructor", "id = ?", id);
    }

    public int delete(long id) {
        return jdbcTemplate.update("DELETE FROM instructor WHERE id = ?", id);
    }

    public boolean exists(long id) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM instructor WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public Optional<Instructor> find(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM instructor WHERE id = ?", MAPPER, id)
                .stream().findFirst();
    }

    public List<Instructor> findAll(String deptName) {
        if (deptName == null) {
            return jdbcTemplate.query("SELECT " + COLUMNS + " FROM instructor ORDER BY id", MAPPER);
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM instructor WHERE dept_name = ? ORDER BY id", MAPPER, deptName);
    }

    public List<WorkloadEntry> workload(long instructorId, Semester semester, AcademicYear year) {
        return jdbcTemplate.query(
                "SELECT t.course_id, t.sec_id, s.time_slot, s.room FROM teaches t " +
                        "JOIN section s ON t.course_id = s.course_id AND t.sec_id = s.sec_id " +
                        "AND t.semester = s.semester AND t.academic_year = s.academic_year " +
                        "WHERE t.instructor_id = ? AND t.semester = ? AND t.academic_year = ? ORDER BY t.course_id, t.sec_id",
                (rs, n) -> new WorkloadEntry(rs.getString(1), rs.getString(2),
                        rs.getString(3) == null ? null : TimeSlot.parse(rs.getString(3)), rs.getString(4)),
                instructorId, semester.label(), year.value());
    }
}
