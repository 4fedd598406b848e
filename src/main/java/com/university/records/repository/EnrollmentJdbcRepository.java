package com.university.records.repository;

import com.university.records.domain.DomainModels.Enrollment;
import com.university.records.domain.DomainModels.TranscriptEntry;
import com.university.records.domain.EnrollmentKey;
import com.university.records.domain.Grade;
import com.university.records.domain.SectionKey;
import com.university.records.domain.Semester;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class EnrollmentJdbcRepository {
    private static final String COLUMNS = "student_id, course_id, sec_id, semester, academic_year, cancelled, grade, enrollment_date";
    private static final String KEY_MATCH = "student_id = ? AND course_id = ? AND sec_id = ? AND semester = ? AND academic_year = ?";
    private static final RowMapper<Enrollment> MAPPER = (rs, n) -> new Enrollment(
            EnrollmentKey.of(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getInt(5)),
            rs.getBoolean(6), Grade.ofNullable(rs.getString(7)), rs.getObject(8, LocalDate.class));

    private final JdbcTemplate jdbcTemplate;

    public EnrollmentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static Object[] keyArgs(EnrollmentKey key, Object... leading) {
        Object[] section = SectionJdbcRepository.keyArgs(key.section());
        Object[] args = new Object[leading.length + 1 + section.length];
        System.arraycopy(leading, 0, args, 0, leading.length);
        args[leading.length] = key.studentId();
        System.arraycopy(section, 0, args, leading.length + 1, section.length);
        return args;
    }

    public Optional<Enrollment> find(EnrollmentKey key) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM takes WHERE " + KEY_MATCH, MAPPER, keyArgs(key))
                .stream().findFirst();
    }

    public Optional<Enrollment> lock(EnrollmentKey key) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM takes WHERE " + KEY_MATCH + " FOR UPDATE", MAPPER, keyArgs(key))
                .stream().findFirst();
    }

    public void insert(EnrollmentKey key, LocalDate enrollmentDate) {
        SectionKey s = key.section();
        jdbcTemplate.update(
                "INSERT INTO takes(" + COLUMNS + ") VALUES (?,?,?,?,?,FALSE,NULL,?)",
                key.studentId(), s.courseId(), s.sectionId(), s.semester().label(), s.year().value(), enrollmentDate);
    }

    public int reactivate(EnrollmentKey key, LocalDate enrollmentDate) {
        return jdbcTemplate.update(
                "UPDATE takes SET cancelled = FALSE, grade = NULL, enrollment_date = ? WHERE " + KEY_MATCH + " AND cancelled = TRUE",
                keyArgs(key, enrollmentDate));
    }

    public int cancel(EnrollmentKey key) {
        return jdbcTemplate.update(
                "UPDATE takes SET cancelled = TRUE WHERE " + KEY_MATCH + " AND cancelled = FALSE",
                keyArgs(key));
    }

    public int updateGrade(EnrollmentKey key, Grade grade) {
        return jdbcTemplate.update(
                "UPDATE takes SET grade = ? WHERE " + KEY_MATCH + " AND cancelled = FALSE",
                keyArgs(key, grade.symbol()));
    }

    public List<EnrollmentKey> loadActiveKeys(long studentId) {
        return jdbcTemplate.query(
                "SELECT student_id, course_id, sec_id, semester, academic_year FROM takes WHERE student_id = ? AND cancelled = FALSE " +
                        "ORDER BY course_id, sec_id, semester, academic_year",
                (rs, n) -> EnrollmentKey.of(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getInt(5)),
                studentId);
    }

    public Set<String> loadPassedCourseIds(long studentId) {
        return new HashSet<>(jdbcTemplate.queryForList(
                "SELECT DISTINCT course_id FROM takes WHERE student_id = ? AND cancelled = FALSE AND grade IS NOT NULL AND grade <> 'F'",
                String.class, studentId));
    }

    public List<GradedCreditRow> loadGradedCredits(long studentId) {
        return jdbcTemplate.query(
                "SELECT c.credits, t.grade FROM takes t JOIN course c ON t.course_id = c.course_id " +
                        "WHERE t.student_id = ? AND t.cancelled = FALSE AND t.grade IS NOT NULL",
                (rs, n) -> new GradedCreditRow(rs.getInt(1), Grade.of(rs.getString(2))),
                studentId);
    }

    public List<TranscriptEntry> loadTranscript(long studentId) {
        return jdbcTemplate.query(
                "SELECT t.course_id, c.title, c.credits, t.semester, t.academic_year, t.grade, t.enrollment_date " +
                        "FROM takes t JOIN course c ON t.course_id = c.course_id " +
                        "WHERE t.student_id = ? AND t.cancelled = FALSE AND t.grade IS NOT NULL " +
                        "ORDER BY t.academic_year, t.semester, t.course_id",
                (rs, n) -> new TranscriptEntry(rs.getString(1), rs.getString(2), rs.getInt(3),
                        Semester.of(rs.getString(4)), rs.getInt(5), Grade.of(rs.getString(6)),
                        rs.getObject(7, LocalDate.class)),
                studentId);
    }

    public List<Enrollment> loadRoster(SectionKey section) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM takes WHERE course_id = ? AND sec_id = ? AND semester = ? AND academic_year = ? " +
                        "AND cancelled = FALSE ORDER BY student_id",
                MAPPER, SectionJdbcRepository.keyArgs(section));
    }

    public int countActive(SectionKey section) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM takes WHERE course_id = ? AND sec_id = ? AND semester = ? AND academic_year = ? AND cancelled = FALSE",
                Integer.class, SectionJdbcRepository.keyArgs(section));
        return count == null ? 0 : count;
    }

    public record GradedCreditRow(int credits, Grade grade) {}
}
