package com.university.records.repository;

import com.university.records.domain.AcademicYear;
import com.university.records.domain.DomainModels.NewSection;
import com.university.records.domain.DomainModels.Section;
import com.university.records.domain.DomainModels.SectionChanges;
import com.university.records.domain.SectionKey;
import com.university.records.domain.Semester;
import com.university.records.domain.TimeSlot;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class SectionJdbcRepository {
    private static final String COLUMNS = "course_id, sec_id, semester, academic_year, time_slot, room, capacity, enrolled";
    private static final String KEY_MATCH = "course_id = ? AND sec_id = ? AND semester = ? AND academic_year = ?";
    private static final RowMapper<Section> MAPPER = (rs, n) -> new Section(
            SectionKey.of(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4)),
            rs.getString(5) == null ? null : TimeSlot.parse(rs.getString(5)),
            rs.getString(6), rs.getInt(7), rs.getInt(8));

    private final JdbcTemplate jdbcTemplate;

    public SectionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    static Object[] keyArgs(SectionKey key) {
        return new Object[]{key.courseId(), key.sectionId(), key.semester().label(), key.year().value()};
    }

    public void insert(NewSection s) {
        SectionKey k = s.key();
        jdbcTemplate.update(
                "INSERT INTO section(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,0)",
                k.courseId(), k.sectionId(), k.semester().label(), k.year().value(),
                s.timeSlot().toString(), s.room(), s.capacity());
    }

    public int update(SectionKey key, SectionChanges changes) {
        return new ColumnUpdates()
                .set("time_slot", changes.timeSlot() == null ? null : changes.timeSlot().toString())
                .set("room", changes.room())
                .set("capacity", changes.capacity())
                .apply(jdbcTemplate, "section", KEY_MATCH, keyArgs(key));
    }

    public int delete(SectionKey key) {
        return jdbcTemplate.update("DELETE FROM section WHERE " + KEY_MATCH, keyArgs(key));
    }

    public Optional<Section> find(SectionKey key) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM section WHERE " + KEY_MATCH, MAPPER, keyArgs(key))
                .stream().findFirst();
    }

    public Optional<Section> lock(SectionKey key) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM section WHERE " + KEY_MATCH + " FOR UPDATE", MAPPER, keyArgs(key))
                .stream().findFirst();
    }

    /** Takes one seat only while one is free; returns 0 when the section is full or absent. */
    public int takeSeat(SectionKey key) {
        return jdbcTemplate.update(
                "UPDATE section SET enrolled = enrolled + 1 WHERE " + KEY_MATCH + " AND enrolled < capacity",
                keyArgs(key));
    }

    public int releaseSeat(SectionKey key) {
        return jdbcTemplate.update(
                "UPDATE section SET enrolled = enrolled - 1 WHERE " + KEY_MATCH + " AND enrolled > 0",
                keyArgs(key));
    }

    public List<Section> findAll(Semester semester, AcademicYear year) {
        List<String> conditions = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        if (semester != null) {
            conditions.add("semester = ?");
            args.add(semester.label());
        }
        if (year != null) {
            conditions.add("academic_year = ?");
            args.add(year.value());
        }
        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM section" + where + " ORDER BY academic_year, semester, course_id, sec_id",
                MAPPER, args.toArray());
    }
}
