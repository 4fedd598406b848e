package com.university.records.repository;

import com.university.records.domain.DomainModels.Department;
import com.university.records.domain.DomainModels.DepartmentChanges;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class DepartmentJdbcRepository {
    private static final RowMapper<Department> MAPPER = (rs, n) -> new Department(
            rs.getString(1), rs.getString(2), rs.getBigDecimal(3), rs.getString(4), rs.getString(5));

    private final JdbcTemplate jdbcTemplate;

    public DepartmentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Department d) {
        jdbcTemplate.update(
                "INSERT INTO department(dept_name, phone, budget, building, dean_name) VALUES (?,?,?,?,?)",
                d.name(), d.phone(), d.budget(), d.building(), d.dean());
    }

    public int update(String name, DepartmentChanges changes) {
        return new ColumnUpdates()
                .set("phone", changes.phone())
                .set("budget", changes.budget())
                .set("building", changes.building())
                .set("dean_name", changes.dean())
                .apply(jdbcTemplate, "department", "dept_name = ?", name);
    }

    public int delete(String name) {
        return jdbcTemplate.update("DELETE FROM department WHERE dept_name = ?", name);
    }

    public boolean exists(String name) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM department WHERE dept_name = ?", Integer.class, name);
        return count != null && count > 0;
    }

    public Optional<Department> find(String name) {
        return jdbcTemplate.query(
                "SELECT dept_name, phone, budget, building, dean_name FROM department WHERE dept_name = ?",
                MAPPER, name).stream().findFirst();
    }

    public List<Department> findAll() {
        return jdbcTemplate.query(
                "SELECT dept_name, phone, budget, building, dean_name FROM department ORDER BY dept_name",
                MAPPER);
    }
}
