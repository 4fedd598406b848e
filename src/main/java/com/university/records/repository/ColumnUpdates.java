package com.university.records.repository;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// only the columns given a non-null value are written
class ColumnUpdates {
    private final Map<String, Object> columns = new LinkedHashMap<>();

    ColumnUpdates set(String column, Object value) {
        if (value != null) {
            columns.put(column, value);
        }
        return this;
    }

    int apply(JdbcTemplate jdbcTemplate, String table, String where, Object... whereArgs) {
        if (columns.isEmpty()) return 0;
        String setClause = String.join(", ", columns.keySet().stream().map(c -> c + " = ?").toList());
        List<Object> args = new ArrayList<>(columns.values());
        args.addAll(List.of(whereArgs));
        return jdbcTemplate.update("UPDATE " + table + " SET " + setClause + " WHERE " + where, args.toArray());
    }
}
