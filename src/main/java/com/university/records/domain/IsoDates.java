package com.university.records.domain;

import com.university.records.error.UnsupportedDateFormatException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

public final class IsoDates {
    private static final Pattern SHAPE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private IsoDates() {}

    public static LocalDate parse(String raw) {
        if (raw == null || !SHAPE.matcher(raw).matches()) {
            throw new UnsupportedDateFormatException(raw);
        }
        try {
            return LocalDate.parse(raw, FORMAT);
        } catch (DateTimeParseException e) {
            throw new UnsupportedDateFormatException(raw);
        }
    }

    public static LocalDate parseNullable(String raw) {
        return raw == null ? null : parse(raw);
    }
}
