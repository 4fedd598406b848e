package com.university.records.domain;

import com.university.records.error.InvalidEmailException;

import java.util.regex.Pattern;

public record Email(String value) {
    private static final Pattern SHAPE = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");

    public Email {
        if (value == null || !SHAPE.matcher(value).matches()) {
            throw new InvalidEmailException(value);
        }
    }

    public static Email of(String raw) {
        return new Email(raw == null ? null : raw.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
