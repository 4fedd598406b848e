package com.university.records.domain;

import com.university.records.error.IncorrectValueException;

import java.util.Arrays;

public enum Semester {
    FALL("Fall"),
    WINTER("Winter"),
    SPRING("Spring"),
    SUMMER("Summer");

    private final String label;

    Semester(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Semester of(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IncorrectValueException("semester", label));
    }

    @Override
    public String toString() {
        return label;
    }
}
