package com.university.records.domain;

import com.university.records.error.IncorrectValueException;

import java.util.Arrays;

public enum AcademicRank {
    ASSISTANT_PROFESSOR("Assistant Professor"),
    ASSOCIATE_PROFESSOR("Associate Professor"),
    PROFESSOR("Professor"),
    LECTURER("Lecturer"),
    ADJUNCT("Adjunct");

    private final String label;

    AcademicRank(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AcademicRank of(String label) {
        return Arrays.stream(values())
                .filter(r -> r.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IncorrectValueException("academic rank", label));
    }
}
