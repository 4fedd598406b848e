package com.university.records.domain;

import com.university.records.error.IncorrectValueException;

public record AcademicYear(int value) {
    public AcademicYear {
        if (value <= 1701 || value >= 2100) {
            throw new IncorrectValueException("academic_year", value);
        }
    }

    public static AcademicYear of(int value) {
        return new AcademicYear(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
