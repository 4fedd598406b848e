package com.university.records.validation;

import com.university.records.domain.AcademicRank;
import com.university.records.domain.AcademicYear;
import com.university.records.domain.Email;
import com.university.records.domain.Grade;
import com.university.records.domain.IsoDates;
import com.university.records.domain.Semester;
import com.university.records.domain.StudentStatus;
import com.university.records.domain.TimeSlot;
import com.university.records.error.IncorrectValueException;

import java.math.BigDecimal;
import java.time.LocalDate;

public final class FieldValidators {
    private FieldValidators() {}

    public static Email email(String raw) {
        return Email.of(raw);
    }

    public static LocalDate date(String raw) {
        return IsoDates.parse(raw);
    }

    public static TimeSlot timeSlot(String raw) {
        return TimeSlot.parse(raw);
    }

    public static Grade grade(String raw) {
        return Grade.of(raw);
    }

    public static Semester semester(String raw) {
        return Semester.of(raw);
    }

    public static AcademicYear academicYear(int raw) {
        return AcademicYear.of(raw);
    }

    public static AcademicRank rank(String raw) {
        return AcademicRank.of(raw);
    }

    public static StudentStatus status(String raw) {
        return StudentStatus.of(raw);
    }

    public static int credits(int credits) {
        if (credits < 1 || credits > 4) {
            throw new IncorrectValueException("credit", credits);
        }
        return credits;
    }

    public static int capacity(int capacity) {
        if (capacity <= 0) {
            throw new IncorrectValueException("capacity", capacity);
        }
        return capacity;
    }

    public static int totalCredits(int totalCredits) {
        if (totalCredits < 0) {
            throw new IncorrectValueException("tot_cred", totalCredits);
        }
        return totalCredits;
    }

    public static BigDecimal nonNegativeAmount(String field, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IncorrectValueException(field, amount);
        }
        return amount;
    }

    public static String required(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IncorrectValueException(field, value);
        }
        return value.trim();
    }
}
