package com.university.records.domain;

import com.university.records.error.IncorrectValueException;

import java.util.Arrays;

public enum StudentStatus {
    ACTIVE("Active"),
    INACTIVE("Inactive"),
    GRADUATED("Graduated"),
    SUSPENDED("Suspended");

    private final String label;

    StudentStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StudentStatus of(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IncorrectValueException("status", label));
    }
}
