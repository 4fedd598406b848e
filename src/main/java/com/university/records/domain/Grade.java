package com.university.records.domain;

import com.university.records.error.IncorrectValueException;

import java.util.Arrays;

public enum Grade {
    A_PLUS("A+", 4.0),
    A("A", 4.0),
    A_MINUS("A-", 3.7),
    B_PLUS("B+", 3.3),
    B("B", 3.0),
    B_MINUS("B-", 2.7),
    C_PLUS("C+", 2.3),
    C("C", 2.0),
    C_MINUS("C-", 1.7),
    D_PLUS("D+", 1.3),
    D("D", 1.0),
    F("F", 0.0);

    private final String symbol;
    private final double points;

    Grade(String symbol, double points) {
        this.symbol = symbol;
        this.points = points;
    }

    public String symbol() {
        return symbol;
    }

    public double points() {
        return points;
    }

    public boolean passing() {
        return this != F;
    }

    public static Grade of(String symbol) {
        return Arrays.stream(values())
                .filter(g -> g.symbol.equals(symbol))
                .findFirst()
                .orElseThrow(() -> new IncorrectValueException("grade", symbol));
    }

    /** Stored grades may be absent while a course is in progress. */
    public static Grade ofNullable(String symbol) {
        return symbol == null ? null : of(symbol);
    }
}
