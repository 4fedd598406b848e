package com.university.records.error;

public enum ErrorKind {
    RECORD_NOT_FOUND,
    DUPLICATE_ENROLLMENT,
    CAPACITY_EXCEEDED,
    PREREQUISITE_NOT_MET,
    INVALID_EMAIL,
    UNSUPPORTED_DATE_FORMAT,
    INCORRECT_TIMESLOT,
    INCORRECT_VALUE,
    DATABASE_ERROR
}
