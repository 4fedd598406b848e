package com.university.records.domain;

import com.university.records.error.IncorrectValueException;

public record EnrollmentKey(long studentId, SectionKey section) {
    public EnrollmentKey {
        if (section == null) {
            throw new IncorrectValueException("section", null);
        }
    }

    public static EnrollmentKey of(long studentId, String courseId, String sectionId, String semester, int year) {
        return new EnrollmentKey(studentId, SectionKey.of(courseId, sectionId, semester, year));
    }

    @Override
    public String toString() {
        return studentId + "-" + section;
    }
}
