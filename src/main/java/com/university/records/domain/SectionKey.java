package com.university.records.domain;

import com.university.records.error.IncorrectValueException;

public record SectionKey(String courseId, String sectionId, Semester semester, AcademicYear year) {
    public SectionKey {
        if (courseId == null || courseId.isBlank()) {
            throw new IncorrectValueException("course_id", courseId);
        }
        if (sectionId == null || sectionId.isBlank()) {
            throw new IncorrectValueException("sec_id", sectionId);
        }
        if (semester == null) {
            throw new IncorrectValueException("semester", null);
        }
        if (year == null) {
            throw new IncorrectValueException("academic_year", null);
        }
    }

    public static SectionKey of(String courseId, String sectionId, String semester, int year) {
        return new SectionKey(courseId, sectionId, Semester.of(semester), AcademicYear.of(year));
    }

    @Override
    public String toString() {
        return courseId + "-" + sectionId + "-" + semester.label() + "-" + year.value();
    }
}
