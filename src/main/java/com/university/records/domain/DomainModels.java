package com.university.records.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public class DomainModels {
    public record Department(String name, String phone, BigDecimal budget, String building, String dean) {}

    public record Student(long id, String firstName, String lastName, String deptName, String major,
                          int totalCredits, Email email, LocalDate enrollmentDate, StudentStatus status) {}

    public record Instructor(long id, String firstName, String lastName, String deptName, AcademicRank rank,
                             BigDecimal salary, Email email, LocalDate hireDate, String office) {}

    public record Course(String id, String title, int credits, String deptName, String description) {}

    /** {@code prerequisiteId} is null once the prerequisite course has been deleted. */
    public record Prerequisite(String courseId, String prerequisiteId) {
        public boolean dangling() {
            return prerequisiteId == null;
        }
    }

    public record Section(SectionKey key, TimeSlot timeSlot, String room, int capacity, int enrolled) {
        public int openSeats() {
            return capacity - enrolled;
        }
    }

    public record Enrollment(EnrollmentKey key, boolean cancelled, Grade grade, LocalDate enrollmentDate) {
        public boolean active() {
            return !cancelled;
        }
    }

    public record Teaching(long instructorId, SectionKey section) {}

    public record Advisor(long studentId, Long instructorId, LocalDate startDate, LocalDate endDate) {}

    public record AdvisorHistoryEntry(long studentId, Long instructorId, LocalDate startDate, LocalDate endDate,
                                      Instant replacedAt) {}

    public record TranscriptEntry(String courseId, String title, int credits, Semester semester, int year,
                                  Grade grade, LocalDate enrollmentDate) {}

    public record WorkloadEntry(String courseId, String sectionId, TimeSlot timeSlot, String room) {}

    public record GpaSummary(long studentId, double gpa, int gradedCredits, int gradedCourses) {}

    // Inputs for creation; identifiers generated by the store are absent.

    public record NewStudent(String firstName, String lastName, String deptName, Email email,
                             int totalCredits, String major, LocalDate enrollmentDate) {}

    public record NewInstructor(String firstName, String lastName, String deptName, Email email,
                                AcademicRank rank, BigDecimal salary, LocalDate hireDate, String office) {}

    public record NewSection(SectionKey key, TimeSlot timeSlot, String room, int capacity) {}

    // Partial updates; a null component leaves the stored column unchanged.

    public record DepartmentChanges(String phone, BigDecimal budget, String building, String dean) {}

    public record StudentChanges(String firstName, String lastName, String deptName, String major,
                                 Integer totalCredits, Email email, LocalDate enrollmentDate, StudentStatus status) {}

    public record InstructorChanges(String firstName, String lastName, String deptName, AcademicRank rank,
                                    BigDecimal salary, Email email, LocalDate hireDate, String office) {}

    public record CourseChanges(String title, Integer credits, String deptName, String description) {}

    public record SectionChanges(TimeSlot timeSlot, String room, Integer capacity) {}
}
