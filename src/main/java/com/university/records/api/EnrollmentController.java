package com.university.records.api;

import com.university.records.domain.DomainModels.Enrollment;
import com.university.records.domain.EnrollmentKey;
import com.university.records.enrollment.EnrollmentService;
import com.university.records.validation.FieldValidators;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/enrollments")
public class EnrollmentController {
    private final EnrollmentService enrollmentService;

    public EnrollmentController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @PostMapping
    public ResponseEntity<Enrollment> enroll(@RequestBody EnrollmentRequest request) {
        return ResponseEntity.ok(enrollmentService.enroll(request.key()));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Void> cancel(@RequestBody EnrollmentRequest request) {
        enrollmentService.cancelEnrollment(request.key());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/grade")
    public ResponseEntity<Enrollment> grade(@RequestBody GradeRequest request) {
        return ResponseEntity.ok(enrollmentService.assignGrade(
                EnrollmentKey.of(request.studentId(), request.courseId(), request.sectionId(), request.semester(), request.year()),
                FieldValidators.grade(request.grade())));
    }

    public record EnrollmentRequest(long studentId, String courseId, String sectionId, String semester, int year) {
        EnrollmentKey key() {
            return EnrollmentKey.of(studentId, courseId, sectionId, semester, year);
        }
    }

    public record GradeRequest(long studentId, String courseId, String sectionId, String semester, int year,
                               String grade) {}
}
