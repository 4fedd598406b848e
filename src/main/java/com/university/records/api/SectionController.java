package com.university.records.api;

import com.university.records.domain.DomainModels.Enrollment;
import com.university.records.domain.DomainModels.Teaching;
import com.university.records.domain.SectionKey;
import com.university.records.enrollment.EnrollmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sections")
public class SectionController {
    private final EnrollmentService enrollmentService;

    public SectionController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @PutMapping("/instructor")
    public ResponseEntity<List<Teaching>> assignInstructor(@RequestBody InstructorAssignment request) {
        SectionKey key = request.section();
        enrollmentService.assignInstructor(request.instructorId(), key);
        return ResponseEntity.ok(enrollmentService.instructorsOf(key));
    }

    @DeleteMapping("/instructor")
    public ResponseEntity<Void> unassignInstructor(@RequestParam long instructorId,
                                                   @RequestParam String courseId,
                                                   @RequestParam String sectionId,
                                                   @RequestParam String semester,
                                                   @RequestParam int year) {
        enrollmentService.unassignInstructor(instructorId, SectionKey.of(courseId, sectionId, semester, year));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/roster")
    public ResponseEntity<List<Enrollment>> roster(@RequestParam String courseId,
                                                   @RequestParam String sectionId,
                                                   @RequestParam String semester,
                                                   @RequestParam int year) {
        return ResponseEntity.ok(enrollmentService.roster(SectionKey.of(courseId, sectionId, semester, year)));
    }

    public record InstructorAssignment(long instructorId, String courseId, String sectionId, String semester, int year) {
        SectionKey section() {
            return SectionKey.of(courseId, sectionId, semester, year);
        }
    }
}
