package com.university.records.api;

import com.university.records.domain.DomainModels.GpaSummary;
import com.university.records.domain.DomainModels.TranscriptEntry;
import com.university.records.grades.GradeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/students")
public class StudentController {
    private final GradeService gradeService;

    public StudentController(GradeService gradeService) {
        this.gradeService = gradeService;
    }

    @GetMapping("/{id}/gpa")
    public ResponseEntity<GpaSummary> gpa(@PathVariable long id) {
        return ResponseEntity.ok(gradeService.calculateGpa(id));
    }

    @GetMapping("/{id}/transcript")
    public ResponseEntity<List<TranscriptEntry>> transcript(@PathVariable long id) {
        return ResponseEntity.ok(gradeService.transcript(id));
    }
}
