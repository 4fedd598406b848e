package com.university.records.api;

import com.university.records.advising.AdvisingService;
import com.university.records.domain.DomainModels.Advisor;
import com.university.records.domain.DomainModels.AdvisorHistoryEntry;
import com.university.records.domain.IsoDates;
import com.university.records.error.RecordNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/advisors")
public class AdvisingController {
    private final AdvisingService advisingService;

    public AdvisingController(AdvisingService advisingService) {
        this.advisingService = advisingService;
    }

    @PutMapping("/{studentId}")
    public ResponseEntity<Advisor> assign(@PathVariable long studentId, @RequestBody AssignRequest request) {
        return ResponseEntity.ok(advisingService.assignAdvisor(
                studentId, request.instructorId(), IsoDates.parseNullable(request.startDate())));
    }

    @PatchMapping("/{studentId}")
    public ResponseEntity<Advisor> update(@PathVariable long studentId, @RequestBody UpdateRequest request) {
        return ResponseEntity.ok(advisingService.updateAdvisor(
                studentId, request.instructorId(), IsoDates.parseNullable(request.endDate())));
    }

    @GetMapping("/{studentId}")
    public ResponseEntity<Advisor> current(@PathVariable long studentId) {
        return ResponseEntity.ok(advisingService.currentAdvisor(studentId)
                .orElseThrow(() -> new RecordNotFoundException("Advisor", studentId)));
    }

    @GetMapping("/{studentId}/history")
    public ResponseEntity<List<AdvisorHistoryEntry>> history(@PathVariable long studentId) {
        return ResponseEntity.ok(advisingService.advisorHistory(studentId));
    }

    public record AssignRequest(long instructorId, String startDate) {}

    public record UpdateRequest(long instructorId, String endDate) {}
}
