package com.university.records.prerequisite;

import com.university.records.domain.DomainModels.Prerequisite;
import com.university.records.prerequisite.PrerequisiteModels.Eligibility;
import com.university.records.repository.EnrollmentJdbcRepository;
import com.university.records.repository.PrerequisiteJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// direct prerequisites only; the edge set is never walked past one hop for eligibility
@Service
public class PrerequisiteResolver {
    private final PrerequisiteJdbcRepository prerequisites;
    private final EnrollmentJdbcRepository enrollments;

    public PrerequisiteResolver(PrerequisiteJdbcRepository prerequisites, EnrollmentJdbcRepository enrollments) {
        this.prerequisites = prerequisites;
        this.enrollments = enrollments;
    }

    public boolean isEligible(long studentId, String courseId) {
        return explain(studentId, courseId).eligible();
    }

    public Eligibility explain(long studentId, String courseId) {
        List<String> required = prerequisites.loadDirectPrerequisiteIds(courseId);
        if (required.isEmpty()) {
            return new Eligibility(studentId, courseId, true, List.of());
        }
        Set<String> passed = enrollments.loadPassedCourseIds(studentId);
        List<String> missing = required.stream()
                .filter(req -> !passed.contains(req))
                .distinct()
                .sorted()
                .toList();
        return new Eligibility(studentId, courseId, missing.isEmpty(), missing);
    }

    public boolean wouldCreateCycle(String courseId, String prerequisiteId) {
        if (courseId.equals(prerequisiteId)) return true;

        Map<String, List<String>> adj = new HashMap<>();
        for (Prerequisite edge : prerequisites.loadAllEdges()) {
            adj.computeIfAbsent(edge.courseId(), k -> new ArrayList<>()).add(edge.prerequisiteId());
        }
        adj.computeIfAbsent(courseId, k -> new ArrayList<>()).add(prerequisiteId);

        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        return hasCycle(courseId, adj, visiting, visited);
    }

    private boolean hasCycle(String node, Map<String, List<String>> adj, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        for (String next : adj.getOrDefault(node, List.of())) {
            if (hasCycle(next, adj, visiting, visited)) return true;
        }
        visiting.remove(node);
        visited.add(node);
        return false;
    }
}
