package com.university.records.prerequisite;

import java.util.List;

public class PrerequisiteModels {
    public record Eligibility(long studentId, String courseId, boolean eligible, List<String> missingPrerequisites) {}
}
