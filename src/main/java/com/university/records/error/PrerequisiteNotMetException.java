package com.university.records.error;

import java.util.List;

public class PrerequisiteNotMetException extends RecordsException {
    private final List<String> missingPrerequisites;

    public PrerequisiteNotMetException(long studentId, String courseId, List<String> missingPrerequisites) {
        super(ErrorKind.PREREQUISITE_NOT_MET,
                "Student " + studentId + " has not passed the prerequisites of " + courseId + ": " + String.join(", ", missingPrerequisites));
        this.missingPrerequisites = List.copyOf(missingPrerequisites);
    }

    public List<String> missingPrerequisites() {
        return missingPrerequisites;
    }
}
