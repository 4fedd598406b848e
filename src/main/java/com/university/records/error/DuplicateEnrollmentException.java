package com.university.records.error;

import com.university.records.domain.EnrollmentKey;

public class DuplicateEnrollmentException extends RecordsException {
    public DuplicateEnrollmentException(EnrollmentKey key) {
        super(ErrorKind.DUPLICATE_ENROLLMENT, "Student " + key.studentId() + " is already enrolled in section " + key.section() + ".");
    }
}
