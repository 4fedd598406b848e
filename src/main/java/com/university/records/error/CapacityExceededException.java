package com.university.records.error;

import com.university.records.domain.SectionKey;

public class CapacityExceededException extends RecordsException {
    public CapacityExceededException(SectionKey section, int capacity) {
        super(ErrorKind.CAPACITY_EXCEEDED, "Section " + section + " is full (capacity " + capacity + ").");
    }

    public CapacityExceededException(SectionKey section, Throwable cause) {
        super(ErrorKind.CAPACITY_EXCEEDED, "Section " + section + " is full.", cause);
    }
}
