package com.university.records.error;

public class RecordNotFoundException extends RecordsException {
    private final String recordType;

    public RecordNotFoundException(String recordType, Object identifier) {
        super(ErrorKind.RECORD_NOT_FOUND, recordType + " with identifier '" + identifier + "' not found.");
        this.recordType = recordType;
    }

    public String recordType() {
        return recordType;
    }
}
