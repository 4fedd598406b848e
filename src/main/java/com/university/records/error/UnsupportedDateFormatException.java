package com.university.records.error;

public class UnsupportedDateFormatException extends RecordsException {
    public UnsupportedDateFormatException(String date) {
        super(ErrorKind.UNSUPPORTED_DATE_FORMAT, "Date '" + date + "' is not in YYYY-MM-DD format or is invalid.");
    }
}
