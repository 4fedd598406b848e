package com.university.records.error;

public class DatabaseException extends RecordsException {
    public DatabaseException(String message) {
        super(ErrorKind.DATABASE_ERROR, message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(ErrorKind.DATABASE_ERROR, message, cause);
    }
}
