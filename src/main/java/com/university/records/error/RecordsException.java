package com.university.records.error;

/**
 * Base of all domain failures. Unchecked so that a throw inside a transaction callback rolls the transaction back.
 */
public abstract class RecordsException extends RuntimeException {
    private final ErrorKind kind;

    protected RecordsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RecordsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
