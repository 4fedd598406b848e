package com.university.records.error;

public class IncorrectValueException extends RecordsException {
    private final String field;

    public IncorrectValueException(String field, Object value) {
        super(ErrorKind.INCORRECT_VALUE, "The value '" + value + "' for field '" + field + "' is not valid.");
        this.field = field;
    }

    public IncorrectValueException(String field, Object value, String reason) {
        super(ErrorKind.INCORRECT_VALUE, "The value '" + value + "' for field '" + field + "' is not valid: " + reason);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
