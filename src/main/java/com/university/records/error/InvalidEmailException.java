package com.university.records.error;

public class InvalidEmailException extends RecordsException {
    public InvalidEmailException(String email) {
        super(ErrorKind.INVALID_EMAIL, "Email '" + email + "' is not a valid address.");
    }
}
