package com.university.records.error;

public class IncorrectTimeslotException extends RecordsException {
    public IncorrectTimeslotException(String slot) {
        super(ErrorKind.INCORRECT_TIMESLOT,
                "Timeslot '" + slot + "' is not of correct format. Example of an acceptable timeslot: TTh 14:00-15:15");
    }
}
