package com.university.records.domain;

import com.university.records.error.IncorrectTimeslotException;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// weekly meeting pattern such as MWF 10:00-11:00
public record TimeSlot(String days, LocalTime start, LocalTime end) {
    private static final String DAY_CODES = "(?:Th|Tu|Sa|Su|M|T|W|R|F|S)+";
    private static final String HHMM = "([01]?\\d|2[0-3]):([0-5]\\d)";
    private static final Pattern SHAPE = Pattern.compile("^(" + DAY_CODES + ") " + HHMM + "-" + HHMM + "$");

    public static TimeSlot parse(String raw) {
        if (raw == null) {
            throw new IncorrectTimeslotException(null);
        }
        Matcher m = SHAPE.matcher(raw.trim());
        if (!m.matches()) {
            throw new IncorrectTimeslotException(raw);
        }
        LocalTime start = LocalTime.of(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        LocalTime end = LocalTime.of(Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)));
        if (!start.isBefore(end)) {
            throw new IncorrectTimeslotException(raw);
        }
        return new TimeSlot(m.group(1), start, end);
    }

    @Override
    public String toString() {
        return days + " " + start + "-" + end;
    }
}
