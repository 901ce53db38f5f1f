package checkin.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * A daily wall-clock check-in time ({@code HH:MM}, no date).
 *
 * <p>Parsed once when a user's schedule is loaded; the scheduler never touches the raw string again.
 *
 * @param hour   hour of day, 0-23
 * @param minute minute of hour, 0-59
 */
public record CheckinTime(int hour, int minute) implements Comparable<CheckinTime> {

    public CheckinTime {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be in [0, 23], got: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be in [0, 59], got: " + minute);
        }
    }

    /**
     * Parses {@code H:MM} or {@code HH:MM}.
     *
     * @param value the time string
     * @return the parsed time
     * @throws IllegalArgumentException if the value is not a valid time of day
     */
    public static CheckinTime parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("check-in time cannot be null");
        }
        String trimmed = value.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 1 || colon > 2 || trimmed.length() != colon + 3) {
            throw new IllegalArgumentException("Invalid check-in time: '" + value + "', expected HH:MM");
        }
        try {
            int hour = Integer.parseInt(trimmed.substring(0, colon));
            int minute = Integer.parseInt(trimmed.substring(colon + 1));
            return new CheckinTime(hour, minute);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid check-in time: '" + value + "', expected HH:MM", e);
        }
    }

    public static CheckinTime of(LocalTime time) {
        return new CheckinTime(time.getHour(), time.getMinute());
    }

    /**
     * Returns the instant this time of day falls on for the given date in the given zone.
     */
    public Instant atDate(LocalDate date, ZoneId zone) {
        return date.atTime(hour, minute).atZone(zone).toInstant();
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }

    @Override
    public int compareTo(CheckinTime other) {
        return Integer.compare(hour * 60 + minute, other.hour * 60 + other.minute);
    }

    @Override
    public String toString() {
        return String.format("%02d:%02d", hour, minute);
    }
}
