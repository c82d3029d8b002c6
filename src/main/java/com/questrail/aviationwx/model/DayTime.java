package com.questrail.aviationwx.model;

/**
 * A UTC day-of-month / hour / minute triple as carried by report time groups.
 *
 * <p>No month or year is attached: the encodings only carry the day of the
 * month. Day arithmetic is therefore opaque digit arithmetic. An end-of-day
 * hour {@code 24} normalises to hour {@code 0} of the following day number,
 * which may yield day {@code 32}; that value is kept as a plain day number and
 * no calendar rollover is inferred.</p>
 *
 * @param day    day of month, 1–32
 * @param hour   hour, 0–23
 * @param minute minute, 0–59
 */
public record DayTime(int day, int hour, int minute)
{
    /** Highest representable day number (day 31 followed by an hour-24 rollover). */
    public static final int MAX_DAY = 32;

    public DayTime {
        if (day < 1 || day > MAX_DAY) {
            throw new IllegalArgumentException("day must be in range 1–" + MAX_DAY + " (was " + day + ")");
        }
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be in range 0–23 (was " + hour + ")");
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be in range 0–59 (was " + minute + ")");
        }
    }

    /**
     * Creates a whole-hour value.
     */
    public static DayTime of(int day, int hour) {
        return new DayTime(day, hour, 0);
    }

    /**
     * Position of this value on an absolute day x 24-hour timeline, in minutes.
     */
    public int minuteOfTimeline() {
        return (day * 24 + hour) * 60 + minute;
    }

    /**
     * Returns {@code true} if both values carry the same day number.
     */
    public boolean sameDay(DayTime other) {
        return day == other.day;
    }
}
